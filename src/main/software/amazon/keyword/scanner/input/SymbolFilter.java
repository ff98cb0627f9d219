package software.amazon.keyword.scanner.input;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Applies query-mode normalization one raw character at a time: case-folds it, drops it if it is outside the
 * alphabet (or rejects it, if so configured) and drops a space that directly follows another space. Keeps the state
 * needed for the space rule between calls, so a text can be normalized in pieces with the same result as in one go.
 */
@NotThreadSafe
public final class SymbolFilter {

    /**
     * Returned by {@link #accept(char)} for a character that does not produce a symbol.
     */
    public static final int DROPPED = -1;

    private final Alphabet alphabet;
    private final boolean rejectUnsupported;

    // The space rule looks at the raw stream, so a dropped character still separates two spaces.
    private boolean previousWasSpace = false;
    private long index = 0;

    public SymbolFilter(final Alphabet alphabet, final boolean rejectUnsupported) {
        this.alphabet = alphabet;
        this.rejectUnsupported = rejectUnsupported;
    }

    /**
     * @param raw the next character of the query text
     * @return the symbol to feed to the automaton, or {@link #DROPPED}
     * @throws UnsupportedSymbolException if the character is outside the alphabet and rejection is configured
     */
    public int accept(final char raw) {
        final char symbol = Normalizer.fold(raw);
        final boolean collapse = symbol == Normalizer.SPACE && previousWasSpace;
        previousWasSpace = symbol == Normalizer.SPACE;
        final long position = index++;

        if (!alphabet.contains(symbol)) {
            if (rejectUnsupported) {
                throw new UnsupportedSymbolException(raw, position);
            }
            return DROPPED;
        }
        return collapse ? DROPPED : symbol;
    }

    public void reset() {
        previousWasSpace = false;
        index = 0;
    }
}
