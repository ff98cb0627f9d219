package software.amazon.keyword.scanner.input;

import java.util.Objects;

/**
 * Turns raw strings into symbol sequences. Patterns go through {@link #normalizeForIngestion}, which may grow the
 * vocabulary; query text goes through {@link #normalizeForQuery}, which only filters against the frozen alphabet.
 *
 * Both modes fold case and collapse a run of spaces into a single space. No other repeated character is collapsed,
 * since patterns such as "book" depend on doubled letters.
 */
public final class Normalizer {

    static final char SPACE = ' ';

    private Normalizer() { }

    public static char fold(final char c) {
        return Character.toLowerCase(c);
    }

    /**
     * Normalize a dictionary pattern.
     *
     * @param raw the pattern as supplied by the caller
     * @param vocabulary the vocabulary being built; unseen symbols are added to it when growth is allowed
     * @param growVocabulary false to drop unseen symbols instead of registering them
     * @return the symbol sequence, possibly empty
     */
    public static String normalizeForIngestion(final String raw, final Vocabulary vocabulary,
                                               final boolean growVocabulary) {
        Objects.requireNonNull(raw, "pattern");
        if (raw.isEmpty()) {
            return "";
        }

        final StringBuilder out = new StringBuilder(raw.length());
        boolean previousWasSpace = false;
        for (int i = 0; i < raw.length(); i++) {
            final char symbol = fold(raw.charAt(i));
            final boolean collapse = symbol == SPACE && previousWasSpace;
            previousWasSpace = symbol == SPACE;

            if (!growVocabulary && !vocabulary.contains(symbol)) {
                continue;
            }
            if (collapse) {
                continue;
            }
            vocabulary.add(symbol);
            out.append(symbol);
        }
        return out.toString();
    }

    /**
     * Normalize query text. Characters outside the alphabet vanish, unless {@code rejectUnsupported} is set.
     *
     * @param raw the text to scan
     * @param alphabet the automaton's frozen alphabet
     * @param rejectUnsupported true to throw on a character outside the alphabet instead of dropping it
     * @return the symbol sequence, possibly empty
     * @throws UnsupportedSymbolException if rejecting and the text holds a character outside the alphabet
     */
    public static String normalizeForQuery(final String raw, final Alphabet alphabet,
                                           final boolean rejectUnsupported) {
        Objects.requireNonNull(raw, "text");
        if (raw.isEmpty()) {
            return "";
        }

        final SymbolFilter filter = new SymbolFilter(alphabet, rejectUnsupported);
        final StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final int symbol = filter.accept(raw.charAt(i));
            if (symbol != SymbolFilter.DROPPED) {
                out.append((char) symbol);
            }
        }
        return out.toString();
    }
}
