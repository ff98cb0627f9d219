package software.amazon.keyword.scanner.input;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;

/**
 * The closed, frozen set of symbols an automaton accepts. Query text is filtered against it.
 */
@Immutable
public final class Alphabet {

    private static final Alphabet EMPTY = new Alphabet(new char[0]);

    // sorted, no duplicates
    private final char[] symbols;

    Alphabet(final char[] sortedSymbols) {
        this.symbols = sortedSymbols;
    }

    public static Alphabet empty() {
        return EMPTY;
    }

    /**
     * @param symbol an already case-folded symbol
     * @return true if the symbol belongs to this alphabet
     */
    public boolean contains(final char symbol) {
        return Arrays.binarySearch(symbols, symbol) >= 0;
    }

    public int size() {
        return symbols.length;
    }

    /**
     * @return the symbols of this alphabet in ascending order. The array is a copy.
     */
    public char[] symbols() {
        return symbols.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(symbols, ((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public String toString() {
        return "Alphabet[" + new String(symbols) + "]";
    }
}
