package software.amazon.keyword.scanner.input;

/**
 * A RuntimeException that indicates query text contained a character outside the automaton's alphabet. Only thrown
 * when the machine is configured to reject such text instead of dropping the character.
 */
public class UnsupportedSymbolException extends RuntimeException {

    private final char symbol;
    private final long index;

    public UnsupportedSymbolException(final char symbol, final long index) {
        super(String.format("Character '%s' (U+%04X) at index %d is not in the alphabet", symbol, (int) symbol, index));
        this.symbol = symbol;
        this.index = index;
    }

    public char getSymbol() {
        return symbol;
    }

    public long getIndex() {
        return index;
    }
}
