package software.amazon.keyword.scanner;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An open-addressing map from symbol to target state index, one per automaton state. Symbols are {@code char}s and
 * state indexes are non-negative, so both fit in one {@code long} cell.
 */
class TransitionMap {

    // taken from FastUtil
    private static final int INT_PHI = 0x9E3779B9;

    private static final long KEY_MASK = 0xFFFFFFFFL;

    // no char maps to 0xFFFFFFFF, so an empty cell can never collide with a stored symbol
    private static final long EMPTY_CELL = -1 & KEY_MASK;

    static final int NO_STATE = -1;
    private static final float LOAD_FACTOR = 0.75f;

    /**
     * Most trie states have a single outgoing transition; 4 cells keep them small while the root, which carries a
     * transition for every alphabet symbol, grows by rehashing.
     */
    private static final int DEFAULT_INITIAL_CAPACITY = 4;

    /**
     * Low 32 bits hold the symbol, high 32 bits hold the target state. Length is always a power of two.
     */
    private long[] table;

    private int threshold;

    private int size;

    private int mask;

    TransitionMap() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    TransitionMap(final int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        if (Integer.bitCount(initialCapacity) != 1) {
            throw new IllegalArgumentException("initialCapacity must be a power of two");
        }
        this.mask = initialCapacity - 1;
        this.table = makeTable(initialCapacity);
        this.threshold = (int) (initialCapacity * LOAD_FACTOR);
    }

    /**
     * Gets the target state for {@code symbol}.
     *
     * @param symbol the symbol to transition on
     * @return the target state index, or {@link #NO_STATE} if there is no transition on {@code symbol}
     */
    int get(final char symbol) {
        int idx = getStartIndex(symbol);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                return NO_STATE;
            }
            if (((int) (cell & KEY_MASK)) == symbol) {
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    boolean contains(final char symbol) {
        return get(symbol) != NO_STATE;
    }

    /**
     * Sets the transition on {@code symbol} to {@code target}, replacing any previous one.
     *
     * @param symbol the symbol to transition on
     * @param target the non-negative target state index
     * @return the previous target for {@code symbol}, or {@link #NO_STATE} if there was none
     * @throws IllegalArgumentException if {@code target} is negative
     */
    int put(final char symbol, final int target) {
        if (target < 0) {
            throw new IllegalArgumentException("target state cannot be negative");
        }
        long cellToPut = (((long) symbol) & KEY_MASK) | (((long) target) << 32);
        int idx = getStartIndex(symbol);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                table[idx] = cellToPut;
                if (size >= threshold) {
                    rehash(table.length * 2);
                    // 'size' is set inside rehash()
                } else {
                    size++;
                }
                return NO_STATE;
            }
            if (((int) (cell & KEY_MASK)) == symbol) {
                table[idx] = cellToPut;
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    /**
     * The transitions of this map, in table order. Callers that need a stable order must sort.
     */
    Iterable<Transition> transitions() {
        return TransitionIterator::new;
    }

    /**
     * The symbols this map has a transition on, in ascending order.
     */
    char[] symbols() {
        char[] symbols = new char[size];
        int i = 0;
        for (long cell : table) {
            if (cell != EMPTY_CELL) {
                symbols[i++] = (char) (cell & KEY_MASK);
            }
        }
        Arrays.sort(symbols);
        return symbols;
    }

    private void rehash(final int newCapacity) {
        threshold = (int) (newCapacity * LOAD_FACTOR);
        mask = newCapacity - 1;

        final long[] oldTable = table;

        table = makeTable(newCapacity);
        size = 0;

        for (int i = oldTable.length - 1; i >= 0; i--) {
            if (oldTable[i] != EMPTY_CELL) {
                put((char) (oldTable[i] & KEY_MASK), (int) (oldTable[i] >> 32));
            }
        }
    }

    private static long[] makeTable(final int capacity) {
        long[] result = new long[capacity];
        Arrays.fill(result, EMPTY_CELL);
        return result;
    }

    private int getStartIndex(final char symbol) {
        return phiMix(symbol) & mask;
    }

    private int getNextIndex(final int currentIndex) {
        return (currentIndex + 1) & mask;
    }

    private static int phiMix(final int val) {
        final int h = val * INT_PHI;
        return h ^ (h >> 16);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (char symbol : symbols()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append('\'').append(symbol).append("'->").append(get(symbol));
        }
        return sb.append('}').toString();
    }

    static class Transition {
        private final char symbol;
        private final int target;

        private Transition(final char symbol, final int target) {
            this.symbol = symbol;
            this.target = target;
        }

        char getSymbol() {
            return symbol;
        }

        int getTarget() {
            return target;
        }
    }

    private class TransitionIterator implements Iterator<Transition> {

        private static final int NO_NEXT_INDEX = -1;

        private int nextIndex = findNextIndex(0);

        @Override
        public boolean hasNext() {
            return nextIndex != NO_NEXT_INDEX;
        }

        @Override
        public Transition next() {
            if (nextIndex == NO_NEXT_INDEX) {
                throw new NoSuchElementException();
            }
            Transition transition = new Transition((char) (table[nextIndex] & KEY_MASK),
                    (int) (table[nextIndex] >> 32));
            nextIndex = findNextIndex(nextIndex + 1);
            return transition;
        }

        private int findNextIndex(int fromIndex) {
            while (fromIndex < table.length) {
                if (table[fromIndex] != EMPTY_CELL) {
                    return fromIndex;
                }
                fromIndex++;
            }
            return NO_NEXT_INDEX;
        }
    }
}
