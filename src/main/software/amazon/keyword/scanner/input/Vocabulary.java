package software.amazon.keyword.scanner.input;

import it.unimi.dsi.fastutil.chars.CharRBTreeSet;
import it.unimi.dsi.fastutil.chars.CharSortedSet;

import java.util.Collection;

/**
 * The growable set of symbols seen while a dictionary is ingested. Every member is case-folded on insertion. Once
 * ingestion is done, {@link #freeze()} produces the immutable {@link Alphabet} used for matching.
 *
 * Not thread-safe; a vocabulary lives only for the duration of one automaton build.
 */
public class Vocabulary {

    private final CharSortedSet symbols = new CharRBTreeSet();

    public Vocabulary() {
    }

    public Vocabulary(final Collection<Character> seed) {
        for (Character c : seed) {
            add(c);
        }
    }

    /**
     * Adds the case-folded form of the given character.
     *
     * @param c the character to add
     * @return true if the folded symbol was not already present
     */
    public boolean add(final char c) {
        return symbols.add(Normalizer.fold(c));
    }

    /**
     * @param symbol an already case-folded symbol
     * @return true if the symbol is in this vocabulary
     */
    public boolean contains(final char symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public Alphabet freeze() {
        return new Alphabet(symbols.toCharArray());
    }

    @Override
    public String toString() {
        return "Vocabulary" + symbols;
    }
}
