package software.amazon.keyword.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLists;
import software.amazon.keyword.scanner.input.SymbolFilter;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

/**
 * A streaming matcher. Feed it the characters of a text one at a time, or in chunks, and it reports the patterns that
 * end at each one. Normalization is applied as the characters arrive, with the same result as scanning the whole
 * text at once.
 *
 * A cursor belongs to one thread; obtain one per thread from {@link KeywordMachine#cursor()}. It only reads the
 * automaton, so any number of cursors may run against the same machine.
 */
@NotThreadSafe
public final class Cursor {

    private final Automaton automaton;
    private final SymbolFilter filter;
    private int state = Automaton.ROOT;

    Cursor(final Automaton automaton, final boolean rejectUnsupported) {
        this.automaton = automaton;
        this.filter = new SymbolFilter(automaton.getAlphabet(), rejectUnsupported);
    }

    /**
     * Consume one raw character.
     *
     * @param c the next character of the text
     * @return ids of the patterns ending at this character, own before inherited. Empty if the character was dropped
     * or nothing ends here.
     */
    public List<Integer> feed(final char c) {
        if (!advance(c)) {
            return IntLists.emptyList();
        }
        return IntArrayList.wrap(automaton.outputs(state).clone());
    }

    /**
     * Consume a chunk of text.
     *
     * @param text the next characters of the text
     * @return ids of the patterns ending anywhere in this chunk, in text order
     */
    public List<Integer> feed(final CharSequence text) {
        final IntArrayList result = new IntArrayList();
        for (int i = 0; i < text.length(); i++) {
            if (advance(text.charAt(i))) {
                final int[] outputs = automaton.outputs(state);
                result.addElements(result.size(), outputs);
            }
        }
        return result;
    }

    /**
     * Return to the root, forgetting everything fed so far.
     */
    public void reset() {
        state = Automaton.ROOT;
        filter.reset();
    }

    int getState() {
        return state;
    }

    // false if the character produced no symbol
    private boolean advance(final char c) {
        final int symbol = filter.accept(c);
        if (symbol == SymbolFilter.DROPPED) {
            return false;
        }
        state = automaton.step(state, (char) symbol);
        return true;
    }
}
