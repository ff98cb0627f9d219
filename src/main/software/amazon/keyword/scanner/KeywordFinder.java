package software.amazon.keyword.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import software.amazon.keyword.scanner.input.Normalizer;

import java.util.List;

/**
 * Scans a whole text against an automaton in one pass.
 */
class KeywordFinder {

    private KeywordFinder() { }

    /**
     * Return the ids of every pattern ending at every position of the text.
     *
     * @param text the raw query text
     * @param automaton the built automaton
     * @param rejectUnsupported true to fail on characters outside the alphabet instead of dropping them
     * @return pattern ids in text order; for one position, own outputs before inherited. May be empty, never null.
     */
    static List<Integer> scan(final String text, final Automaton automaton, final boolean rejectUnsupported) {
        final String symbols = Normalizer.normalizeForQuery(text, automaton.getAlphabet(), rejectUnsupported);
        final IntArrayList result = new IntArrayList();

        // the cursor exists only for this call
        int state = Automaton.ROOT;
        for (int i = 0; i < symbols.length(); i++) {
            state = automaton.step(state, symbols.charAt(i));
            final int[] outputs = automaton.outputs(state);
            if (outputs.length > 0) {
                result.addElements(result.size(), outputs);
            }
        }
        return result;
    }
}
