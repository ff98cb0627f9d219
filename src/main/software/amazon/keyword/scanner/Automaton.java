package software.amazon.keyword.scanner;

import software.amazon.keyword.scanner.input.Alphabet;

import javax.annotation.concurrent.Immutable;
import java.util.Arrays;

import static software.amazon.keyword.scanner.TransitionMap.NO_STATE;

/**
 * A built Aho-Corasick automaton. States live in an arena and are addressed by index; the root is state 0.
 * Transitions, fail links and outputs are indexes into the same arena, so root self-loops and backward fail links
 * create no ownership cycles.
 *
 * Nothing mutates an Automaton once AutomatonBuilder hands it out, so any number of threads may step through it.
 */
@Immutable
final class Automaton {

    static final int ROOT = 0;

    private final Alphabet alphabet;
    private final TransitionMap[] transitions;

    // fail[ROOT] is NO_STATE and never followed
    private final int[] fail;

    // own pattern ids first, then the fail target's outputs, flattened
    private final int[][] outputs;

    Automaton(final Alphabet alphabet, final TransitionMap[] transitions, final int[] fail, final int[][] outputs) {
        this.alphabet = alphabet;
        this.transitions = transitions;
        this.fail = fail;
        this.outputs = outputs;
    }

    Alphabet getAlphabet() {
        return alphabet;
    }

    int stateCount() {
        return transitions.length;
    }

    /**
     * @return the direct transition target of {@code state} on {@code symbol}, or NO_STATE
     */
    int transition(final int state, final char symbol) {
        return transitions[state].get(symbol);
    }

    char[] symbolsOf(final int state) {
        return transitions[state].symbols();
    }

    int fail(final int state) {
        return fail[state];
    }

    /**
     * The flattened outputs of a state. The returned array is shared; callers must not modify it.
     */
    int[] outputs(final int state) {
        return outputs[state];
    }

    /**
     * Moves from {@code state} on {@code symbol}, following fail links until a transition exists. The chase ends at
     * the root at the latest because the root has a transition on every alphabet symbol.
     *
     * @param state the state the cursor is in
     * @param symbol a symbol of the alphabet
     * @return the state the cursor moves to
     * @throws IllegalArgumentException if {@code symbol} is not part of the alphabet
     */
    int step(int state, final char symbol) {
        int next;
        while ((next = transitions[state].get(symbol)) == NO_STATE) {
            if (state == ROOT) {
                throw new IllegalArgumentException("Symbol '" + symbol + "' is not in " + alphabet);
            }
            state = fail[state];
        }
        return next;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Automaton{").append(alphabet);
        for (int state = 0; state < transitions.length; state++) {
            sb.append("\n  ").append(state)
                    .append(" go=").append(transitions[state])
                    .append(" fail=").append(fail[state])
                    .append(" out=").append(Arrays.toString(outputs[state]));
        }
        return sb.append("\n}").toString();
    }
}
