package software.amazon.keyword.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.keyword.scanner.input.Alphabet;
import software.amazon.keyword.scanner.input.Normalizer;
import software.amazon.keyword.scanner.input.Vocabulary;

import java.util.ArrayList;
import java.util.List;

import static software.amazon.keyword.scanner.Automaton.ROOT;
import static software.amazon.keyword.scanner.TransitionMap.NO_STATE;

/**
 * Builds an Automaton from an ordered pattern list in three passes: trie insertion, root completion and the
 * breadth-first computation of fail links and flattened outputs. A builder is used once and then discarded.
 */
class AutomatonBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonBuilder.class);

    private static final int[] NO_OUTPUTS = new int[0];

    private final Vocabulary vocabulary;
    private final boolean vocabularyGrowth;

    // the arena under construction; index = state
    private final List<TransitionMap> transitions = new ArrayList<>();
    private final List<IntArrayList> ownOutputs = new ArrayList<>();

    AutomatonBuilder(final Vocabulary vocabulary, final boolean vocabularyGrowth) {
        this.vocabulary = vocabulary;
        this.vocabularyGrowth = vocabularyGrowth;
    }

    Automaton build(final List<String> patterns) {
        final int root = newState();
        assert root == ROOT;

        for (int id = 0; id < patterns.size(); id++) {
            insert(Normalizer.normalizeForIngestion(patterns.get(id), vocabulary, vocabularyGrowth), id);
        }

        final Alphabet alphabet = vocabulary.freeze();
        final int selfLoops = completeRoot(alphabet);

        final int stateCount = transitions.size();
        final int[] fail = new int[stateCount];
        final int[][] outputs = new int[stateCount][];
        computeFailureLinks(fail, outputs);

        if (logger.isDebugEnabled()) {
            logger.debug("Built automaton: {} patterns, {} states, {} root self-loops, {}",
                    patterns.size(), stateCount, selfLoops, alphabet);
        }
        return new Automaton(alphabet, transitions.toArray(new TransitionMap[0]), fail, outputs);
    }

    private int newState() {
        transitions.add(new TransitionMap());
        ownOutputs.add(null);
        return transitions.size() - 1;
    }

    // walk the trie along the symbols, growing it where needed, and mark the last state terminal for the pattern
    private void insert(final String symbols, final int patternId) {
        int state = ROOT;
        for (int i = 0; i < symbols.length(); i++) {
            final char symbol = symbols.charAt(i);
            int next = transitions.get(state).get(symbol);
            if (next == NO_STATE) {
                next = newState();
                transitions.get(state).put(symbol, next);
            }
            state = next;
        }

        IntArrayList own = ownOutputs.get(state);
        if (own == null) {
            own = new IntArrayList(1);
            ownOutputs.set(state, own);
        }
        own.add(patternId);
        logger.trace("Pattern {} ends at state {}", patternId, state);
    }

    // every alphabet symbol no pattern starts with loops back to the root
    private int completeRoot(final Alphabet alphabet) {
        final TransitionMap rootTransitions = transitions.get(ROOT);
        int added = 0;
        for (char symbol : alphabet.symbols()) {
            if (!rootTransitions.contains(symbol)) {
                rootTransitions.put(symbol, ROOT);
                added++;
            }
        }
        return added;
    }

    /*
     * Breadth-first, so that when a state's fail target is resolved, the target (being shallower) already has its
     * flattened outputs. Each state's outputs are its own pattern ids followed by those of its fail target.
     */
    private void computeFailureLinks(final int[] fail, final int[][] outputs) {
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        fail[ROOT] = NO_STATE;
        outputs[ROOT] = flatten(ROOT, NO_OUTPUTS);

        for (TransitionMap.Transition transition : transitions.get(ROOT).transitions()) {
            final int child = transition.getTarget();
            if (child != ROOT) {
                fail[child] = ROOT;
                outputs[child] = flatten(child, outputs[ROOT]);
                queue.enqueue(child);
            }
        }

        while (!queue.isEmpty()) {
            final int r = queue.dequeueInt();
            for (TransitionMap.Transition transition : transitions.get(r).transitions()) {
                final char symbol = transition.getSymbol();
                final int u = transition.getTarget();
                queue.enqueue(u);

                int v = fail[r];
                while (!transitions.get(v).contains(symbol)) {
                    v = fail[v];
                }
                final int target = transitions.get(v).get(symbol);

                fail[u] = target;
                outputs[u] = flatten(u, outputs[target]);
            }
        }
    }

    private int[] flatten(final int state, final int[] inherited) {
        final IntArrayList own = ownOutputs.get(state);
        if (own == null) {
            return inherited;
        }
        final int[] result = new int[own.size() + inherited.length];
        own.getElements(0, result, 0, own.size());
        System.arraycopy(inherited, 0, result, own.size(), inherited.length);
        return result;
    }
}
