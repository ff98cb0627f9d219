package software.amazon.keyword.scanner;

import software.amazon.keyword.scanner.input.Alphabet;
import software.amazon.keyword.scanner.input.Vocabulary;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 *  Represents an Aho-Corasick keyword automaton: built once from an ordered list of patterns, it then reports, for a
 *  scanned text, every pattern ending at every position, overlapping matches included, in time linear in the length
 *  of the text.
 *
 *  The machine is thread safe. The concurrency strategy is:
 *  build() is synchronized and runs at most once; the automaton it produces is immutable and published through a
 *  volatile field. After that, any number of threads may call scan() or use their own Cursor without locking.
 *
 *  Patterns are identified by their position in the list given to build(). Identical patterns keep distinct ids and
 *  are reported independently.
 */
@ThreadSafe
public class KeywordMachine {

    /**
     * Configuration for the Machine.
     */
    private final Configuration configuration;

    /**
     * The automaton, null until build() has completed.
     */
    private volatile Automaton automaton;

    /**
     * The patterns the automaton was built from, so that ids can be mapped back to them.
     */
    private volatile List<String> patterns = Collections.emptyList();

    public KeywordMachine() {
        this(new Configuration.Builder().build());
    }

    /**
     * @param vocabularySeed the characters of the initial alphabet; case is ignored
     */
    public KeywordMachine(final Set<Character> vocabularySeed) {
        this(new Configuration.Builder().withVocabularySeed(vocabularySeed).build());
    }

    public KeywordMachine(@Nonnull final Configuration configuration) {
        this.configuration = configuration;
    }

    /**
     * Build the automaton from a dictionary. Every pattern is normalized (case-folded, runs of spaces collapsed), and
     * unless vocabulary growth is switched off, every character it holds joins the alphabet. Empty patterns are
     * allowed; they end at every position of a scanned text.
     *
     * "synchronized" here is to ensure that only one thread builds the machine. The list is copied, so the caller may
     * change it afterwards.
     *
     * @param patterns the dictionary; a pattern's id is its index in this list
     * @throws AlreadyInitializedException if this machine has already been built. The existing automaton is kept.
     */
    public synchronized void build(@Nonnull final List<String> patterns) {
        if (automaton != null) {
            throw new AlreadyInitializedException("Machine has already been built from "
                    + this.patterns.size() + " patterns");
        }

        final List<String> dictionary = Collections.unmodifiableList(new ArrayList<>(patterns));
        final Vocabulary vocabulary = new Vocabulary(configuration.getVocabularySeed());
        final Automaton built = new AutomatonBuilder(vocabulary, configuration.isVocabularyGrowth())
                .build(dictionary);

        this.patterns = dictionary;
        this.automaton = built;
    }

    public boolean isBuilt() {
        return automaton != null;
    }

    /**
     * Return the ids of all patterns ending at each position of the text, in text order. Where several patterns end at
     * the same position, a pattern is reported before the patterns that are proper suffixes of it.
     *
     * @param text the text to scan; characters outside the alphabet are ignored
     * @return list of pattern ids. The list may be empty but never null.
     * @throws IllegalStateException if the machine has not been built
     * @throws software.amazon.keyword.scanner.input.UnsupportedSymbolException if the machine rejects unsupported
     * symbols and the text holds one
     */
    public List<Integer> scan(@Nonnull final String text) {
        return KeywordFinder.scan(text, builtAutomaton(), configuration.isUnsupportedSymbolRejection());
    }

    /**
     * Start a streaming scan. The cursor is for use by a single thread.
     *
     * @return a new cursor positioned at the root
     * @throws IllegalStateException if the machine has not been built
     */
    public Cursor cursor() {
        return new Cursor(builtAutomaton(), configuration.isUnsupportedSymbolRejection());
    }

    /**
     * Map pattern ids, as returned by scan(), back to the patterns they came from.
     *
     * @param ids pattern ids
     * @return the pattern for each id, in the same order
     * @throws IndexOutOfBoundsException if an id is not one of this machine's
     */
    public List<String> patternsFor(@Nonnull final List<Integer> ids) {
        final List<String> dictionary = patterns;
        final List<String> result = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            result.add(dictionary.get(id));
        }
        return result;
    }

    /**
     * @return the patterns this machine was built from, empty before build()
     */
    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * @return the alphabet the machine matches over
     * @throws IllegalStateException if the machine has not been built
     */
    public Alphabet getAlphabet() {
        return builtAutomaton().getAlphabet();
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    final Automaton getAutomaton() {
        return automaton;
    }

    private Automaton builtAutomaton() {
        final Automaton current = automaton;
        if (current == null) {
            throw new IllegalStateException("Machine has not been built");
        }
        return current;
    }

    @Override
    public String toString() {
        final Automaton current = automaton;
        return "KeywordMachine{" + (current == null ? "not built" : current.toString()) + '}';
    }
}
