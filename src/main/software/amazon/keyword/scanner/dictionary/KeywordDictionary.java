package software.amazon.keyword.scanner.dictionary;

import software.amazon.keyword.scanner.Configuration;
import software.amazon.keyword.scanner.KeywordMachine;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A loaded dictionary: the ordered patterns and, if the source named one, a vocabulary seed.
 */
@Immutable
public final class KeywordDictionary {

    private final List<String> patterns;
    private final Set<Character> vocabulary;

    KeywordDictionary(final List<String> patterns, @Nullable final Set<Character> vocabulary) {
        this.patterns = Collections.unmodifiableList(patterns);
        this.vocabulary = vocabulary == null ? null : Collections.unmodifiableSet(vocabulary);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    /**
     * @return the vocabulary seed given by the source, or null if it gave none
     */
    @Nullable
    public Set<Character> getVocabulary() {
        return vocabulary;
    }

    /**
     * Build a machine from this dictionary. The dictionary's own vocabulary seed, if any, replaces the one in the
     * given configuration.
     *
     * @param configuration the configuration to start from
     * @return a built machine
     */
    public KeywordMachine toMachine(final Configuration configuration) {
        Configuration effective = configuration;
        if (vocabulary != null) {
            effective = new Configuration.Builder()
                    .withVocabularySeed(vocabulary)
                    .withVocabularyGrowth(configuration.isVocabularyGrowth())
                    .withUnsupportedSymbolRejection(configuration.isUnsupportedSymbolRejection())
                    .build();
        }
        final KeywordMachine machine = new KeywordMachine(effective);
        machine.build(patterns);
        return machine;
    }

    @Override
    public String toString() {
        return "KeywordDictionary{patterns=" + patterns.size() + ", vocabulary=" + vocabulary + '}';
    }
}
