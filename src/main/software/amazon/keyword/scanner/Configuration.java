package software.amazon.keyword.scanner;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Configuration for a KeywordMachine.
 */
public class Configuration {

    /**
     * The characters the alphabet starts out with, before any pattern is ingested. Case-folded when the vocabulary is
     * created.
     */
    private final Set<Character> vocabularySeed;

    /**
     * When true, which is the default, every character found in a pattern joins the alphabet, so the seed only needs
     * to name symbols that appear in query text but in no pattern. When false, the alphabet is exactly the seed and
     * pattern characters outside it are dropped.
     */
    private final boolean vocabularyGrowth;

    /**
     * When false, which is the default, query characters outside the alphabet are silently dropped. When true, a scan
     * of text holding such a character fails with an UnsupportedSymbolException.
     */
    private final boolean unsupportedSymbolRejection;

    private Configuration(Set<Character> vocabularySeed, boolean vocabularyGrowth,
                          boolean unsupportedSymbolRejection) {
        this.vocabularySeed = Collections.unmodifiableSet(new TreeSet<>(vocabularySeed));
        this.vocabularyGrowth = vocabularyGrowth;
        this.unsupportedSymbolRejection = unsupportedSymbolRejection;
    }

    public Set<Character> getVocabularySeed() {
        return vocabularySeed;
    }

    public boolean isVocabularyGrowth() {
        return vocabularyGrowth;
    }

    public boolean isUnsupportedSymbolRejection() {
        return unsupportedSymbolRejection;
    }

    public static class Builder {

        private Set<Character> vocabularySeed = Collections.emptySet();
        private boolean vocabularyGrowth = true;
        private boolean unsupportedSymbolRejection = false;

        public Builder withVocabularySeed(Set<Character> vocabularySeed) {
            this.vocabularySeed = vocabularySeed;
            return this;
        }

        public Builder withVocabularySeed(String characters) {
            Set<Character> seed = new TreeSet<>();
            for (char c : characters.toCharArray()) {
                seed.add(c);
            }
            this.vocabularySeed = seed;
            return this;
        }

        public Builder withVocabularyGrowth(boolean vocabularyGrowth) {
            this.vocabularyGrowth = vocabularyGrowth;
            return this;
        }

        public Builder withUnsupportedSymbolRejection(boolean unsupportedSymbolRejection) {
            this.unsupportedSymbolRejection = unsupportedSymbolRejection;
            return this;
        }

        public Configuration build() {
            return new Configuration(vocabularySeed, vocabularyGrowth, unsupportedSymbolRejection);
        }
    }
}
