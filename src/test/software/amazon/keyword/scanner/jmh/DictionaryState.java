package software.amazon.keyword.scanner.jmh;

import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import software.amazon.keyword.scanner.Configuration;
import software.amazon.keyword.scanner.KeywordMachine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A machine built from a random dictionary of the given size, plus a fixed set of texts to scan.
 */
@State(Scope.Benchmark)
public class DictionaryState {

    static final int TEXT_COUNT = 100;
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz ";

    @Param({ "100", "10000", "100000" })
    public int dictionarySize;

    KeywordMachine machine;
    final List<String> texts = new ArrayList<>();

    @Setup
    public void setup() {
        // deterministic seed so runs are comparable
        Random random = new Random(1);
        List<String> patterns = new ArrayList<>(dictionarySize);
        for (int i = 0; i < dictionarySize; i++) {
            patterns.add(word(random, 3 + random.nextInt(8)));
        }
        machine = new KeywordMachine(new Configuration.Builder().withVocabularySeed(LETTERS).build());
        machine.build(patterns);

        for (int i = 0; i < TEXT_COUNT; i++) {
            texts.add(word(random, 2000));
        }
    }

    private static String word(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(LETTERS.charAt(random.nextInt(LETTERS.length())));
        }
        return sb.toString();
    }
}
