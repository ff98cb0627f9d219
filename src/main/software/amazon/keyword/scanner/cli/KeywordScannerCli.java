package software.amazon.keyword.scanner.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.keyword.scanner.Configuration;
import software.amazon.keyword.scanner.KeywordMachine;
import software.amazon.keyword.scanner.dictionary.DictionaryLoader;
import software.amazon.keyword.scanner.dictionary.KeywordDictionary;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line front end: loads a dictionary, then scans either the text given on the command line or, without one,
 * each line typed at the prompt until an empty line. For each match the source pattern is printed, one per line, or
 * "none" when nothing matched.
 */
public class KeywordScannerCli {

    static final String DEFAULT_VOCABULARY = "abcdefghijklmnopqrstuvwxyz";
    static final String NO_MATCH = "none";

    private static final Logger logger = LoggerFactory.getLogger(KeywordScannerCli.class);

    private KeywordScannerCli() { }

    public static void main(String[] args) {
        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, in, System.out));
    }

    /**
     * @return the process exit status
     */
    static int run(final String[] args, final BufferedReader in, final PrintStream out) {
        if ((args.length != 1 && args.length != 2) || "-h".equals(args[0])) {
            out.println("Usage: " + KeywordScannerCli.class.getSimpleName()
                    + " dictionary-file [quoted-test-string]");
            return 0;
        }

        final Path file = Paths.get(args[0]);
        final KeywordDictionary dictionary;
        try {
            dictionary = DictionaryLoader.load(file);
        } catch (IOException e) {
            logger.error("Cannot load dictionary {}", file, e);
            out.println("Failed to read " + file + ": " + e.getLocalizedMessage());
            return 1;
        }
        out.println("Read " + dictionary.getPatterns().size() + " keywords from " + args[0]);

        final KeywordMachine machine = dictionary.toMachine(
                new Configuration.Builder().withVocabularySeed(DEFAULT_VOCABULARY).build());

        if (args.length == 2) {
            out.println("Parse: " + args[1]);
            printResult(machine, machine.scan(args[1]), out);
            return 0;
        }

        out.println("Press Ctrl+C when you are bored.");
        try {
            while (true) {
                out.print("Input string: ");
                out.flush();
                final String input = in.readLine();
                if (input == null || input.isEmpty()) {
                    break;
                }
                printResult(machine, machine.scan(input), out);
            }
        } catch (IOException e) {
            logger.error("Cannot read input", e);
            return 1;
        }
        return 0;
    }

    private static void printResult(final KeywordMachine machine, final List<Integer> ids, final PrintStream out) {
        if (ids.isEmpty()) {
            out.println(NO_MATCH);
            return;
        }
        for (String pattern : machine.patternsFor(ids)) {
            out.println(pattern);
        }
    }
}
