package software.amazon.keyword.scanner.cli;

import org.junit.Before;
import org.junit.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class KeywordScannerCliTest {

    private ByteArrayOutputStream bytes;
    private PrintStream out;
    private String dictionary;

    @Before
    public void setUp() throws Exception {
        bytes = new ByteArrayOutputStream();
        out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
        dictionary = Paths.get(getClass().getResource("/dictionaries/classic.txt").toURI()).toString();
    }

    private int run(String input, String... args) {
        return KeywordScannerCli.run(args, new BufferedReader(new StringReader(input)), out);
    }

    private String output() throws Exception {
        return bytes.toString(StandardCharsets.UTF_8.name()).replace(System.lineSeparator(), "\n");
    }

    @Test
    public void testUsage() throws Exception {
        assertEquals(0, run(""));
        assertTrue(output().startsWith("Usage: KeywordScannerCli dictionary-file [quoted-test-string]"));
    }

    @Test
    public void testHelpFlag() throws Exception {
        assertEquals(0, run("", "-h"));
        assertTrue(output().startsWith("Usage: "));
    }

    @Test
    public void testParseGivenString() throws Exception {
        assertEquals(0, run("", dictionary, "UsHeRs"));
        assertEquals("Read 4 keywords from " + dictionary + "\n"
                + "Parse: UsHeRs\n"
                + "she\n"
                + "he\n"
                + "hers\n", output());
    }

    @Test
    public void testParseGivenStringWithoutMatch() throws Exception {
        assertEquals(0, run("", dictionary, "xyz abc"));
        assertTrue(output().endsWith("Parse: xyz abc\nnone\n"));
    }

    @Test
    public void testInteractiveLoopStopsOnEmptyLine() throws Exception {
        assertEquals(0, run("ushers\nxyz\n\nhis\n", dictionary));
        assertEquals("Read 4 keywords from " + dictionary + "\n"
                + "Press Ctrl+C when you are bored.\n"
                + "Input string: she\nhe\nhers\n"
                + "Input string: none\n"
                + "Input string: ", output());
    }

    @Test
    public void testInteractiveLoopStopsAtEndOfInput() throws Exception {
        assertEquals(0, run("his", dictionary));
        assertTrue(output().endsWith("Input string: his\nInput string: "));
    }

    @Test
    public void testMissingDictionary() throws Exception {
        assertEquals(1, run("", "/no/such/dictionary.txt", "he"));
        assertTrue(output().startsWith("Failed to read "));
    }
}
