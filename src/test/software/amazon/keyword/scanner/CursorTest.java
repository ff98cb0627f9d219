package software.amazon.keyword.scanner;

import org.junit.Before;
import org.junit.Test;
import software.amazon.keyword.scanner.input.UnsupportedSymbolException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CursorTest {

    private KeywordMachine machine;

    @Before
    public void setUp() {
        machine = new KeywordMachine(new Configuration.Builder().withVocabularySeed(" abcdefghijklmnopqrstuvwxyz")
                .build());
        machine.build(Arrays.asList("he", "she", "hers", "his", "a  b"));
    }

    @Test
    public void feedShouldReportPatternsEndingAtEachCharacter() {
        Cursor cursor = machine.cursor();
        assertTrue(cursor.feed('U').isEmpty());
        assertTrue(cursor.feed('s').isEmpty());
        assertTrue(cursor.feed('h').isEmpty());
        assertEquals(Arrays.asList(1, 0), cursor.feed('E'));
        assertTrue(cursor.feed('r').isEmpty());
        assertEquals(Collections.singletonList(2), cursor.feed('s'));
    }

    @Test
    public void feedShouldMatchAcrossChunks() {
        Cursor cursor = machine.cursor();
        List<Integer> result = new ArrayList<>();
        result.addAll(cursor.feed("us"));
        result.addAll(cursor.feed("he"));
        result.addAll(cursor.feed("rs"));
        assertEquals(machine.scan("ushers"), result);
    }

    @Test
    public void feedShouldCollapseSpacesAcrossChunks() {
        Cursor cursor = machine.cursor();
        assertTrue(cursor.feed("a ").isEmpty());
        assertTrue(cursor.feed("   ").isEmpty());
        assertEquals(Collections.singletonList(4), cursor.feed("b"));
    }

    @Test
    public void feedShouldDropCharactersOutsideAlphabet() {
        Cursor cursor = machine.cursor();
        int before = cursor.getState();
        assertTrue(cursor.feed('!').isEmpty());
        assertEquals(before, cursor.getState());
    }

    @Test
    public void resetShouldReturnToRoot() {
        Cursor cursor = machine.cursor();
        cursor.feed("sh");
        cursor.reset();
        assertEquals(Automaton.ROOT, cursor.getState());
        assertTrue(cursor.feed('e').isEmpty());
    }

    @Test
    public void feedShouldNotExposeAutomatonOutputs() {
        Cursor cursor = machine.cursor();
        cursor.feed('h');
        List<Integer> outputs = cursor.feed('e');
        outputs.set(0, 99);
        assertEquals(Collections.singletonList(0), machine.scan("he"));
    }

    @Test
    public void strictCursorShouldRejectUnsupportedSymbol() {
        KeywordMachine strict = new KeywordMachine(new Configuration.Builder()
                .withUnsupportedSymbolRejection(true)
                .build());
        strict.build(Arrays.asList("ab"));
        Cursor cursor = strict.cursor();
        cursor.feed("ab");
        try {
            cursor.feed('c');
            fail("Expected UnsupportedSymbolException");
        } catch (UnsupportedSymbolException e) {
            assertEquals(2, e.getIndex());
        }
    }

    @Test
    public void streamingShouldAgreeWithScanOnRandomChunks() {
        // deterministic seed to prevent unit test flakiness
        Random random = new Random(11);
        for (int trial = 0; trial < 100; trial++) {
            String text = AutomatonBuilderTest.randomWord(random, "hersiu  H!", 40);
            Cursor cursor = machine.cursor();
            List<Integer> streamed = new ArrayList<>();
            int start = 0;
            while (start < text.length()) {
                int end = Math.min(text.length(), start + 1 + random.nextInt(5));
                streamed.addAll(cursor.feed(text.substring(start, end)));
                start = end;
            }
            assertEquals(text, machine.scan(text), streamed);
        }
    }
}
