package software.amazon.keyword.scanner.input;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class VocabularyTest {

    @Test
    public void seedIsCaseFolded() {
        Vocabulary vocabulary = new Vocabulary(new HashSet<>(Arrays.asList('A', 'a', 'B')));
        assertEquals(2, vocabulary.size());
        assertTrue(vocabulary.contains('a'));
        assertTrue(vocabulary.contains('b'));
        assertFalse(vocabulary.contains('A'));
    }

    @Test
    public void addReportsWhetherSymbolWasNew() {
        Vocabulary vocabulary = new Vocabulary();
        assertTrue(vocabulary.add('Q'));
        assertFalse(vocabulary.add('q'));
        assertEquals(1, vocabulary.size());
    }

    @Test
    public void freezeSnapshotsSortedSymbols() {
        Vocabulary vocabulary = new Vocabulary();
        for (char c : "zyx".toCharArray()) {
            vocabulary.add(c);
        }
        Alphabet alphabet = vocabulary.freeze();
        vocabulary.add('w');

        assertArrayEquals("xyz".toCharArray(), alphabet.symbols());
        assertFalse(alphabet.contains('w'));
        assertEquals(4, vocabulary.size());
    }

    @Test
    public void alphabetSymbolsAreDefensivelyCopied() {
        Alphabet alphabet = new Vocabulary(new HashSet<>(Arrays.asList('a', 'b'))).freeze();
        alphabet.symbols()[0] = 'z';
        assertTrue(alphabet.contains('a'));
        assertFalse(alphabet.contains('z'));
    }

    @Test
    public void alphabetEquality() {
        Alphabet ab = new Vocabulary(new HashSet<>(Arrays.asList('a', 'b'))).freeze();
        Alphabet ba = new Vocabulary(new HashSet<>(Arrays.asList('B', 'A'))).freeze();
        assertEquals(ab, ba);
        assertEquals(ab.hashCode(), ba.hashCode());
        assertNotEquals(ab, Alphabet.empty());
        assertEquals(0, Alphabet.empty().size());
    }
}
