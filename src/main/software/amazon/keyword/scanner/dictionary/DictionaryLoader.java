package software.amazon.keyword.scanner.dictionary;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads keyword dictionaries, either as plain text with one pattern per line, or as JSON. A JSON dictionary is an
 * array of pattern strings:
 *   [ "he", "she", "hers", "his" ]
 * or an object which also names the vocabulary seed:
 *   {
 *     "vocabulary": "abcdefghijklmnopqrstuvwxyz",
 *     "patterns": [ "he", "she", "hers", "his" ]
 *   }
 * Pattern order is significant: a pattern's id is its position in the file.
 */
public class DictionaryLoader {

    static final String VOCABULARY_FIELD = "vocabulary";
    static final String PATTERNS_FIELD = "patterns";
    private static final String JSON_SUFFIX = ".json";

    private static final Logger logger = LoggerFactory.getLogger(DictionaryLoader.class);

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private DictionaryLoader() { }

    /**
     * Load a dictionary file, as JSON if its name ends in ".json", as lines of text otherwise.
     *
     * @param file the dictionary file, UTF-8
     * @return the dictionary
     * @throws IOException if the file cannot be read, or is not a valid JSON dictionary
     */
    public static KeywordDictionary load(final Path file) throws IOException {
        final KeywordDictionary dictionary;
        if (file.getFileName() != null && file.getFileName().toString().endsWith(JSON_SUFFIX)) {
            try (InputStream in = Files.newInputStream(file)) {
                dictionary = parseJson(in);
            }
        } else {
            try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                dictionary = new KeywordDictionary(readLines(in), null);
            }
        }
        logger.debug("Loaded {} from {}", dictionary, file);
        return dictionary;
    }

    /**
     * Read one pattern per line. Line terminators are stripped; every line, including an empty one, is a pattern.
     *
     * @param source the text
     * @return the patterns in order
     * @throws IOException if reading fails
     */
    public static List<String> readLines(final Reader source) throws IOException {
        final BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source : new BufferedReader(source);
        final List<String> patterns = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            patterns.add(line);
        }
        return patterns;
    }

    /**
     * Verify the syntax of a JSON dictionary
     * @param source dictionary, as a String
     * @return null if the dictionary is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doParse(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static KeywordDictionary parseJson(final String source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    public static KeywordDictionary parseJson(final Reader source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    public static KeywordDictionary parseJson(final InputStream source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    public static KeywordDictionary parseJson(final byte[] source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    private static KeywordDictionary doParse(final JsonParser parser) throws IOException {
        try (JsonParser p = parser) {
            final KeywordDictionary dictionary;
            final JsonToken token = p.nextToken();
            if (token == JsonToken.START_ARRAY) {
                dictionary = new KeywordDictionary(parsePatterns(p), null);
            } else if (token == JsonToken.START_OBJECT) {
                dictionary = parseObject(p);
            } else {
                barf(p, "Dictionary must be an array of patterns or an object");
                return null;
            }
            if (p.nextToken() != null) {
                barf(p, "Unexpected content after dictionary");
            }
            return dictionary;
        }
    }

    private static KeywordDictionary parseObject(final JsonParser parser) throws IOException {
        List<String> patterns = null;
        Set<Character> vocabulary = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            final JsonToken value = parser.nextToken();
            switch (fieldName) {
                case PATTERNS_FIELD:
                    if (patterns != null) {
                        barf(parser, "\"" + PATTERNS_FIELD + "\" given more than once");
                    }
                    if (value != JsonToken.START_ARRAY) {
                        barf(parser, "\"" + PATTERNS_FIELD + "\" must be an array of strings");
                    }
                    patterns = parsePatterns(parser);
                    break;

                case VOCABULARY_FIELD:
                    if (vocabulary != null) {
                        barf(parser, "\"" + VOCABULARY_FIELD + "\" given more than once");
                    }
                    if (value != JsonToken.VALUE_STRING) {
                        barf(parser, "\"" + VOCABULARY_FIELD + "\" must be a string of characters");
                    }
                    vocabulary = new TreeSet<>();
                    for (char c : parser.getText().toCharArray()) {
                        vocabulary.add(c);
                    }
                    break;

                default:
                    barf(parser, String.format("Unrecognized field \"%s\"", fieldName));
            }
        }

        if (patterns == null) {
            barf(parser, "Dictionary object must have a \"" + PATTERNS_FIELD + "\" array");
        }
        return new KeywordDictionary(patterns, vocabulary);
    }

    // the parser is positioned on START_ARRAY
    private static List<String> parsePatterns(final JsonParser parser) throws IOException {
        final List<String> patterns = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.VALUE_STRING) {
                barf(parser, "Pattern must be a string");
            }
            patterns.add(parser.getText());
        }
        return patterns;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
