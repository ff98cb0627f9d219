package software.amazon.keyword.scanner;

/**
 * Thrown by {@link KeywordMachine#build} when the machine has already been built. The existing automaton is left as it
 * was; build a new KeywordMachine to use a different dictionary.
 */
public class AlreadyInitializedException extends IllegalStateException {

    public AlreadyInitializedException(String msg) {
        super(msg);
    }
}
