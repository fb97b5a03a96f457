package software.amazon.keyword.matcher.table;

/**
 * A RuntimeException that indicates a keyword table whose structure cannot be turned back into an automaton.
 */
public class MalformedTableException extends RuntimeException {

    public MalformedTableException(String msg) {
        super(msg);
    }

    public MalformedTableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
