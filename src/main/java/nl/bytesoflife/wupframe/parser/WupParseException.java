package nl.bytesoflife.wupframe.parser;

/**
 * Input that cannot be turned into a model at all. Recoverable problems are recorded as
 * unhandled statements instead.
 */
public class WupParseException extends RuntimeException {

    private final int statementIndex;

    public WupParseException(String message) {
        this(message, -1);
    }

    public WupParseException(String message, int statementIndex) {
        super(message);
        this.statementIndex = statementIndex;
    }

    /**
     * Index of the offending statement, or -1 when the problem is not tied to one.
     */
    public int getStatementIndex() {
        return statementIndex;
    }
}
