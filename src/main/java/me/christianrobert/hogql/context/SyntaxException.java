package me.christianrobert.hogql.context;

/**
 * A structural rule was violated (index 0, ARRAY JOIN without FROM, unaliased ARRAY JOIN member,
 * malformed join constraint, reserved-word alias) or the parser reported a grammar-level syntax error.
 */
public class SyntaxException extends HogQLException {

    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, Integer start, Integer end) {
        super(message, start, end);
    }

    private SyntaxException(String message, String query, Integer start, Integer end, Throwable cause) {
        super(message, query, start, end, cause);
    }

    /**
     * Returns a copy of this exception annotated with the given span (end exclusive).
     */
    public SyntaxException withSpan(int start, int end) {
        return new SyntaxException(getMessage(), getQuery(), start, end, this);
    }

    @Override
    public SyntaxException withQuery(String query) {
        return new SyntaxException(getMessage(), query, getStart(), getEnd(), this);
    }

    @Override
    public String getErrorType() {
        return "SyntaxError";
    }
}
