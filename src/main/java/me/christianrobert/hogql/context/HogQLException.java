package me.christianrobert.hogql.context;

/**
 * Base exception for every failure raised while turning HogQL text into an AST.
 * Carries the offending source text and, when known, the character span it refers to.
 */
public abstract class HogQLException extends RuntimeException {

    private final String query;
    private final Integer start;
    private final Integer end;

    protected HogQLException(String message) {
        this(message, null, null, null, null);
    }

    protected HogQLException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    protected HogQLException(String message, Integer start, Integer end) {
        this(message, null, start, end, null);
    }

    protected HogQLException(String message, String query, Integer start, Integer end, Throwable cause) {
        super(message, cause);
        this.query = query;
        this.start = start;
        this.end = end;
    }

    /**
     * Name of the error category as reported to callers (e.g. "SyntaxError").
     */
    public abstract String getErrorType();

    /**
     * Returns a copy of this exception bound to the given source text.
     */
    public abstract HogQLException withQuery(String query);

    public String getQuery() {
        return query;
    }

    public Integer getStart() {
        return start;
    }

    public Integer getEnd() {
        return end;
    }

    public boolean hasSpan() {
        return start != null && end != null;
    }

    /**
     * Gets a detailed error message including the query and the position of the error.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getErrorType()).append(": ").append(getMessage());
        if (hasSpan()) {
            sb.append("\nPosition: ").append(start).append("-").append(end);
        }
        if (query != null) {
            sb.append("\nQuery: ").append(query);
        }
        return sb.toString();
    }
}
