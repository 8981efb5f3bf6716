package me.christianrobert.hogql.context;

/**
 * The query uses a construct the transducer deliberately does not translate.
 */
public class NotImplementedException extends HogQLException {

    public NotImplementedException(String message) {
        super(message);
    }

    private NotImplementedException(String message, String query, Integer start, Integer end, Throwable cause) {
        super(message, query, start, end, cause);
    }

    @Override
    public NotImplementedException withQuery(String query) {
        return new NotImplementedException(getMessage(), query, getStart(), getEnd(), this);
    }

    @Override
    public String getErrorType() {
        return "NotImplementedError";
    }
}
