package me.christianrobert.hogql.context;

/**
 * A lexeme could not be interpreted (malformed numeral, bad quoting) or the transducer
 * produced something it did not expect. Should not happen with a correct grammar.
 */
public class ParsingException extends HogQLException {

    public ParsingException(String message) {
        super(message);
    }

    public ParsingException(String message, Throwable cause) {
        super(message, cause);
    }

    private ParsingException(String message, String query, Integer start, Integer end, Throwable cause) {
        super(message, query, start, end, cause);
    }

    @Override
    public ParsingException withQuery(String query) {
        return new ParsingException(getMessage(), query, getStart(), getEnd(), this);
    }

    @Override
    public String getErrorType() {
        return "ParsingError";
    }
}
