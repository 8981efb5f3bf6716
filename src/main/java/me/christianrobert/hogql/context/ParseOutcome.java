package me.christianrobert.hogql.context;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of an {@code analyze} call.
 * Contains either the AST rendered as JSON or the error type, message and span.
 * Optionally includes the formatted parse tree for debugging.
 */
public class ParseOutcome {

    private final boolean success;
    private final String query;
    private final JsonNode ast;
    private final String errorType;
    private final String errorMessage;
    private final Integer start;
    private final Integer end;
    private final String parseTree;  // null unless requested

    private ParseOutcome(boolean success, String query, JsonNode ast, String errorType, String errorMessage,
                         Integer start, Integer end, String parseTree) {
        this.success = success;
        this.query = query;
        this.ast = ast;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.start = start;
        this.end = end;
        this.parseTree = parseTree;
    }

    public static ParseOutcome success(String query, JsonNode ast) {
        return new ParseOutcome(true, query, ast, null, null, null, null, null);
    }

    public static ParseOutcome successWithParseTree(String query, JsonNode ast, String parseTree) {
        return new ParseOutcome(true, query, ast, null, null, null, null, parseTree);
    }

    /**
     * Creates a failed outcome from a transduction error, keeping its span.
     */
    public static ParseOutcome failure(String query, HogQLException exception) {
        return failureWithParseTree(query, exception, null);
    }

    public static ParseOutcome failureWithParseTree(String query, HogQLException exception, String parseTree) {
        return new ParseOutcome(false, query, null, exception.getErrorType(), exception.getMessage(),
                exception.getStart(), exception.getEnd(), parseTree);
    }

    /**
     * Creates a failed outcome for input rejected before parsing (empty body and the like).
     */
    public static ParseOutcome failure(String query, String errorType, String errorMessage) {
        return new ParseOutcome(false, query, null, errorType, errorMessage, null, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getQuery() {
        return query;
    }

    public JsonNode getAst() {
        return ast;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getStart() {
        return start;
    }

    public Integer getEnd() {
        return end;
    }

    public String getParseTree() {
        return parseTree;
    }

    public boolean hasParseTree() {
        return parseTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "ParseOutcome{success=true" + (parseTree != null ? ", hasParseTree=true" : "") + "}";
        }
        return "ParseOutcome{success=false, errorType='" + errorType + "', error='" + errorMessage + "'}";
    }
}
