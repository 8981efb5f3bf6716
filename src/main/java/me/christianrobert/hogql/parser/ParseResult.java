package me.christianrobert.hogql.parser;

import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of running the HogQL grammar over source text.
 * Contains the parse tree, the syntax errors encountered and the span of the first error.
 */
public class ParseResult {

    private final ParserRuleContext tree;
    private final List<String> errors;
    private final String originalQuery;
    private final Integer errorStart;
    private final Integer errorEnd;

    public ParseResult(ParserRuleContext tree, List<String> errors, String originalQuery) {
        this(tree, errors, originalQuery, null, null);
    }

    public ParseResult(ParserRuleContext tree, List<String> errors, String originalQuery,
                       Integer errorStart, Integer errorEnd) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalQuery = originalQuery;
        this.errorStart = errorStart;
        this.errorEnd = errorEnd;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public ParserRuleContext getTree() {
        return tree;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * First error message, which is what gets reported to callers.
     */
    public String getFirstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    /**
     * Start offset (inclusive) of the first error, or null if unknown.
     */
    public Integer getErrorStart() {
        return errorStart;
    }

    /**
     * End offset (exclusive) of the first error, or null if unknown.
     */
    public Integer getErrorEnd() {
        return errorEnd;
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
