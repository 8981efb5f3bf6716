package me.christianrobert.hogql.parser;

/**
 * Grammar rules that can be used as parse entry points.
 */
public enum StartRule {
    EXPR("expression"),
    ORDER_EXPR("order expression"),
    SELECT("SELECT statement");

    private final String description;

    StartRule(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
