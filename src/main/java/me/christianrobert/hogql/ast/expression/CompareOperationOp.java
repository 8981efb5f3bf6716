package me.christianrobert.hogql.ast.expression;

/**
 * Comparison operators. The symbol is the canonical HogQL spelling.
 */
public enum CompareOperationOp {
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    LT_EQ("<="),
    GT(">"),
    GT_EQ(">="),
    LIKE("like"),
    NOT_LIKE("not like"),
    ILIKE("ilike"),
    NOT_ILIKE("not ilike"),
    REGEX("=~"),
    NOT_REGEX("!~"),
    IREGEX("=~*"),
    NOT_IREGEX("!~*"),
    IN("in"),
    NOT_IN("not in"),
    IN_COHORT("in cohort"),
    NOT_IN_COHORT("not in cohort");

    private final String symbol;

    CompareOperationOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
