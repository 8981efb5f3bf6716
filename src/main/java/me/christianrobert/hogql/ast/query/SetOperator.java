package me.christianrobert.hogql.ast.query;

/**
 * Operators joining the members of a {@link SelectSetQuery}.
 */
public enum SetOperator {
    UNION_ALL("UNION ALL"),
    UNION_DISTINCT("UNION DISTINCT"),
    INTERSECT("INTERSECT"),
    INTERSECT_DISTINCT("INTERSECT DISTINCT"),
    EXCEPT("EXCEPT");

    private final String keyword;

    SetOperator(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
