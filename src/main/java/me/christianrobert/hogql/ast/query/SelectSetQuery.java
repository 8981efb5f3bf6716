package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code s1 UNION ALL s2 EXCEPT s3 ...}: an initial query followed by at least one
 * operator-tagged member.
 */
public class SelectSetQuery implements Expr {

    private final Expr initialSelectQuery;
    private final List<SelectSetNode> subsequentSelectQueries;

    public SelectSetQuery(Expr initialSelectQuery, List<SelectSetNode> subsequentSelectQueries) {
        if (initialSelectQuery == null) {
            throw new IllegalArgumentException("SelectSetQuery requires an initial select query");
        }
        if (subsequentSelectQueries == null || subsequentSelectQueries.isEmpty()) {
            throw new IllegalArgumentException("SelectSetQuery requires at least one subsequent select query");
        }
        this.initialSelectQuery = initialSelectQuery;
        this.subsequentSelectQueries = Collections.unmodifiableList(new ArrayList<>(subsequentSelectQueries));
    }

    public Expr getInitialSelectQuery() {
        return initialSelectQuery;
    }

    public List<SelectSetNode> getSubsequentSelectQueries() {
        return subsequentSelectQueries;
    }

    /**
     * All member queries in source order, the initial one first.
     */
    public List<Expr> getSelectQueries() {
        List<Expr> queries = new ArrayList<>(subsequentSelectQueries.size() + 1);
        queries.add(initialSelectQuery);
        for (SelectSetNode node : subsequentSelectQueries) {
            queries.add(node.getSelectQuery());
        }
        return queries;
    }

    /**
     * True when every member is attached with UNION ALL, so the set can be spliced into an
     * enclosing UNION ALL without changing its meaning.
     */
    public boolean isUnionAllOnly() {
        for (SelectSetNode node : subsequentSelectQueries) {
            if (node.getSetOperator() != SetOperator.UNION_ALL) {
                return false;
            }
        }
        return true;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitSelectSetQuery(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectSetQuery that = (SelectSetQuery) o;
        return initialSelectQuery.equals(that.initialSelectQuery)
                && subsequentSelectQueries.equals(that.subsequentSelectQueries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialSelectQuery, subsequentSelectQueries);
    }

    @Override
    public String toString() {
        return "SelectSetQuery{initialSelectQuery=" + initialSelectQuery
                + ", subsequentSelectQueries=" + subsequentSelectQueries + "}";
    }
}
