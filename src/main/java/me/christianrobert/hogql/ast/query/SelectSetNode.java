package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * One member after the first in a {@link SelectSetQuery}, with the operator that attaches it.
 * The query is a {@link SelectQuery} or, for a parenthesized group that could not be flattened,
 * a nested {@link SelectSetQuery}.
 */
public class SelectSetNode implements AstNode {

    private final SetOperator setOperator;
    private final Expr selectQuery;

    public SelectSetNode(SetOperator setOperator, Expr selectQuery) {
        if (setOperator == null || selectQuery == null) {
            throw new IllegalArgumentException("SelectSetNode operator and query cannot be null");
        }
        this.setOperator = setOperator;
        this.selectQuery = selectQuery;
    }

    public SetOperator getSetOperator() {
        return setOperator;
    }

    public Expr getSelectQuery() {
        return selectQuery;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitSelectSetNode(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectSetNode that = (SelectSetNode) o;
        return setOperator == that.setOperator && selectQuery.equals(that.selectQuery);
    }

    @Override
    public int hashCode() {
        return Objects.hash(setOperator, selectQuery);
    }

    @Override
    public String toString() {
        return "SelectSetNode{setOperator=" + setOperator + ", selectQuery=" + selectQuery + "}";
    }
}
