package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

/**
 * The ON condition of a join.
 */
public class JoinConstraint implements AstNode {

    private final Expr expr;

    public JoinConstraint(Expr expr) {
        if (expr == null) {
            throw new IllegalArgumentException("JoinConstraint expr cannot be null");
        }
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitJoinConstraint(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return expr.equals(((JoinConstraint) o).expr);
    }

    @Override
    public int hashCode() {
        return expr.hashCode();
    }

    @Override
    public String toString() {
        return "JoinConstraint{expr=" + expr + "}";
    }
}
