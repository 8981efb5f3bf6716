package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

public class Not implements Expr {

    private final Expr expr;

    public Not(Expr expr) {
        if (expr == null) {
            throw new IllegalArgumentException("Not expr cannot be null");
        }
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return expr.equals(((Not) o).expr);
    }

    @Override
    public int hashCode() {
        return expr.hashCode();
    }

    @Override
    public String toString() {
        return "Not{expr=" + expr + "}";
    }
}
