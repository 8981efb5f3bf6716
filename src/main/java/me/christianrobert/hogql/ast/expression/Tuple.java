package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parenthesized list with at least two members, or an explicit {@code tuple(...)}.
 */
public class Tuple implements Expr {

    private final List<Expr> exprs;

    public Tuple(List<Expr> exprs) {
        if (exprs == null) {
            throw new IllegalArgumentException("Tuple exprs cannot be null");
        }
        this.exprs = Collections.unmodifiableList(new ArrayList<>(exprs));
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitTuple(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return exprs.equals(((Tuple) o).exprs);
    }

    @Override
    public int hashCode() {
        return exprs.hashCode();
    }

    @Override
    public String toString() {
        return "Tuple{exprs=" + exprs + "}";
    }
}
