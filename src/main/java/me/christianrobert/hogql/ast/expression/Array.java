package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Array implements Expr {

    private final List<Expr> exprs;

    public Array(List<Expr> exprs) {
        if (exprs == null) {
            throw new IllegalArgumentException("Array exprs cannot be null");
        }
        this.exprs = Collections.unmodifiableList(new ArrayList<>(exprs));
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return exprs.equals(((Array) o).exprs);
    }

    @Override
    public int hashCode() {
        return exprs.hashCode();
    }

    @Override
    public String toString() {
        return "Array{exprs=" + exprs + "}";
    }
}
