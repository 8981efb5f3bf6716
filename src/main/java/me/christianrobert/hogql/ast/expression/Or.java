package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N-ary disjunction. Operands are never themselves {@code Or} nodes.
 */
public class Or implements Expr {

    private final List<Expr> exprs;

    public Or(List<Expr> exprs) {
        if (exprs == null || exprs.size() < 2) {
            throw new IllegalArgumentException("Or requires at least two operands");
        }
        for (Expr expr : exprs) {
            if (expr instanceof Or) {
                throw new IllegalArgumentException("Or operand cannot itself be an Or");
            }
        }
        this.exprs = Collections.unmodifiableList(new ArrayList<>(exprs));
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return exprs.equals(((Or) o).exprs);
    }

    @Override
    public int hashCode() {
        return exprs.hashCode();
    }

    @Override
    public String toString() {
        return "Or{exprs=" + exprs + "}";
    }
}
