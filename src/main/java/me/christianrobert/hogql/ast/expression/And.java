package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * N-ary conjunction. Operands are never themselves {@code And} nodes.
 */
public class And implements Expr {

    private final List<Expr> exprs;

    public And(List<Expr> exprs) {
        if (exprs == null || exprs.size() < 2) {
            throw new IllegalArgumentException("And requires at least two operands");
        }
        for (Expr expr : exprs) {
            if (expr instanceof And) {
                throw new IllegalArgumentException("And operand cannot itself be an And");
            }
        }
        this.exprs = Collections.unmodifiableList(new ArrayList<>(exprs));
    }

    public List<Expr> getExprs() {
        return exprs;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return exprs.equals(((And) o).exprs);
    }

    @Override
    public int hashCode() {
        return exprs.hashCode();
    }

    @Override
    public String toString() {
        return "And{exprs=" + exprs + "}";
    }
}
