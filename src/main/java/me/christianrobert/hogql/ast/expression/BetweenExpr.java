package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * {@code expr [NOT] BETWEEN low AND high}, bounds inclusive.
 */
public class BetweenExpr implements Expr {

    private final Expr expr;
    private final Expr low;
    private final Expr high;
    private final boolean negated;

    public BetweenExpr(Expr expr, Expr low, Expr high, boolean negated) {
        if (expr == null || low == null || high == null) {
            throw new IllegalArgumentException("BetweenExpr expr, low and high cannot be null");
        }
        this.expr = expr;
        this.low = low;
        this.high = high;
        this.negated = negated;
    }

    public Expr getExpr() {
        return expr;
    }

    public Expr getLow() {
        return low;
    }

    public Expr getHigh() {
        return high;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitBetweenExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BetweenExpr that = (BetweenExpr) o;
        return negated == that.negated
                && expr.equals(that.expr)
                && low.equals(that.low)
                && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, low, high, negated);
    }

    @Override
    public String toString() {
        return "BetweenExpr{expr=" + expr + ", low=" + low + ", high=" + high + ", negated=" + negated + "}";
    }
}
