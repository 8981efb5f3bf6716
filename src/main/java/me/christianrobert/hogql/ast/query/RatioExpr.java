package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.expression.Constant;

import java.util.Objects;

/**
 * {@code numerator [/ denominator]} as used by SAMPLE.
 */
public class RatioExpr implements AstNode {

    private final Constant left;
    private final Constant right;

    public RatioExpr(Constant left, Constant right) {
        if (left == null) {
            throw new IllegalArgumentException("RatioExpr left cannot be null");
        }
        this.left = left;
        this.right = right;
    }

    public Constant getLeft() {
        return left;
    }

    public Constant getRight() {
        return right;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitRatioExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RatioExpr that = (RatioExpr) o;
        return left.equals(that.left) && Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "RatioExpr{left=" + left + ", right=" + right + "}";
    }
}
