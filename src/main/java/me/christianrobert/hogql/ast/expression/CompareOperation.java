package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

public class CompareOperation implements Expr {

    private final CompareOperationOp op;
    private final Expr left;
    private final Expr right;

    public CompareOperation(CompareOperationOp op, Expr left, Expr right) {
        if (op == null) {
            throw new IllegalArgumentException("CompareOperation op cannot be null");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("CompareOperation operands cannot be null");
        }
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public CompareOperationOp getOp() {
        return op;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitCompareOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompareOperation that = (CompareOperation) o;
        return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
        return "CompareOperation{op=" + op + ", left=" + left + ", right=" + right + "}";
    }
}
