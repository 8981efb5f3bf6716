package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

public class ArithmeticOperation implements Expr {

    private final ArithmeticOperationOp op;
    private final Expr left;
    private final Expr right;

    public ArithmeticOperation(ArithmeticOperationOp op, Expr left, Expr right) {
        if (op == null) {
            throw new IllegalArgumentException("ArithmeticOperation op cannot be null");
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("ArithmeticOperation operands cannot be null");
        }
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public ArithmeticOperationOp getOp() {
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
        return visitor.visitArithmeticOperation(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArithmeticOperation that = (ArithmeticOperation) o;
        return op == that.op && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
        return "ArithmeticOperation{op=" + op + ", left=" + left + ", right=" + right + "}";
    }
}
