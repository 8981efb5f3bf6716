package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * One ORDER BY item. NULLS FIRST/LAST and COLLATE are accepted by the grammar but not kept.
 */
public class OrderExpr implements Expr {

    public enum Order {
        ASC,
        DESC
    }

    private final Expr expr;
    private final Order order;

    public OrderExpr(Expr expr, Order order) {
        if (expr == null) {
            throw new IllegalArgumentException("OrderExpr expr cannot be null");
        }
        if (order == null) {
            throw new IllegalArgumentException("OrderExpr order cannot be null");
        }
        this.expr = expr;
        this.order = order;
    }

    public Expr getExpr() {
        return expr;
    }

    public Order getOrder() {
        return order;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitOrderExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderExpr that = (OrderExpr) o;
        return expr.equals(that.expr) && order == that.order;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, order);
    }

    @Override
    public String toString() {
        return "OrderExpr{expr=" + expr + ", order=" + order + "}";
    }
}
