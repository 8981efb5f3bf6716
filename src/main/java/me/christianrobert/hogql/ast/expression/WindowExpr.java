package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A window specification, used inline after OVER or as a named entry of a WINDOW clause.
 */
public class WindowExpr implements Expr {

    public enum FrameMethod {
        ROWS,
        RANGE
    }

    private final List<Expr> partitionBy;
    private final List<OrderExpr> orderBy;
    private final FrameMethod frameMethod;
    private final WindowFrameExpr frameStart;
    private final WindowFrameExpr frameEnd;

    public WindowExpr(List<Expr> partitionBy, List<OrderExpr> orderBy, FrameMethod frameMethod,
                      WindowFrameExpr frameStart, WindowFrameExpr frameEnd) {
        if (frameEnd != null && frameStart == null) {
            throw new IllegalArgumentException("WindowExpr frameEnd requires frameStart");
        }
        this.partitionBy = partitionBy == null ? null : Collections.unmodifiableList(new ArrayList<>(partitionBy));
        this.orderBy = orderBy == null ? null : Collections.unmodifiableList(new ArrayList<>(orderBy));
        this.frameMethod = frameMethod;
        this.frameStart = frameStart;
        this.frameEnd = frameEnd;
    }

    public List<Expr> getPartitionBy() {
        return partitionBy;
    }

    public List<OrderExpr> getOrderBy() {
        return orderBy;
    }

    public FrameMethod getFrameMethod() {
        return frameMethod;
    }

    public WindowFrameExpr getFrameStart() {
        return frameStart;
    }

    public WindowFrameExpr getFrameEnd() {
        return frameEnd;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitWindowExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowExpr that = (WindowExpr) o;
        return Objects.equals(partitionBy, that.partitionBy)
                && Objects.equals(orderBy, that.orderBy)
                && frameMethod == that.frameMethod
                && Objects.equals(frameStart, that.frameStart)
                && Objects.equals(frameEnd, that.frameEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionBy, orderBy, frameMethod, frameStart, frameEnd);
    }

    @Override
    public String toString() {
        return "WindowExpr{partitionBy=" + partitionBy
                + ", orderBy=" + orderBy
                + ", frameMethod=" + frameMethod
                + ", frameStart=" + frameStart
                + ", frameEnd=" + frameEnd + "}";
    }
}
