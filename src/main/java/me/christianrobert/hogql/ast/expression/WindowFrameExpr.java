package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * A window frame bound: {@code CURRENT ROW}, {@code UNBOUNDED PRECEDING}, {@code 3 FOLLOWING}, ...
 * A null frame value means UNBOUNDED.
 */
public class WindowFrameExpr implements Expr {

    public enum FrameType {
        PRECEDING("PRECEDING"),
        FOLLOWING("FOLLOWING"),
        CURRENT_ROW("CURRENT ROW");

        private final String keyword;

        FrameType(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final FrameType frameType;
    private final Number frameValue;

    public WindowFrameExpr(FrameType frameType, Number frameValue) {
        if (frameType == null) {
            throw new IllegalArgumentException("WindowFrameExpr frameType cannot be null");
        }
        this.frameType = frameType;
        this.frameValue = frameValue;
    }

    public FrameType getFrameType() {
        return frameType;
    }

    public Number getFrameValue() {
        return frameValue;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitWindowFrameExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowFrameExpr that = (WindowFrameExpr) o;
        return frameType == that.frameType && Objects.equals(frameValue, that.frameValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameType, frameValue);
    }

    @Override
    public String toString() {
        return "WindowFrameExpr{frameType=" + frameType + ", frameValue=" + frameValue + "}";
    }
}
