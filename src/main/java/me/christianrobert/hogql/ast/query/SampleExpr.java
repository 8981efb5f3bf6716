package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;

import java.util.Objects;

/**
 * {@code SAMPLE ratio [OFFSET ratio]}.
 */
public class SampleExpr implements AstNode {

    private final RatioExpr sampleValue;
    private final RatioExpr offsetValue;

    public SampleExpr(RatioExpr sampleValue, RatioExpr offsetValue) {
        if (sampleValue == null) {
            throw new IllegalArgumentException("SampleExpr sampleValue cannot be null");
        }
        this.sampleValue = sampleValue;
        this.offsetValue = offsetValue;
    }

    public RatioExpr getSampleValue() {
        return sampleValue;
    }

    public RatioExpr getOffsetValue() {
        return offsetValue;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitSampleExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SampleExpr that = (SampleExpr) o;
        return sampleValue.equals(that.sampleValue) && Objects.equals(offsetValue, that.offsetValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleValue, offsetValue);
    }

    @Override
    public String toString() {
        return "SampleExpr{sampleValue=" + sampleValue + ", offsetValue=" + offsetValue + "}";
    }
}
