package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A literal value.
 *
 * <p>Allowed value types:
 * <ul>
 *   <li>{@code null} - SQL NULL</li>
 *   <li>{@link Boolean} - true / false identifiers</li>
 *   <li>{@link BigInteger} - integer literals (unbounded)</li>
 *   <li>{@link Double} - floating literals, including infinity and NaN</li>
 *   <li>{@link String} - unescaped string literals</li>
 * </ul>
 */
public class Constant implements Expr {

    private final Object value;

    public Constant(Object value) {
        if (value != null
                && !(value instanceof Boolean)
                && !(value instanceof BigInteger)
                && !(value instanceof Double)
                && !(value instanceof String)) {
            throw new IllegalArgumentException("Unsupported constant type: " + value.getClass().getName());
        }
        this.value = value;
    }

    public static Constant ofNull() {
        return new Constant(null);
    }

    public static Constant of(long value) {
        return new Constant(BigInteger.valueOf(value));
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    /**
     * True when the value is numerically zero (integer or float).
     */
    public boolean isZero() {
        if (value instanceof BigInteger) {
            return ((BigInteger) value).signum() == 0;
        }
        if (value instanceof Double) {
            return (Double) value == 0.0d;
        }
        return false;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((Constant) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        if (value instanceof String) {
            return "Constant{value='" + value + "'}";
        }
        return "Constant{value=" + value + "}";
    }
}
