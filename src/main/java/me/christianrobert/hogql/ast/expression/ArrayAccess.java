package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * {@code array[property]}, also produced by dotted property access on a non-identifier
 * ({@code expr.name} becomes {@code expr['name']}). Literal indices are 1-based.
 * The null-safe forms {@code a?.[i]} and {@code a?.name} set {@code nullish}.
 */
public class ArrayAccess implements Expr {

    private final Expr array;
    private final Expr property;
    private final boolean nullish;

    public ArrayAccess(Expr array, Expr property) {
        this(array, property, false);
    }

    public ArrayAccess(Expr array, Expr property, boolean nullish) {
        if (array == null || property == null) {
            throw new IllegalArgumentException("ArrayAccess array and property cannot be null");
        }
        this.array = array;
        this.property = property;
        this.nullish = nullish;
    }

    public Expr getArray() {
        return array;
    }

    public Expr getProperty() {
        return property;
    }

    public boolean isNullish() {
        return nullish;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitArrayAccess(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArrayAccess that = (ArrayAccess) o;
        return nullish == that.nullish && array.equals(that.array) && property.equals(that.property);
    }

    @Override
    public int hashCode() {
        return Objects.hash(array, property, nullish);
    }

    @Override
    public String toString() {
        return "ArrayAccess{array=" + array + ", property=" + property + ", nullish=" + nullish + "}";
    }
}
