package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.math.BigInteger;
import java.util.Objects;

/**
 * {@code tuple.N} with a 1-based positive index; {@code tuple?.N} sets {@code nullish}.
 */
public class TupleAccess implements Expr {

    private final Expr tuple;
    private final BigInteger index;
    private final boolean nullish;

    public TupleAccess(Expr tuple, BigInteger index) {
        this(tuple, index, false);
    }

    public TupleAccess(Expr tuple, BigInteger index, boolean nullish) {
        if (tuple == null) {
            throw new IllegalArgumentException("TupleAccess tuple cannot be null");
        }
        if (index == null || index.signum() <= 0) {
            throw new IllegalArgumentException("TupleAccess index must be a positive integer");
        }
        this.tuple = tuple;
        this.index = index;
        this.nullish = nullish;
    }

    public Expr getTuple() {
        return tuple;
    }

    public BigInteger getIndex() {
        return index;
    }

    public boolean isNullish() {
        return nullish;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitTupleAccess(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TupleAccess that = (TupleAccess) o;
        return nullish == that.nullish && tuple.equals(that.tuple) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tuple, index, nullish);
    }

    @Override
    public String toString() {
        return "TupleAccess{tuple=" + tuple + ", index=" + index + ", nullish=" + nullish + "}";
    }
}
