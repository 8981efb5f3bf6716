package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A column or table reference, e.g. {@code ["events", "timestamp"]} or {@code ["t", "*"]}.
 */
public class Field implements Expr {

    private final List<String> chain;

    public Field(List<String> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Field chain cannot be null or empty");
        }
        this.chain = Collections.unmodifiableList(new ArrayList<>(chain));
    }

    public List<String> getChain() {
        return chain;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return chain.equals(((Field) o).chain);
    }

    @Override
    public int hashCode() {
        return chain.hashCode();
    }

    @Override
    public String toString() {
        return "Field{chain=" + chain + "}";
    }
}
