package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

/**
 * A {@code {name}} parameter, substituted by the host before execution.
 */
public class Placeholder implements Expr {

    private final String field;

    public Placeholder(String field) {
        if (field == null) {
            throw new IllegalArgumentException("Placeholder field cannot be null");
        }
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitPlaceholder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return field.equals(((Placeholder) o).field);
    }

    @Override
    public int hashCode() {
        return field.hashCode();
    }

    @Override
    public String toString() {
        return "Placeholder{field='" + field + "'}";
    }
}
