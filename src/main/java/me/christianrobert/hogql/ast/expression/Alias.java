package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * {@code expr AS alias}. The alias is stored unescaped.
 */
public class Alias implements Expr {

    private final String alias;
    private final Expr expr;

    public Alias(String alias, Expr expr) {
        if (alias == null) {
            throw new IllegalArgumentException("Alias name cannot be null");
        }
        if (expr == null) {
            throw new IllegalArgumentException("Alias expr cannot be null");
        }
        this.alias = alias;
        this.expr = expr;
    }

    public String getAlias() {
        return alias;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitAlias(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alias that = (Alias) o;
        return alias.equals(that.alias) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, expr);
    }

    @Override
    public String toString() {
        return "Alias{alias='" + alias + "', expr=" + expr + "}";
    }
}
