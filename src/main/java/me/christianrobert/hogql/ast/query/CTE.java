package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.Objects;

/**
 * A WITH clause entry: either {@code name AS (SELECT ...)} or {@code expr AS name}.
 */
public class CTE implements AstNode {

    public enum CteType {
        SUBQUERY("subquery"),
        COLUMN("column");

        private final String value;

        CteType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final String name;
    private final Expr expr;
    private final CteType cteType;

    public CTE(String name, Expr expr, CteType cteType) {
        if (name == null) {
            throw new IllegalArgumentException("CTE name cannot be null");
        }
        if (expr == null) {
            throw new IllegalArgumentException("CTE expr cannot be null");
        }
        if (cteType == null) {
            throw new IllegalArgumentException("CTE type cannot be null");
        }
        this.name = name;
        this.expr = expr;
        this.cteType = cteType;
    }

    public String getName() {
        return name;
    }

    public Expr getExpr() {
        return expr;
    }

    public CteType getCteType() {
        return cteType;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitCTE(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CTE that = (CTE) o;
        return name.equals(that.name) && expr.equals(that.expr) && cteType == that.cteType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expr, cteType);
    }

    @Override
    public String toString() {
        return "CTE{name='" + name + "', cteType=" + cteType + ", expr=" + expr + "}";
    }
}
