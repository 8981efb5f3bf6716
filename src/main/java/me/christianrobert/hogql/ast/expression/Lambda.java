package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code (x, y) -> expr} or {@code x -> expr}.
 */
public class Lambda implements Expr {

    private final List<String> args;
    private final Expr expr;

    public Lambda(List<String> args, Expr expr) {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("Lambda args cannot be null or empty");
        }
        if (expr == null) {
            throw new IllegalArgumentException("Lambda expr cannot be null");
        }
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.expr = expr;
    }

    public List<String> getArgs() {
        return args;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitLambda(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Lambda that = (Lambda) o;
        return args.equals(that.args) && expr.equals(that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(args, expr);
    }

    @Override
    public String toString() {
        return "Lambda{args=" + args + ", expr=" + expr + "}";
    }
}
