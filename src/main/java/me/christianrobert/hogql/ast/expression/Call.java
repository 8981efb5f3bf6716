package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function call: {@code name(params)(args)}.
 *
 * <p>Parametric aggregates such as {@code quantile(0.5)(x)} carry the first parenthesized
 * list in {@code params}; for plain calls {@code params} is null.
 * Several surface constructs desugar into calls ({@code if}, {@code multiIf}, {@code transform},
 * {@code ifNull}, {@code concat}, {@code toInterval*}).
 */
public class Call implements Expr {

    private final String name;
    private final List<Expr> params;
    private final List<Expr> args;
    private final boolean distinct;

    public Call(String name, List<Expr> args) {
        this(name, null, args, false);
    }

    public Call(String name, List<Expr> params, List<Expr> args, boolean distinct) {
        if (name == null) {
            throw new IllegalArgumentException("Call name cannot be null");
        }
        if (args == null) {
            throw new IllegalArgumentException("Call args cannot be null");
        }
        this.name = name;
        this.params = params == null ? null : Collections.unmodifiableList(new ArrayList<>(params));
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.distinct = distinct;
    }

    public String getName() {
        return name;
    }

    public List<Expr> getParams() {
        return params;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public boolean isDistinct() {
        return distinct;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Call call = (Call) o;
        return distinct == call.distinct
                && name.equals(call.name)
                && Objects.equals(params, call.params)
                && args.equals(call.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, params, args, distinct);
    }

    @Override
    public String toString() {
        return "Call{name='" + name + "'"
                + (params != null ? ", params=" + params : "")
                + ", args=" + args
                + (distinct ? ", distinct=true" : "")
                + "}";
    }
}
