package me.christianrobert.hogql.ast.expression;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code name(args) OVER (window)} or {@code name(args) OVER windowName}.
 * Exactly one of {@code overExpr} / {@code overIdentifier} is set.
 */
public class WindowFunction implements Expr {

    private final String name;
    private final List<Expr> args;
    private final WindowExpr overExpr;
    private final String overIdentifier;

    private WindowFunction(String name, List<Expr> args, WindowExpr overExpr, String overIdentifier) {
        if (name == null) {
            throw new IllegalArgumentException("WindowFunction name cannot be null");
        }
        this.name = name;
        this.args = args == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(args));
        this.overExpr = overExpr;
        this.overIdentifier = overIdentifier;
    }

    public static WindowFunction over(String name, List<Expr> args, WindowExpr overExpr) {
        if (overExpr == null) {
            throw new IllegalArgumentException("WindowFunction overExpr cannot be null");
        }
        return new WindowFunction(name, args, overExpr, null);
    }

    public static WindowFunction overNamed(String name, List<Expr> args, String overIdentifier) {
        if (overIdentifier == null) {
            throw new IllegalArgumentException("WindowFunction overIdentifier cannot be null");
        }
        return new WindowFunction(name, args, null, overIdentifier);
    }

    public String getName() {
        return name;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public WindowExpr getOverExpr() {
        return overExpr;
    }

    public String getOverIdentifier() {
        return overIdentifier;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitWindowFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WindowFunction that = (WindowFunction) o;
        return name.equals(that.name)
                && args.equals(that.args)
                && Objects.equals(overExpr, that.overExpr)
                && Objects.equals(overIdentifier, that.overIdentifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, overExpr, overIdentifier);
    }

    @Override
    public String toString() {
        return "WindowFunction{name='" + name + "', args=" + args
                + (overExpr != null ? ", overExpr=" + overExpr : ", overIdentifier='" + overIdentifier + "'")
                + "}";
    }
}
