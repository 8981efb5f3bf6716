package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.expression.Placeholder;
import me.christianrobert.hogql.util.StringLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Column references.
 *
 * <p>{@code {name}} gives a Placeholder. Otherwise the optional table prefix and the nested
 * identifier segments are joined into one Field chain, except that a bare {@code true} or
 * {@code false} (any case, unqualified) is a boolean constant.
 */
public class VisitColumnIdentifier {

  public static Expr v(HogQLParser.ColumnIdentifierContext ctx, AstBuilder b) {
    if (ctx.PLACEHOLDER() != null) {
      return new Placeholder(StringLiterals.parseString(ctx.PLACEHOLDER().getText()));
    }

    List<String> table = ctx.tableIdentifier() != null
        ? b.visitAsStringList(ctx.tableIdentifier())
        : new ArrayList<>();
    List<String> nested = ctx.nestedIdentifier() != null
        ? b.visitAsStringList(ctx.nestedIdentifier())
        : new ArrayList<>();

    if (table.isEmpty() && !nested.isEmpty()) {
      String text = ctx.getText().toLowerCase(Locale.ROOT);
      if (text.equals("true")) {
        return new Constant(Boolean.TRUE);
      }
      if (text.equals("false")) {
        return new Constant(Boolean.FALSE);
      }
      return new Field(nested);
    }

    List<String> chain = new ArrayList<>(table);
    chain.addAll(nested);
    return new Field(chain);
  }

  public static Expr v(HogQLParser.ColumnExprAsteriskContext ctx, AstBuilder b) {
    List<String> chain = new ArrayList<>();
    if (ctx.tableIdentifier() != null) {
      chain.addAll(b.visitAsStringList(ctx.tableIdentifier()));
    }
    chain.add("*");
    return new Field(chain);
  }

  public static List<String> v(HogQLParser.NestedIdentifierContext ctx, AstBuilder b) {
    List<String> segments = new ArrayList<>();
    for (HogQLParser.IdentifierContext identifier : ctx.identifier()) {
      segments.add(b.visitAsString(identifier));
    }
    return segments;
  }
}
