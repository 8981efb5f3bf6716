package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.context.ParsingException;
import me.christianrobert.hogql.context.SyntaxException;
import me.christianrobert.hogql.util.StringLiterals;

/**
 * {@code expr alias}, {@code expr AS identifier} and {@code expr AS 'string'}.
 * Aliases from the reserved keyword set are rejected.
 */
public class VisitAlias {

  public static Expr v(HogQLParser.ColumnExprAliasContext ctx, AstBuilder b) {
    String alias;
    if (ctx.alias() != null) {
      alias = b.visitAsString(ctx.alias());
    } else if (ctx.identifier() != null) {
      alias = b.visitAsString(ctx.identifier());
    } else if (ctx.STRING_LITERAL() != null) {
      alias = StringLiterals.parseString(ctx.STRING_LITERAL().getText());
    } else {
      throw new ParsingException("A ColumnExprAlias must have the alias in some form");
    }

    Expr expr = b.visitAsExpr(ctx.columnExpr());

    if (b.getContext().isReservedAlias(alias)) {
      throw new SyntaxException("Alias '" + alias + "' is a reserved keyword");
    }
    return new Alias(alias, expr);
  }
}
