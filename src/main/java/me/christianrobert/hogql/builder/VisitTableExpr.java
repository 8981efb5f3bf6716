package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.query.JoinExpr;
import me.christianrobert.hogql.context.SyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Table references in FROM / JOIN.
 *
 * <p>Aliased tables and table functions come back as a {@link JoinExpr} so that the alias or
 * the function arguments travel with the table; {@link VisitJoinExpr} then adds FINAL and SAMPLE.
 */
public class VisitTableExpr {

  public static Field v(HogQLParser.TableExprIdentifierContext ctx, AstBuilder b) {
    return new Field(b.visitAsStringList(ctx.tableIdentifier()));
  }

  public static JoinExpr v(HogQLParser.TableExprAliasContext ctx, AstBuilder b) {
    String alias = ctx.alias() != null ? b.visitAsString(ctx.alias()) : b.visitAsString(ctx.identifier());
    if (b.getContext().isReservedAlias(alias)) {
      throw new SyntaxException("Alias '" + alias + "' is a reserved keyword");
    }

    Object table = b.visit(ctx.tableExpr());
    if (table instanceof JoinExpr) {
      return ((JoinExpr) table).withAlias(alias);
    }
    return new JoinExpr(VisitJoinExpr.asTable(table)).withAlias(alias);
  }

  /**
   * {@code numbers(1, 10)} becomes a join member on {@code Field([numbers])} with table arguments.
   */
  public static JoinExpr v(HogQLParser.TableFunctionExprContext ctx, AstBuilder b) {
    String name = b.visitAsString(ctx.identifier());
    List<Expr> tableArgs = b.visitAsExprListOrNull(ctx.tableArgList());
    return new JoinExpr(new Field(Collections.singletonList(name)), tableArgs);
  }

  public static List<String> v(HogQLParser.TableIdentifierContext ctx, AstBuilder b) {
    List<String> chain = new ArrayList<>(2);
    if (ctx.databaseIdentifier() != null) {
      chain.add(b.visitAsString(ctx.databaseIdentifier()));
    }
    chain.add(b.visitAsString(ctx.identifier()));
    return chain;
  }
}
