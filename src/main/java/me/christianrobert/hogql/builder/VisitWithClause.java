package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.query.CTE;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WITH clause entries.
 *
 * <pre>
 * withExpr
 *     : identifier AS LPAREN selectSetStmt RPAREN    # WithExprSubquery
 *     | columnExpr AS identifier                       # WithExprColumn
 * </pre>
 */
public class VisitWithClause {

  /**
   * Keys CTEs by name in source order. A repeated name replaces the earlier entry.
   */
  public static Map<String, CTE> v(HogQLParser.WithExprListContext ctx, AstBuilder b) {
    Map<String, CTE> ctes = new LinkedHashMap<>();
    for (HogQLParser.WithExprContext withExpr : ctx.withExpr()) {
      CTE cte = b.visitAs(withExpr, CTE.class);
      ctes.put(cte.getName(), cte);
    }
    return ctes;
  }

  public static CTE v(HogQLParser.WithExprSubqueryContext ctx, AstBuilder b) {
    return new CTE(b.visitAsString(ctx.identifier()), b.visitAsExpr(ctx.selectSetStmt()), CTE.CteType.SUBQUERY);
  }

  public static CTE v(HogQLParser.WithExprColumnContext ctx, AstBuilder b) {
    return new CTE(b.visitAsString(ctx.identifier()), b.visitAsExpr(ctx.columnExpr()), CTE.CteType.COLUMN);
  }
}
