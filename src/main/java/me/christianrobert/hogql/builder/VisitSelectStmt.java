package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.query.CTE;
import me.christianrobert.hogql.ast.query.JoinExpr;
import me.christianrobert.hogql.ast.query.SelectQuery;
import me.christianrobert.hogql.context.NotImplementedException;
import me.christianrobert.hogql.context.SyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link SelectQuery} from the clauses of a selectStmt.
 *
 * <p>Grammar:
 * <pre>
 * selectStmt:
 *     withClause? SELECT DISTINCT? topClause? columnExprList
 *     fromClause? arrayJoinClause? prewhereClause? whereClause?
 *     groupByClause? (WITH (CUBE | ROLLUP))? (WITH TOTALS)? havingClause?
 *     windowClause? orderByClause? (limitAndOffsetClause | offsetOnlyClause)? settingsClause?
 * </pre>
 *
 * <p>WINDOW, LIMIT and ARRAY JOIN are read positionally here rather than visited as rules.
 * ARRAY JOIN is validated: it needs a FROM clause and every member must be aliased. An unaliased
 * member is reported with its own span.
 */
public class VisitSelectStmt {

  public static SelectQuery v(HogQLParser.SelectStmtContext ctx, AstBuilder b) {
    SelectQuery.Builder query = SelectQuery.builder()
        .ctes(ctes(ctx.withClause(), b))
        .select(b.visitAsExprListOrEmpty(ctx.columnExprList()))
        .distinct(ctx.DISTINCT() != null)
        .selectFrom(ctx.fromClause() != null ? b.visitAs(ctx.fromClause(), JoinExpr.class) : null)
        .where(b.visitAsExprOrNull(ctx.whereClause()))
        .prewhere(b.visitAsExprOrNull(ctx.prewhereClause()))
        .having(b.visitAsExprOrNull(ctx.havingClause()))
        .groupBy(b.visitAsExprListOrNull(ctx.groupByClause()))
        .orderBy(orderExprs(ctx.orderByClause(), b));

    HogQLParser.WindowClauseContext windowClause = ctx.windowClause();
    if (windowClause != null) {
      query.windowExprs(windowExprs(windowClause, b));
    }

    HogQLParser.LimitAndOffsetClauseContext limitClause = ctx.limitAndOffsetClause();
    if (limitClause != null) {
      query.limit(b.visitAsExpr(limitClause.columnExpr(0)));
      if (limitClause.columnExpr(1) != null) {
        query.offset(b.visitAsExpr(limitClause.columnExpr(1)));
      }
      if (limitClause.columnExprList() != null) {
        query.limitBy(b.visitAsExprList(limitClause.columnExprList()));
      }
      if (limitClause.WITH() != null && limitClause.TIES() != null) {
        query.limitWithTies(true);
      }
    } else if (ctx.offsetOnlyClause() != null) {
      query.offset(b.visitAsExpr(ctx.offsetOnlyClause()));
    }

    HogQLParser.ArrayJoinClauseContext arrayJoinClause = ctx.arrayJoinClause();
    if (arrayJoinClause != null) {
      if (query.getSelectFrom() == null) {
        throw new SyntaxException("Using ARRAY JOIN without a FROM clause is not permitted");
      }
      List<HogQLParser.ColumnExprContext> members = arrayJoinClause.columnExprList().columnExpr();
      List<Expr> arrayJoinList = b.visitAsExprList(arrayJoinClause.columnExprList());
      for (int i = 0; i < arrayJoinList.size(); i++) {
        if (!(arrayJoinList.get(i) instanceof Alias)) {
          HogQLParser.ColumnExprContext member = members.get(i);
          int start = member.getStart().getStartIndex();
          int end = member.getStop().getStopIndex() + 1;
          throw new SyntaxException("ARRAY JOIN arrays must have an alias", start, end);
        }
      }
      query.arrayJoin(arrayJoinOp(arrayJoinClause), arrayJoinList);
    }

    if (ctx.topClause() != null) {
      throw new NotImplementedException("Unsupported: SelectStmt.topClause()");
    }
    if (ctx.settingsClause() != null) {
      throw new NotImplementedException("Unsupported: SelectStmt.settingsClause()");
    }

    return query.build();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, CTE> ctes(HogQLParser.WithClauseContext ctx, AstBuilder b) {
    if (ctx == null) {
      return null;
    }
    return (Map<String, CTE>) b.visitAs(ctx, Map.class);
  }

  private static List<OrderExpr> orderExprs(HogQLParser.OrderByClauseContext ctx, AstBuilder b) {
    if (ctx == null) {
      return null;
    }
    List<OrderExpr> result = new ArrayList<>();
    for (Expr expr : b.visitAsExprList(ctx)) {
      result.add((OrderExpr) expr);
    }
    return result;
  }

  // WINDOW a AS (...), b AS (...) pairs identifiers with window expressions by position
  private static Map<String, WindowExpr> windowExprs(HogQLParser.WindowClauseContext ctx, AstBuilder b) {
    List<HogQLParser.IdentifierContext> names = ctx.identifier();
    List<HogQLParser.WindowExprContext> exprs = ctx.windowExpr();
    Map<String, WindowExpr> result = new LinkedHashMap<>();
    for (int i = 0; i < exprs.size(); i++) {
      result.put(b.visitAsString(names.get(i)), b.visitAs(exprs.get(i), WindowExpr.class));
    }
    return result;
  }

  private static String arrayJoinOp(HogQLParser.ArrayJoinClauseContext ctx) {
    if (ctx.LEFT() != null) {
      return "LEFT ARRAY JOIN";
    }
    if (ctx.INNER() != null) {
      return "INNER ARRAY JOIN";
    }
    return "ARRAY JOIN";
  }
}
