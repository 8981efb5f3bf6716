package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.expression.WindowFrameExpr;
import me.christianrobert.hogql.context.ParsingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Window specifications.
 *
 * <pre>
 * windowExpr: winPartitionByClause? winOrderByClause? winFrameClause?;
 * winFrameClause: (ROWS | RANGE) winFrameExtend;
 * winFrameExtend: winFrameBound | BETWEEN winFrameBound AND winFrameBound;
 * </pre>
 */
public class VisitWindowExpr {

  public static WindowExpr v(HogQLParser.WindowExprContext ctx, AstBuilder b) {
    List<Expr> partitionBy = b.visitAsExprListOrNull(ctx.winPartitionByClause());

    List<OrderExpr> orderBy = null;
    if (ctx.winOrderByClause() != null) {
      orderBy = new ArrayList<>();
      for (Expr expr : b.visitAsExprList(ctx.winOrderByClause())) {
        orderBy.add((OrderExpr) expr);
      }
    }

    HogQLParser.WinFrameClauseContext frameClause = ctx.winFrameClause();
    if (frameClause == null) {
      return new WindowExpr(partitionBy, orderBy, null, null, null);
    }

    WindowExpr.FrameMethod frameMethod = frameClause.RANGE() != null
        ? WindowExpr.FrameMethod.RANGE
        : WindowExpr.FrameMethod.ROWS;

    // one bound for "ROWS x", two for "ROWS BETWEEN x AND y"
    List<?> bounds = b.visitAs(frameClause, List.class);
    WindowFrameExpr frameStart = asBound(bounds.get(0));
    WindowFrameExpr frameEnd = bounds.size() > 1 ? asBound(bounds.get(1)) : null;

    return new WindowExpr(partitionBy, orderBy, frameMethod, frameStart, frameEnd);
  }

  public static WindowFrameExpr v(HogQLParser.WinFrameBoundContext ctx, AstBuilder b) {
    if (ctx.PRECEDING() != null || ctx.FOLLOWING() != null) {
      Number frameValue = null;
      if (ctx.numberLiteral() != null) {
        frameValue = (Number) b.visitAs(ctx.numberLiteral(), Constant.class).getValue();
      }
      WindowFrameExpr.FrameType frameType = ctx.PRECEDING() != null
          ? WindowFrameExpr.FrameType.PRECEDING
          : WindowFrameExpr.FrameType.FOLLOWING;
      return new WindowFrameExpr(frameType, frameValue);
    }
    return new WindowFrameExpr(WindowFrameExpr.FrameType.CURRENT_ROW, null);
  }

  private static WindowFrameExpr asBound(Object bound) {
    if (!(bound instanceof WindowFrameExpr)) {
      throw new ParsingException("Expected a window frame bound");
    }
    return (WindowFrameExpr) bound;
  }
}
