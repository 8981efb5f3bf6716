package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.expression.OrderExpr;

public class VisitOrderExpr {

  // NULLS FIRST/LAST and COLLATE are parsed and dropped
  public static OrderExpr v(HogQLParser.OrderExprContext ctx, AstBuilder b) {
    OrderExpr.Order order = ctx.DESC() != null || ctx.DESCENDING() != null
        ? OrderExpr.Order.DESC
        : OrderExpr.Order.ASC;
    return new OrderExpr(b.visitAsExpr(ctx.columnExpr()), order);
  }
}
