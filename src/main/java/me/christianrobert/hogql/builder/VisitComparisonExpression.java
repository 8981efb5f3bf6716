package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.BetweenExpr;
import me.christianrobert.hogql.ast.expression.CompareOperation;
import me.christianrobert.hogql.ast.expression.CompareOperationOp;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.context.ParsingException;

/**
 * Comparison tier, IS [NOT] NULL and [NOT] BETWEEN.
 *
 * <p>Exactly one operator token is present on a ColumnExprPrecedence3 node; NOT and COHORT
 * only qualify IN / LIKE / ILIKE.
 */
public class VisitComparisonExpression {

  public static Expr v(HogQLParser.ColumnExprPrecedence3Context ctx, AstBuilder b) {
    CompareOperationOp op = resolveOperator(ctx);
    return new CompareOperation(op, b.visitAsExpr(ctx.left), b.visitAsExpr(ctx.right));
  }

  public static Expr v(HogQLParser.ColumnExprIsNullContext ctx, AstBuilder b) {
    CompareOperationOp op = ctx.NOT() != null ? CompareOperationOp.NOT_EQ : CompareOperationOp.EQ;
    return new CompareOperation(op, b.visitAsExpr(ctx.columnExpr()), Constant.ofNull());
  }

  public static Expr v(HogQLParser.ColumnExprBetweenContext ctx, AstBuilder b) {
    Expr expr = b.visitAsExpr(ctx.columnExpr(0));
    Expr low = b.visitAsExpr(ctx.columnExpr(1));
    Expr high = b.visitAsExpr(ctx.columnExpr(2));
    return new BetweenExpr(expr, low, high, ctx.NOT() != null);
  }

  static CompareOperationOp resolveOperator(HogQLParser.ColumnExprPrecedence3Context ctx) {
    boolean not = ctx.NOT() != null;

    if (ctx.EQ_SINGLE() != null || ctx.EQ_DOUBLE() != null) {
      return CompareOperationOp.EQ;
    }
    if (ctx.NOT_EQ() != null) {
      return CompareOperationOp.NOT_EQ;
    }
    if (ctx.LT() != null) {
      return CompareOperationOp.LT;
    }
    if (ctx.LT_EQ() != null) {
      return CompareOperationOp.LT_EQ;
    }
    if (ctx.GT() != null) {
      return CompareOperationOp.GT;
    }
    if (ctx.GT_EQ() != null) {
      return CompareOperationOp.GT_EQ;
    }
    if (ctx.LIKE() != null) {
      return not ? CompareOperationOp.NOT_LIKE : CompareOperationOp.LIKE;
    }
    if (ctx.ILIKE() != null) {
      return not ? CompareOperationOp.NOT_ILIKE : CompareOperationOp.ILIKE;
    }
    if (ctx.REGEX_SINGLE() != null || ctx.REGEX_DOUBLE() != null) {
      return CompareOperationOp.REGEX;
    }
    if (ctx.NOT_REGEX() != null) {
      return CompareOperationOp.NOT_REGEX;
    }
    if (ctx.IREGEX_SINGLE() != null || ctx.IREGEX_DOUBLE() != null) {
      return CompareOperationOp.IREGEX;
    }
    if (ctx.NOT_IREGEX() != null) {
      return CompareOperationOp.NOT_IREGEX;
    }
    if (ctx.IN() != null) {
      if (ctx.COHORT() != null) {
        return not ? CompareOperationOp.NOT_IN_COHORT : CompareOperationOp.IN_COHORT;
      }
      return not ? CompareOperationOp.NOT_IN : CompareOperationOp.IN;
    }
    throw new ParsingException("Unsupported value of rule ColumnExprPrecedence3");
  }
}
