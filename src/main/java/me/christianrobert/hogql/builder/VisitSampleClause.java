package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.query.RatioExpr;
import me.christianrobert.hogql.ast.query.SampleExpr;

/**
 * {@code SAMPLE 1/10 OFFSET 1/2}.
 */
public class VisitSampleClause {

  public static SampleExpr v(HogQLParser.SampleClauseContext ctx, AstBuilder b) {
    RatioExpr sampleValue = b.visitAs(ctx.ratioExpr(0), RatioExpr.class);
    RatioExpr offsetValue = ctx.OFFSET() != null && ctx.ratioExpr(1) != null
        ? b.visitAs(ctx.ratioExpr(1), RatioExpr.class)
        : null;
    return new SampleExpr(sampleValue, offsetValue);
  }

  public static RatioExpr v(HogQLParser.RatioExprContext ctx, AstBuilder b) {
    Constant left = b.visitAs(ctx.numberLiteral(0), Constant.class);
    Constant right = ctx.SLASH() != null && ctx.numberLiteral().size() > 1
        ? b.visitAs(ctx.numberLiteral(1), Constant.class)
        : null;
    return new RatioExpr(left, right);
  }
}
