package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Array;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.Constant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Desugars CASE into function calls.
 *
 * <p>Grammar:
 * <pre>
 * CASE caseExpr=columnExpr? (WHEN whenExpr=columnExpr THEN thenExpr=columnExpr)+ (ELSE elseExpr=columnExpr)? END
 * </pre>
 *
 * <p>Simple CASE (with a scrutinee):
 * <pre>
 * CASE s WHEN v1 THEN x1 WHEN v2 THEN x2 ELSE z END  =&gt;  transform(s, [v1, v2], [x1, x2], z)
 * </pre>
 *
 * <p>Searched CASE:
 * <pre>
 * CASE WHEN a THEN x ELSE z END                      =&gt;  if(a, x, z)
 * CASE WHEN a THEN x WHEN b THEN y ELSE z END        =&gt;  multiIf(a, x, b, y, z)
 * </pre>
 *
 * <p>A missing ELSE becomes a NULL constant in both forms.
 */
public class VisitCaseExpression {

  public static Expr v(HogQLParser.ColumnExprCaseContext ctx, AstBuilder b) {
    if (ctx == null) {
      throw new IllegalArgumentException("ColumnExprCaseContext cannot be null");
    }

    // sub-expressions in source order: [caseExpr] when then when then ... [else]
    List<Expr> columns = b.visitEach(ctx.columnExpr());
    boolean hasElse = ctx.elseExpr != null;

    if (ctx.caseExpr != null) {
      return buildTransform(columns, hasElse);
    }
    return buildSearchedCase(columns, hasElse);
  }

  private static Expr buildTransform(List<Expr> columns, boolean hasElse) {
    Expr scrutinee = columns.get(0);
    int pairsEnd = hasElse ? columns.size() - 1 : columns.size();

    List<Expr> whens = new ArrayList<>();
    List<Expr> thens = new ArrayList<>();
    for (int i = 1; i < pairsEnd; i += 2) {
      whens.add(columns.get(i));
      thens.add(columns.get(i + 1));
    }
    Expr elseValue = hasElse ? columns.get(columns.size() - 1) : Constant.ofNull();

    return new Call("transform", Arrays.asList(scrutinee, new Array(whens), new Array(thens), elseValue));
  }

  private static Expr buildSearchedCase(List<Expr> columns, boolean hasElse) {
    List<Expr> args = new ArrayList<>(columns);
    if (!hasElse) {
      args.add(Constant.ofNull());
    }
    return new Call(args.size() == 3 ? "if" : "multiIf", args);
  }
}
