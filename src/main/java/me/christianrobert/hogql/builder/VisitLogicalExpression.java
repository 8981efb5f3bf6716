package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.And;
import me.christianrobert.hogql.ast.expression.Not;
import me.christianrobert.hogql.ast.expression.Or;

import java.util.ArrayList;
import java.util.List;

/**
 * AND / OR / NOT.
 *
 * <p>AND and OR are flattened on construction: an operand of the same connective is spliced
 * into the new operand list, so {@code a AND (b AND c)} and {@code (a AND b) AND c} both give
 * {@code And[a, b, c]}.
 */
public class VisitLogicalExpression {

  public static Expr v(HogQLParser.ColumnExprAndContext ctx, AstBuilder b) {
    Expr left = b.visitAsExpr(ctx.columnExpr(0));
    Expr right = b.visitAsExpr(ctx.columnExpr(1));

    List<Expr> exprs = new ArrayList<>();
    for (Expr operand : new Expr[] {left, right}) {
      if (operand instanceof And) {
        exprs.addAll(((And) operand).getExprs());
      } else {
        exprs.add(operand);
      }
    }
    return new And(exprs);
  }

  public static Expr v(HogQLParser.ColumnExprOrContext ctx, AstBuilder b) {
    Expr left = b.visitAsExpr(ctx.columnExpr(0));
    Expr right = b.visitAsExpr(ctx.columnExpr(1));

    List<Expr> exprs = new ArrayList<>();
    for (Expr operand : new Expr[] {left, right}) {
      if (operand instanceof Or) {
        exprs.addAll(((Or) operand).getExprs());
      } else {
        exprs.add(operand);
      }
    }
    return new Or(exprs);
  }

  public static Expr v(HogQLParser.ColumnExprNotContext ctx, AstBuilder b) {
    return new Not(b.visitAsExpr(ctx.columnExpr()));
  }
}
