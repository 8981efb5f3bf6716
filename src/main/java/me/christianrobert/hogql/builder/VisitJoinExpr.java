package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.query.JoinConstraint;
import me.christianrobert.hogql.ast.query.JoinExpr;
import me.christianrobert.hogql.ast.query.SampleExpr;
import me.christianrobert.hogql.context.ParsingException;

/**
 * Builds left-deep join chains.
 *
 * <p>Grammar:
 * <pre>
 * joinExpr
 *     : joinExpr joinOp? JOIN joinExpr joinConstraintClause  # JoinExprOp
 *     | joinExpr joinOpCross joinExpr                        # JoinExprCrossOp
 *     | tableExpr FINAL? sampleClause?                       # JoinExprTable
 *     | LPAREN joinExpr RPAREN                               # JoinExprParens
 * </pre>
 *
 * <p>The right-hand side is appended at the tail of the left chain, so
 * {@code a JOIN b ON .. JOIN c ON ..} yields {@code a -> b -> c} regardless of how the
 * grammar nested the binary productions. The joined member carries the join type and its
 * ON constraint.
 */
public class VisitJoinExpr {

  public static JoinExpr v(HogQLParser.JoinExprOpContext ctx, AstBuilder b) {
    JoinExpr left = b.visitAs(ctx.joinExpr(0), JoinExpr.class);
    JoinExpr right = b.visitAs(ctx.joinExpr(1), JoinExpr.class);

    String joinType = ctx.joinOp() != null ? b.visitAsString(ctx.joinOp()) + " JOIN" : "JOIN";
    JoinConstraint constraint = b.visitAs(ctx.joinConstraintClause(), JoinConstraint.class);

    return left.appendToChain(right.withJoin(joinType, constraint));
  }

  public static JoinExpr v(HogQLParser.JoinExprCrossOpContext ctx, AstBuilder b) {
    JoinExpr left = b.visitAs(ctx.joinExpr(0), JoinExpr.class);
    JoinExpr right = b.visitAs(ctx.joinExpr(1), JoinExpr.class);

    return left.appendToChain(right.withJoin("CROSS JOIN", null));
  }

  public static JoinExpr v(HogQLParser.JoinExprTableContext ctx, AstBuilder b) {
    SampleExpr sample = ctx.sampleClause() != null ? b.visitAs(ctx.sampleClause(), SampleExpr.class) : null;
    Boolean tableFinal = ctx.FINAL() != null ? Boolean.TRUE : null;

    Object table = b.visit(ctx.tableExpr());
    if (table instanceof JoinExpr) {
      // aliased tables and table functions already come back wrapped
      return ((JoinExpr) table).withFinalAndSample(tableFinal, sample);
    }
    return new JoinExpr(asTable(table)).withFinalAndSample(tableFinal, sample);
  }

  static Expr asTable(Object table) {
    if (!(table instanceof Expr)) {
      throw new ParsingException(
          "Expected a table expression, got " + (table == null ? "null" : table.getClass().getSimpleName()));
    }
    return (Expr) table;
  }
}
