package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.query.JoinConstraint;
import me.christianrobert.hogql.context.SyntaxException;

import java.util.List;

/**
 * Only {@code ON <single expression>} is accepted; USING and multi-expression ON are rejected.
 */
public class VisitJoinConstraintClause {

  public static JoinConstraint v(HogQLParser.JoinConstraintClauseContext ctx, AstBuilder b) {
    if (ctx.USING() != null) {
      throw new SyntaxException("Unsupported: JOIN ... USING");
    }
    List<Expr> exprs = b.visitAsExprList(ctx.columnExprList());
    if (exprs.size() != 1) {
      throw new SyntaxException("Unsupported: JOIN ... ON with multiple expressions");
    }
    return new JoinConstraint(exprs.get(0));
  }
}
