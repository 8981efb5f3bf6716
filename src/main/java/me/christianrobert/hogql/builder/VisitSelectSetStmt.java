package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.query.SelectQuery;
import me.christianrobert.hogql.ast.query.SelectSetNode;
import me.christianrobert.hogql.ast.query.SelectSetQuery;
import me.christianrobert.hogql.ast.query.SetOperator;
import me.christianrobert.hogql.context.ParsingException;
import me.christianrobert.hogql.context.SyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code s1 UNION ALL s2 EXCEPT (s3 INTERSECT s4)} becomes a {@link SelectSetQuery}: the first
 * member plus one {@link SelectSetNode} per following member, tagged with its operator.
 *
 * <p>A parenthesized member that is itself a UNION ALL chain is spliced in when it is attached
 * with UNION ALL (or is the first member of an all-UNION ALL set). Any other nested set keeps its
 * grouping. A set with a single member is returned as that member.
 */
public class VisitSelectSetStmt {

  public static Expr v(HogQLParser.SelectSetStmtContext ctx, AstBuilder b) {
    Expr initial = member(b.visitAsExpr(ctx.selectStmtWithParens()));

    List<SelectSetNode> subsequent = new ArrayList<>();
    for (HogQLParser.SubsequentSelectSetClauseContext clause : ctx.subsequentSelectSetClause()) {
      SetOperator operator = operator(clause);
      Expr query = member(b.visitAsExpr(clause.selectStmtWithParens()));
      if (operator == SetOperator.UNION_ALL && query instanceof SelectSetQuery
          && ((SelectSetQuery) query).isUnionAllOnly()) {
        SelectSetQuery nested = (SelectSetQuery) query;
        subsequent.add(new SelectSetNode(SetOperator.UNION_ALL, nested.getInitialSelectQuery()));
        subsequent.addAll(nested.getSubsequentSelectQueries());
      } else {
        subsequent.add(new SelectSetNode(operator, query));
      }
    }

    if (subsequent.isEmpty()) {
      return initial;
    }

    if (initial instanceof SelectSetQuery && ((SelectSetQuery) initial).isUnionAllOnly()
        && allUnionAll(subsequent)) {
      SelectSetQuery nested = (SelectSetQuery) initial;
      List<SelectSetNode> merged = new ArrayList<>(nested.getSubsequentSelectQueries());
      merged.addAll(subsequent);
      return new SelectSetQuery(nested.getInitialSelectQuery(), merged);
    }
    return new SelectSetQuery(initial, subsequent);
  }

  static SetOperator operator(HogQLParser.SubsequentSelectSetClauseContext clause) {
    if (clause.UNION() != null && clause.ALL() != null) {
      return SetOperator.UNION_ALL;
    }
    if (clause.UNION() != null && clause.DISTINCT() != null) {
      return SetOperator.UNION_DISTINCT;
    }
    if (clause.INTERSECT() != null && clause.DISTINCT() != null) {
      return SetOperator.INTERSECT_DISTINCT;
    }
    if (clause.INTERSECT() != null) {
      return SetOperator.INTERSECT;
    }
    if (clause.EXCEPT() != null) {
      return SetOperator.EXCEPT;
    }
    throw new SyntaxException(
        "Set operator must be one of UNION ALL, UNION DISTINCT, INTERSECT, INTERSECT DISTINCT, and EXCEPT");
  }

  private static boolean allUnionAll(List<SelectSetNode> nodes) {
    for (SelectSetNode node : nodes) {
      if (node.getSetOperator() != SetOperator.UNION_ALL) {
        return false;
      }
    }
    return true;
  }

  private static Expr member(Expr query) {
    if (query instanceof SelectQuery || query instanceof SelectSetQuery) {
      return query;
    }
    throw new ParsingException("Set member is not a SELECT: " + query.getClass().getSimpleName());
  }
}
