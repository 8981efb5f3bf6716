package me.christianrobert.hogql.ast;

import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.ast.expression.And;
import me.christianrobert.hogql.ast.expression.ArithmeticOperation;
import me.christianrobert.hogql.ast.expression.Array;
import me.christianrobert.hogql.ast.expression.ArrayAccess;
import me.christianrobert.hogql.ast.expression.BetweenExpr;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.CompareOperation;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.expression.Lambda;
import me.christianrobert.hogql.ast.expression.Not;
import me.christianrobert.hogql.ast.expression.Or;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.Placeholder;
import me.christianrobert.hogql.ast.expression.Tuple;
import me.christianrobert.hogql.ast.expression.TupleAccess;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.expression.WindowFrameExpr;
import me.christianrobert.hogql.ast.expression.WindowFunction;
import me.christianrobert.hogql.ast.query.CTE;
import me.christianrobert.hogql.ast.query.JoinConstraint;
import me.christianrobert.hogql.ast.query.JoinExpr;
import me.christianrobert.hogql.ast.query.RatioExpr;
import me.christianrobert.hogql.ast.query.SampleExpr;
import me.christianrobert.hogql.ast.query.SelectQuery;
import me.christianrobert.hogql.ast.query.SelectSetNode;
import me.christianrobert.hogql.ast.query.SelectSetQuery;

/**
 * Visitor over the closed set of AST node kinds.
 */
public interface AstVisitor<T> {

    // ========== EXPRESSIONS ==========

    T visitConstant(Constant node);

    T visitField(Field node);

    T visitPlaceholder(Placeholder node);

    T visitCall(Call node);

    T visitArithmeticOperation(ArithmeticOperation node);

    T visitCompareOperation(CompareOperation node);

    T visitBetweenExpr(BetweenExpr node);

    T visitAnd(And node);

    T visitOr(Or node);

    T visitNot(Not node);

    T visitAlias(Alias node);

    T visitTuple(Tuple node);

    T visitArray(Array node);

    T visitArrayAccess(ArrayAccess node);

    T visitTupleAccess(TupleAccess node);

    T visitLambda(Lambda node);

    T visitWindowFunction(WindowFunction node);

    T visitOrderExpr(OrderExpr node);

    T visitWindowExpr(WindowExpr node);

    T visitWindowFrameExpr(WindowFrameExpr node);

    // ========== QUERIES ==========

    T visitSelectQuery(SelectQuery node);

    T visitSelectSetQuery(SelectSetQuery node);

    T visitSelectSetNode(SelectSetNode node);

    T visitJoinExpr(JoinExpr node);

    T visitJoinConstraint(JoinConstraint node);

    T visitSampleExpr(SampleExpr node);

    T visitRatioExpr(RatioExpr node);

    T visitCTE(CTE node);
}
