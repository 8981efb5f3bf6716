package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.ArrayAccess;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.TupleAccess;
import me.christianrobert.hogql.context.SyntaxException;

import java.math.BigInteger;

/**
 * {@code a[i]}, {@code t.1} and {@code expr.name}, plus their null-safe forms {@code a?.[i]},
 * {@code t?.1} and {@code expr?.name} which set the node's {@code nullish} flag.
 *
 * <p>Indices are 1-based; a literal zero index is rejected. Property access on an arbitrary
 * expression desugars to {@code ArrayAccess(expr, 'name')}.
 */
public class VisitAccessExpression {

  static final String ZERO_INDEX_MESSAGE = "SQL indexes start from one, not from zero. E.g: array[1]";

  public static Expr v(HogQLParser.ColumnExprArrayAccessContext ctx, AstBuilder b) {
    Expr array = b.visitAsExpr(ctx.columnExpr(0));
    Expr property = b.visitAsExpr(ctx.columnExpr(1));
    if (property instanceof Constant && ((Constant) property).isZero()) {
      throw new SyntaxException(ZERO_INDEX_MESSAGE);
    }
    return new ArrayAccess(array, property);
  }

  public static Expr v(HogQLParser.ColumnExprTupleAccessContext ctx, AstBuilder b) {
    Expr tuple = b.visitAsExpr(ctx.columnExpr());
    BigInteger index = new BigInteger(ctx.DECIMAL_LITERAL().getText());
    if (index.signum() == 0) {
      throw new SyntaxException(ZERO_INDEX_MESSAGE);
    }
    return new TupleAccess(tuple, index);
  }

  public static Expr v(HogQLParser.ColumnExprPropertyAccessContext ctx, AstBuilder b) {
    Expr object = b.visitAsExpr(ctx.columnExpr());
    String property = b.visitAsString(ctx.identifier());
    return new ArrayAccess(object, new Constant(property));
  }

  public static Expr v(HogQLParser.ColumnExprNullArrayAccessContext ctx, AstBuilder b) {
    Expr array = b.visitAsExpr(ctx.columnExpr(0));
    Expr property = b.visitAsExpr(ctx.columnExpr(1));
    if (property instanceof Constant && ((Constant) property).isZero()) {
      throw new SyntaxException(ZERO_INDEX_MESSAGE);
    }
    return new ArrayAccess(array, property, true);
  }

  public static Expr v(HogQLParser.ColumnExprNullTupleAccessContext ctx, AstBuilder b) {
    Expr tuple = b.visitAsExpr(ctx.columnExpr());
    BigInteger index = new BigInteger(ctx.DECIMAL_LITERAL().getText());
    if (index.signum() == 0) {
      throw new SyntaxException(ZERO_INDEX_MESSAGE);
    }
    return new TupleAccess(tuple, index, true);
  }

  public static Expr v(HogQLParser.ColumnExprNullPropertyAccessContext ctx, AstBuilder b) {
    Expr object = b.visitAsExpr(ctx.columnExpr());
    String property = b.visitAsString(ctx.identifier());
    return new ArrayAccess(object, new Constant(property), true);
  }
}
