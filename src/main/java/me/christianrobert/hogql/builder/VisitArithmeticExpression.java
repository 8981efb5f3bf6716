package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.ArithmeticOperation;
import me.christianrobert.hogql.ast.expression.ArithmeticOperationOp;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.context.ParsingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Multiplicative and additive precedence tiers, plus unary minus.
 *
 * <ul>
 *   <li>{@code a * b}, {@code a / b}, {@code a % b} - ArithmeticOperation Mult/Div/Mod</li>
 *   <li>{@code a + b}, {@code a - b} - ArithmeticOperation Add/Sub</li>
 *   <li>{@code a || b} - {@code concat(a, b)}, flattened with any concat operand</li>
 *   <li>{@code -a} - {@code 0 - a}</li>
 * </ul>
 */
public class VisitArithmeticExpression {

  public static Expr v(HogQLParser.ColumnExprPrecedence1Context ctx, AstBuilder b) {
    ArithmeticOperationOp op;
    if (ctx.SLASH() != null) {
      op = ArithmeticOperationOp.DIV;
    } else if (ctx.ASTERISK() != null) {
      op = ArithmeticOperationOp.MULT;
    } else if (ctx.PERCENT() != null) {
      op = ArithmeticOperationOp.MOD;
    } else {
      throw new ParsingException("Unsupported value of rule ColumnExprPrecedence1");
    }
    return new ArithmeticOperation(op, b.visitAsExpr(ctx.left), b.visitAsExpr(ctx.right));
  }

  public static Expr v(HogQLParser.ColumnExprPrecedence2Context ctx, AstBuilder b) {
    Expr left = b.visitAsExpr(ctx.left);
    Expr right = b.visitAsExpr(ctx.right);

    if (ctx.PLUS() != null) {
      return new ArithmeticOperation(ArithmeticOperationOp.ADD, left, right);
    }
    if (ctx.DASH() != null) {
      return new ArithmeticOperation(ArithmeticOperationOp.SUB, left, right);
    }
    if (ctx.CONCAT() != null) {
      List<Expr> args = new ArrayList<>();
      addConcatOperand(args, left);
      addConcatOperand(args, right);
      return new Call("concat", args);
    }
    throw new ParsingException("Unsupported value of rule ColumnExprPrecedence2");
  }

  public static Expr v(HogQLParser.ColumnExprNegateContext ctx, AstBuilder b) {
    return new ArithmeticOperation(ArithmeticOperationOp.SUB, Constant.of(0), b.visitAsExpr(ctx.columnExpr()));
  }

  private static void addConcatOperand(List<Expr> args, Expr operand) {
    if (operand instanceof Call && "concat".equals(((Call) operand).getName())) {
      args.addAll(((Call) operand).getArgs());
    } else {
      args.add(operand);
    }
  }
}
