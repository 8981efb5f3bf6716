package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Lambda;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.expression.WindowFunction;
import me.christianrobert.hogql.context.ParsingException;
import me.christianrobert.hogql.util.StringLiterals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Function calls and the surface forms that desugar into them.
 *
 * <ul>
 *   <li>{@code f(x)}, {@code f(DISTINCT x)}, {@code quantile(0.5)(x)} - Call with optional params</li>
 *   <li>{@code f(x) OVER (...)}, {@code f(x) OVER w} - WindowFunction</li>
 *   <li>{@code INTERVAL 3 DAY} - {@code toIntervalDay(3)}</li>
 *   <li>{@code c ? a : b} - {@code if(c, a, b)}</li>
 *   <li>{@code a ?? b} - {@code ifNull(a, b)}</li>
 *   <li>{@code TRIM(LEADING 'x' FROM s)} - {@code trimLeft(s, 'x')}; TRAILING and BOTH give
 *       {@code trimRight} and {@code trim}</li>
 *   <li>{@code (x, y) -> x + y} - Lambda (argument position only)</li>
 * </ul>
 */
public class VisitFunctionCall {

  public static Expr v(HogQLParser.ColumnExprFunctionContext ctx, AstBuilder b) {
    String name = b.visitAsString(ctx.identifier());
    List<Expr> params = b.visitAsExprListOrNull(ctx.columnExprList());
    List<Expr> args = b.visitAsExprListOrEmpty(ctx.columnArgList());
    return new Call(name, params, args, ctx.DISTINCT() != null);
  }

  public static Expr v(HogQLParser.ColumnExprWinFunctionContext ctx, AstBuilder b) {
    String name = b.visitAsString(ctx.identifier());
    List<Expr> args = b.visitAsExprListOrEmpty(ctx.columnExprList());
    WindowExpr overExpr = b.visitAs(ctx.windowExpr(), WindowExpr.class);
    return WindowFunction.over(name, args, overExpr);
  }

  public static Expr v(HogQLParser.ColumnExprWinFunctionTargetContext ctx, AstBuilder b) {
    String name = b.visitAsString(ctx.identifier(0));
    String overIdentifier = b.visitAsString(ctx.identifier(1));
    List<Expr> args = b.visitAsExprListOrEmpty(ctx.columnExprList());
    return WindowFunction.overNamed(name, args, overIdentifier);
  }

  public static Expr v(HogQLParser.ColumnExprTrimContext ctx, AstBuilder b) {
    String name;
    if (ctx.LEADING() != null) {
      name = "trimLeft";
    } else if (ctx.TRAILING() != null) {
      name = "trimRight";
    } else if (ctx.BOTH() != null) {
      name = "trim";
    } else {
      throw new ParsingException("Unsupported value of rule ColumnExprTrim");
    }
    Expr expr = b.visitAsExpr(ctx.columnExpr());
    Constant characters = new Constant(StringLiterals.parseString(ctx.STRING_LITERAL().getText()));
    return new Call(name, Arrays.asList(expr, characters));
  }

  public static Expr v(HogQLParser.ColumnExprIntervalContext ctx, AstBuilder b) {
    HogQLParser.IntervalContext interval = ctx.interval();
    String name;
    if (interval.SECOND() != null) {
      name = "toIntervalSecond";
    } else if (interval.MINUTE() != null) {
      name = "toIntervalMinute";
    } else if (interval.HOUR() != null) {
      name = "toIntervalHour";
    } else if (interval.DAY() != null) {
      name = "toIntervalDay";
    } else if (interval.WEEK() != null) {
      name = "toIntervalWeek";
    } else if (interval.MONTH() != null) {
      name = "toIntervalMonth";
    } else if (interval.QUARTER() != null) {
      name = "toIntervalQuarter";
    } else if (interval.YEAR() != null) {
      name = "toIntervalYear";
    } else {
      throw new ParsingException("Unsupported value of rule ColumnExprInterval");
    }
    return new Call(name, Arrays.asList(b.visitAsExpr(ctx.columnExpr())));
  }

  public static Expr v(HogQLParser.ColumnExprTernaryOpContext ctx, AstBuilder b) {
    return new Call("if", b.visitEach(ctx.columnExpr()));
  }

  public static Expr v(HogQLParser.ColumnExprNullishContext ctx, AstBuilder b) {
    return new Call("ifNull", b.visitEach(ctx.columnExpr()));
  }

  public static Expr v(HogQLParser.ColumnLambdaExprContext ctx, AstBuilder b) {
    List<String> args = new ArrayList<>();
    for (HogQLParser.IdentifierContext identifier : ctx.identifier()) {
      args.add(b.visitAsString(identifier));
    }
    return new Lambda(args, b.visitAsExpr(ctx.columnExpr()));
  }
}
