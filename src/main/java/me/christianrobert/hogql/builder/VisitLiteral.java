package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.util.NumberLiterals;
import me.christianrobert.hogql.util.StringLiterals;

public class VisitLiteral {

  public static Constant v(HogQLParser.LiteralContext ctx, AstBuilder b) {
    if (ctx.NULL_SQL() != null) {
      return Constant.ofNull();
    }
    if (ctx.STRING_LITERAL() != null) {
      return new Constant(StringLiterals.parseString(ctx.STRING_LITERAL().getText()));
    }
    return b.visitAs(ctx.numberLiteral(), Constant.class);
  }

  /**
   * Sign, digits and named floats arrive as one text run, e.g. {@code -1e10} or {@code -inf}.
   */
  public static Constant v(HogQLParser.NumberLiteralContext ctx, AstBuilder b) {
    return new Constant(NumberLiterals.parse(ctx.getText()));
  }
}
