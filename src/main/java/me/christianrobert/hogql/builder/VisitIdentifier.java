package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.util.StringLiterals;

/**
 * Identifier text, unquoted when written in backquotes or double quotes.
 * Keywords used as identifiers pass through with their source spelling.
 */
public class VisitIdentifier {

  public static String v(HogQLParser.IdentifierContext ctx, AstBuilder b) {
    return StringLiterals.parseIdentifier(ctx.getText());
  }

  public static String v(HogQLParser.AliasContext ctx, AstBuilder b) {
    return StringLiterals.parseIdentifier(ctx.getText());
  }
}
