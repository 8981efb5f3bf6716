package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a join operator as its canonical keyword sequence, without the trailing JOIN.
 * Keyword order is fixed regardless of the order written in the source.
 */
public class VisitJoinOp {

  public static String v(HogQLParser.JoinOpInnerContext ctx, AstBuilder b) {
    List<String> tokens = new ArrayList<>();
    if (ctx.ALL() != null) {
      tokens.add("ALL");
    }
    if (ctx.ANY() != null) {
      tokens.add("ANY");
    }
    if (ctx.ASOF() != null) {
      tokens.add("ASOF");
    }
    tokens.add("INNER");
    return String.join(" ", tokens);
  }

  public static String v(HogQLParser.JoinOpLeftRightContext ctx, AstBuilder b) {
    List<String> tokens = new ArrayList<>();
    if (ctx.LEFT() != null) {
      tokens.add("LEFT");
    }
    if (ctx.RIGHT() != null) {
      tokens.add("RIGHT");
    }
    if (ctx.OUTER() != null) {
      tokens.add("OUTER");
    }
    if (ctx.SEMI() != null) {
      tokens.add("SEMI");
    }
    if (ctx.ALL() != null) {
      tokens.add("ALL");
    }
    if (ctx.ANTI() != null) {
      tokens.add("ANTI");
    }
    if (ctx.ANY() != null) {
      tokens.add("ANY");
    }
    if (ctx.ASOF() != null) {
      tokens.add("ASOF");
    }
    return String.join(" ", tokens);
  }

  public static String v(HogQLParser.JoinOpFullContext ctx, AstBuilder b) {
    List<String> tokens = new ArrayList<>();
    if (ctx.FULL() != null) {
      tokens.add("FULL");
    }
    if (ctx.OUTER() != null) {
      tokens.add("OUTER");
    }
    if (ctx.ALL() != null) {
      tokens.add("ALL");
    }
    if (ctx.ANY() != null) {
      tokens.add("ANY");
    }
    return String.join(" ", tokens);
  }
}
