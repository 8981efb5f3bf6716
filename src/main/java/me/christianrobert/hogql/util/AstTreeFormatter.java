package me.christianrobert.hogql.util;

import me.christianrobert.hogql.antlr.HogQLParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats HogQL parse trees into human-readable, indented text.
 *
 * <p>Labeled alternatives are shown by label, so the precedence ladder is visible:</p>
 * <pre>
 * Expr
 *   ColumnExprPrecedence2
 *     ColumnExprLiteral [1]
 *       Literal [1]
 *         NumberLiteral [1]
 *           "1" (DECIMAL_LITERAL)
 *     "+" (PLUS)
 *     ColumnExprIdentifier [x]
 *       ...
 *   "&lt;EOF&gt;" (EOF)
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;
  private static final int MAX_SNIPPET_LENGTH = 30;

  /**
   * Formats a parse tree into human-readable text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;
      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");
      String tokenName = getTokenName(terminal);
      if (!tokenName.isEmpty()) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Short snippet for small nodes
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= MAX_SNIPPET_LENGTH) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Rule name from the context class, i.e. the alternative label where one exists.
   */
  static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    return className;
  }

  private static String getTokenName(TerminalNode terminal) {
    int type = terminal.getSymbol().getType();
    if (type == Token.EOF) {
      return "EOF";
    }
    String name = HogQLParser.VOCABULARY.getSymbolicName(type);
    return name != null ? name : "";
  }

  static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
