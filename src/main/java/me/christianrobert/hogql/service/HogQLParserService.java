package me.christianrobert.hogql.service;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.builder.AstBuilder;
import me.christianrobert.hogql.config.service.ConfigService;
import me.christianrobert.hogql.context.HogQLException;
import me.christianrobert.hogql.context.ParseContext;
import me.christianrobert.hogql.context.ParseOutcome;
import me.christianrobert.hogql.context.ParsingException;
import me.christianrobert.hogql.context.SyntaxException;
import me.christianrobert.hogql.parser.AntlrParser;
import me.christianrobert.hogql.parser.ParseResult;
import me.christianrobert.hogql.parser.StartRule;
import me.christianrobert.hogql.util.AstJsonWriter;
import me.christianrobert.hogql.util.AstTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-facing entry points for turning HogQL text into an AST.
 *
 * <p>Pipeline:
 * <pre>
 * HogQL text → ANTLR parse (start rule) → AstBuilder → Expr / OrderExpr
 * </pre>
 *
 * <p>Each call gets its own {@link ParseContext} and {@link AstBuilder}; nothing is shared between calls.
 * The {@code parse*} methods throw {@link HogQLException} subclasses bound to the source text;
 * {@link #analyze} never throws and reports failures through {@link ParseOutcome}.
 */
@ApplicationScoped
public class HogQLParserService {

    private static final Logger log = LoggerFactory.getLogger(HogQLParserService.class);

    @Inject
    AntlrParser parser;

    @Inject
    ConfigService configService;

    // ==================== ENTRY POINTS ====================

    /**
     * Parses a single column expression, e.g. {@code a + 1 AS b}.
     */
    public Expr parseExpr(String source) {
        return transduce(source, StartRule.EXPR, Expr.class);
    }

    /**
     * Parses one ORDER BY element, e.g. {@code timestamp DESC}.
     */
    public OrderExpr parseOrderExpr(String source) {
        return transduce(source, StartRule.ORDER_EXPR, OrderExpr.class);
    }

    /**
     * Parses a full statement.
     *
     * @return a SelectQuery, or a SelectSetQuery for UNION, INTERSECT and EXCEPT chains
     */
    public Expr parseSelect(String source) {
        return transduce(source, StartRule.SELECT, Expr.class);
    }

    /**
     * Parses and renders the result as JSON. Never throws.
     *
     * @param source HogQL text
     * @param rule Entry rule to parse with
     * @param includeParseTree Whether to include the formatted parse tree (for debugging)
     * @return ParseOutcome with either the AST or the error type, message and span
     */
    public ParseOutcome analyze(String source, StartRule rule, boolean includeParseTree) {
        if (source == null || source.trim().isEmpty()) {
            return ParseOutcome.failure(source, "ParsingError", "Query cannot be null or empty");
        }

        log.debug("Analyzing {} (includeParseTree={})", rule.getDescription(), includeParseTree);
        log.trace("HogQL: {}", source);

        String parseTree = null;
        try {
            checkLength(source);
            ParseResult parseResult = parser.parse(source, rule);
            if (includeParseTree && parseResult.getTree() != null) {
                parseTree = AstTreeFormatter.format(parseResult.getTree());
            }
            AstNode node = build(parseResult, rule, AstNode.class);
            JsonNode ast = new AstJsonWriter().toJson(node);
            log.debug("Analysis of {} succeeded", rule.getDescription());
            return parseTree != null
                    ? ParseOutcome.successWithParseTree(source, ast, parseTree)
                    : ParseOutcome.success(source, ast);

        } catch (HogQLException e) {
            log.debug("Analysis failed: {}", e.getDetailedMessage());
            return ParseOutcome.failureWithParseTree(source, e.withQuery(source), parseTree);

        } catch (StackOverflowError e) {
            log.warn("Analysis of {} exceeded the stack ({} characters)", rule.getDescription(), source.length());
            ParsingException tooDeep = new ParsingException(AstBuilder.TOO_DEEPLY_NESTED_MESSAGE, e);
            return ParseOutcome.failure(source, tooDeep.withQuery(source));

        } catch (RuntimeException e) {
            log.error("Unexpected error while parsing {}", rule.getDescription(), e);
            ParsingException wrapped = new ParsingException("Unexpected error: " + e.getMessage(), e);
            return ParseOutcome.failureWithParseTree(source, wrapped, parseTree);
        }
    }

    // ==================== PIPELINE ====================

    private <T> T transduce(String source, StartRule rule, Class<T> expected) {
        if (source == null) {
            throw new ParsingException("Query cannot be null");
        }
        log.debug("Parsing {}", rule.getDescription());
        log.trace("HogQL: {}", source);

        try {
            checkLength(source);
            ParseResult parseResult = parser.parse(source, rule);
            return build(parseResult, rule, expected);
        } catch (HogQLException e) {
            log.debug("Parsing {} failed: {}", rule.getDescription(), e.getMessage());
            throw e.withQuery(source);
        } catch (StackOverflowError e) {
            // the parser and the builder both recurse once per nesting level
            log.warn("Parsing {} exceeded the stack ({} characters)", rule.getDescription(), source.length());
            throw new ParsingException(AstBuilder.TOO_DEEPLY_NESTED_MESSAGE, e).withQuery(source);
        }
    }

    private <T> T build(ParseResult parseResult, StartRule rule, Class<T> expected) {
        if (parseResult.hasErrors()) {
            throw new SyntaxException(parseResult.getFirstError(),
                    parseResult.getErrorStart(), parseResult.getErrorEnd());
        }

        ParseContext context = new ParseContext(configService.getReservedKeywords());
        AstBuilder builder = new AstBuilder(context);
        Object result = builder.visit(parseResult.getTree());

        if (!expected.isInstance(result)) {
            throw new ParsingException("Expected " + expected.getSimpleName() + " from " + rule.getDescription()
                    + ", got " + (result == null ? "null" : result.getClass().getSimpleName()));
        }
        return expected.cast(result);
    }

    private void checkLength(String source) {
        int maxLength = configService.getMaxQueryLength();
        if (source.length() > maxLength) {
            throw new ParsingException("Query is too long: " + source.length()
                    + " characters, maximum is " + maxLength);
        }
    }
}
