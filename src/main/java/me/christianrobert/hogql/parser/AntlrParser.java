package me.christianrobert.hogql.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.hogql.antlr.HogQLLexer;
import me.christianrobert.hogql.antlr.HogQLParser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Thin wrapper around the generated HogQL lexer and parser.
 * Handles parser instantiation and error collection, and exposes one method per entry rule.
 *
 * <p>Uses a two-stage strategy:
 * <ol>
 *   <li>SLL(*) prediction with a bail-out error strategy (fast path)</li>
 *   <li>LL(*) prediction with full error reporting if the fast path fails</li>
 * </ol>
 *
 * <p>Stateless, so {@code @Dependent} scope; tests instantiate it with {@code new}.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    public ParseResult parseExpr(String source) {
        return parse(source, StartRule.EXPR);
    }

    public ParseResult parseOrderExpr(String source) {
        return parse(source, StartRule.ORDER_EXPR);
    }

    public ParseResult parseSelect(String source) {
        return parse(source, StartRule.SELECT);
    }

    public ParseResult parse(String source, StartRule rule) {
        if (source == null) {
            throw new IllegalArgumentException("Source cannot be null");
        }
        if (rule == null) {
            throw new IllegalArgumentException("Start rule cannot be null");
        }
        log.debug("Parsing {}: {}", rule.getDescription(), source.substring(0, Math.min(100, source.length())));
        return parseTwoStage(source, entryPoint(rule), rule.getDescription());
    }

    private static Function<HogQLParser, ParserRuleContext> entryPoint(StartRule rule) {
        switch (rule) {
            case EXPR:
                return HogQLParser::expr;
            case ORDER_EXPR:
                return HogQLParser::orderExpr;
            case SELECT:
                return HogQLParser::select;
            default:
                throw new IllegalArgumentException("Unknown start rule: " + rule);
        }
    }

    private ParseResult parseTwoStage(String source, Function<HogQLParser, ParserRuleContext> parseFunction,
                                      String description) {
        CharStream input = CharStreams.fromString(source);
        HogQLLexer lexer = new HogQLLexer(input);
        ErrorCollector collector = new ErrorCollector();
        lexer.removeErrorListeners();
        lexer.addErrorListener(collector);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        HogQLParser parser = new HogQLParser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        ParserRuleContext tree;
        try {
            log.trace("Attempting SLL(*) parse for {}", description);
            tree = parseFunction.apply(parser);
            log.trace("SLL(*) parse succeeded for {}", description);
        } catch (ParseCancellationException sllFailure) {
            log.trace("SLL(*) parse failed for {}, falling back to LL(*)", description);
            tokens.seek(0);
            parser.reset();
            parser.removeErrorListeners();
            parser.addErrorListener(collector);
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);

            tree = parseFunction.apply(parser);
            log.debug("LL(*) parse completed for {}", description);
        }

        Token next = tokens.LT(1);
        if (collector.errors.isEmpty() && next != null && next.getType() != Token.EOF) {
            collector.record("Unexpected input after " + description + ": '" + next.getText() + "'",
                    next.getStartIndex(), next.getStopIndex() + 1);
        }

        return new ParseResult(tree, collector.errors, source, collector.firstStart, collector.firstEnd);
    }

    /**
     * Collects lexer and parser errors, remembering the span of the first one.
     */
    private static class ErrorCollector extends BaseErrorListener {
        private final List<String> errors = new ArrayList<>();
        private Integer firstStart;
        private Integer firstEnd;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            int start;
            int end;
            if (offendingSymbol instanceof Token) {
                Token token = (Token) offendingSymbol;
                start = token.getStartIndex();
                end = token.getType() == Token.EOF ? start : token.getStopIndex() + 1;
            } else if (recognizer instanceof Lexer) {
                Lexer lexer = (Lexer) recognizer;
                start = lexer._tokenStartCharIndex;
                end = lexer.getInputStream().index() + 1;
            } else {
                start = -1;
                end = -1;
            }
            String error = String.format("Line %d:%d - %s", line, charPositionInLine, msg);
            log.warn("Parse error: {}", error);
            record(msg, start, end);
        }

        void record(String message, int start, int end) {
            if (errors.isEmpty() && start >= 0) {
                firstStart = start;
                firstEnd = Math.max(start, end);
            }
            errors.add(message);
        }
    }
}
