package me.christianrobert.hogql.parser;

import me.christianrobert.hogql.antlr.HogQLParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AntlrParserTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    @Test
    void parseSimpleSelect() {
        ParseResult parseResult = parser.parseSelect("SELECT event FROM events");

        assertTrue(parseResult.isSuccess(), "Parsing should succeed");
        assertFalse(parseResult.hasErrors(), "Should have no errors");
        assertNotNull(parseResult.getTree(), "Parse tree should not be null");
        assertInstanceOf(HogQLParser.SelectContext.class, parseResult.getTree());
    }

    @Test
    void parseExpressionUsesExprRule() {
        ParseResult parseResult = parser.parseExpr("a + 1");

        assertTrue(parseResult.isSuccess());
        assertInstanceOf(HogQLParser.ExprContext.class, parseResult.getTree());
    }

    @Test
    void parseOrderExpression() {
        ParseResult parseResult = parser.parseOrderExpr("timestamp DESC");

        assertTrue(parseResult.isSuccess());
        assertInstanceOf(HogQLParser.OrderExprContext.class, parseResult.getTree());
    }

    @Test
    void syntaxErrorIsCollectedWithSpan() {
        ParseResult parseResult = parser.parseSelect("SELECT FROM WHERE");

        assertTrue(parseResult.hasErrors());
        assertNotNull(parseResult.getFirstError());
        assertNotNull(parseResult.getErrorStart());
        assertNotNull(parseResult.getErrorEnd());
        assertTrue(parseResult.getErrorStart() <= parseResult.getErrorEnd());
    }

    @Test
    void lexerErrorIsCollected() {
        ParseResult parseResult = parser.parseExpr("a # b");

        assertTrue(parseResult.hasErrors());
        assertEquals(2, parseResult.getErrorStart());
    }

    @Test
    void trailingInputAfterOrderExpressionIsAnError() {
        ParseResult parseResult = parser.parseOrderExpr("a DESC b");

        assertTrue(parseResult.hasErrors());
        assertEquals("Unexpected input after order expression: 'b'", parseResult.getFirstError());
        assertEquals(7, parseResult.getErrorStart());
        assertEquals(8, parseResult.getErrorEnd());
    }

    @Test
    void incompleteExpressionIsAnError() {
        ParseResult parseResult = parser.parseExpr("1 +");

        assertTrue(parseResult.hasErrors());
        assertNotNull(parseResult.getErrorMessage());
    }

    @Test
    void nullSourceIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parser.parseExpr(null));
    }
}
