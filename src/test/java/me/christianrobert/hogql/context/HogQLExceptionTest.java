package me.christianrobert.hogql.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HogQLExceptionTest {

    @Test
    void errorTypes() {
        assertEquals("SyntaxError", new SyntaxException("x").getErrorType());
        assertEquals("NotImplementedError", new NotImplementedException("x").getErrorType());
        assertEquals("ParsingError", new ParsingException("x").getErrorType());
    }

    @Test
    void withQueryKeepsMessageAndSpan() {
        // Given
        SyntaxException original = new SyntaxException("bad index", 4, 10);

        // When
        SyntaxException bound = original.withQuery("SELECT arr[0]");

        // Then
        assertEquals("bad index", bound.getMessage());
        assertEquals("SELECT arr[0]", bound.getQuery());
        assertEquals(4, bound.getStart());
        assertEquals(10, bound.getEnd());
        assertSame(original, bound.getCause());
    }

    @Test
    void withSpanKeepsQuery() {
        SyntaxException bound = new SyntaxException("no alias").withQuery("q").withSpan(1, 3);

        assertTrue(bound.hasSpan());
        assertEquals("q", bound.getQuery());
    }

    @Test
    void detailedMessage() {
        SyntaxException e = new SyntaxException("bad index", 4, 10).withQuery("SELECT arr[0]");

        assertEquals("SyntaxError: bad index\nPosition: 4-10\nQuery: SELECT arr[0]", e.getDetailedMessage());
    }

    @Test
    void detailedMessageWithoutSpanOrQuery() {
        assertEquals("NotImplementedError: Unsupported node: ColumnExprCast",
                new NotImplementedException("Unsupported node: ColumnExprCast").getDetailedMessage());
    }

    @Test
    void failedOutcomeCopiesTheException() {
        ParseOutcome outcome = ParseOutcome.failure("arr[0]", new SyntaxException("bad index", 0, 6));

        assertFalse(outcome.isSuccess());
        assertEquals("SyntaxError", outcome.getErrorType());
        assertEquals(0, outcome.getStart());
        assertEquals(6, outcome.getEnd());
        assertNull(outcome.getAst());
    }
}
