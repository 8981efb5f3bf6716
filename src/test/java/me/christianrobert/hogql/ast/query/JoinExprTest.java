package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JoinExprTest {

    private static JoinExpr table(String name) {
        return new JoinExpr(new Field(List.of(name)));
    }

    private static JoinExpr chainOf(int length) {
        JoinExpr head = table("t0");
        for (int i = 1; i < length; i++) {
            head = head.appendToChain(table("t" + i).withJoin("JOIN", new JoinConstraint(new Constant(true))));
        }
        return head;
    }

    @Test
    void appendLinksAfterTheTail() {
        JoinExpr chain = table("a").appendToChain(table("b")).appendToChain(table("c"));

        List<JoinExpr> members = chain.chain();
        assertEquals(3, members.size());
        assertEquals(new Field(List.of("c")), members.get(2).getTable());
    }

    @Test
    void appendLeavesTheOriginalUntouched() {
        JoinExpr original = table("a").withAlias("x");

        JoinExpr appended = original.appendToChain(table("b"));

        assertNull(original.getNextJoin());
        assertEquals("x", appended.getAlias());
        assertEquals(2, appended.chain().size());
    }

    @Test
    void appendRejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> table("a").appendToChain(null));
    }

    @Test
    void longChainsCompareWithoutRecursion() {
        JoinExpr first = chainOf(5000);
        JoinExpr second = chainOf(5000);

        assertEquals(5000, first.chain().size());
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, chainOf(4999));
        assertTrue(first.toString().startsWith("JoinExpr{table=Field"));
    }

    @Test
    void membersDifferingOnlyDeepInTheChainAreNotEqual() {
        JoinExpr left = table("a").appendToChain(table("b")).appendToChain(table("c"));
        JoinExpr right = table("a").appendToChain(table("b")).appendToChain(table("d"));

        assertNotEquals(left, right);
    }
}
