package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.ast.expression.ArithmeticOperation;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.CompareOperation;
import me.christianrobert.hogql.ast.expression.CompareOperationOp;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.query.CTE;
import me.christianrobert.hogql.ast.query.SelectQuery;
import me.christianrobert.hogql.ast.query.SelectSetNode;
import me.christianrobert.hogql.ast.query.SelectSetQuery;
import me.christianrobert.hogql.ast.query.SetOperator;
import me.christianrobert.hogql.context.NotImplementedException;
import me.christianrobert.hogql.context.ParseContext;
import me.christianrobert.hogql.context.SyntaxException;
import me.christianrobert.hogql.parser.AntlrParser;
import me.christianrobert.hogql.parser.ParseResult;
import me.christianrobert.hogql.util.ReservedKeywords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SELECT statement assembly: clauses, limits, CTEs, named windows, set operators and ARRAY JOIN validation.
 */
class SelectStatementBuilderTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private Expr select(String source) {
        ParseResult parseResult = parser.parseSelect(source);
        assertFalse(parseResult.hasErrors(), "Parse should succeed: " + parseResult.getErrorMessage());
        return (Expr) new AstBuilder(ParseContext.defaults()).visit(parseResult.getTree());
    }

    private SelectQuery selectQuery(String source) {
        return assertInstanceOf(SelectQuery.class, select(source));
    }

    private static Field field(String... chain) {
        return new Field(List.of(chain));
    }

    // ========== SUCCESS CASES ==========

    @Test
    void selectWithoutFrom() {
        SelectQuery query = selectQuery("SELECT 1");

        assertEquals(List.of(Constant.of(1)), query.getSelect());
        assertNull(query.getSelectFrom());
        assertNull(query.getWhere());
        assertFalse(query.isDistinct());
    }

    @Test
    void allClauses() {
        // Given
        String source = "SELECT DISTINCT event, count() AS c FROM events "
                + "PREWHERE team_id = 1 WHERE timestamp > now() GROUP BY event HAVING c > 10 "
                + "ORDER BY c DESC, event LIMIT 100 OFFSET 20";

        // When
        SelectQuery query = selectQuery(source);

        // Then
        assertTrue(query.isDistinct());
        assertEquals(List.of(field("event"), new Alias("c", new Call("count", List.of()))), query.getSelect());
        assertEquals(field("events"), query.getSelectFrom().getTable());
        assertEquals(new CompareOperation(CompareOperationOp.EQ, field("team_id"), Constant.of(1)), query.getPrewhere());
        assertEquals(new CompareOperation(CompareOperationOp.GT, field("timestamp"), new Call("now", List.of())),
                query.getWhere());
        assertEquals(List.of(field("event")), query.getGroupBy());
        assertEquals(new CompareOperation(CompareOperationOp.GT, field("c"), Constant.of(10)), query.getHaving());
        assertEquals(List.of(new OrderExpr(field("c"), OrderExpr.Order.DESC), new OrderExpr(field("event"), OrderExpr.Order.ASC)),
                query.getOrderBy());
        assertEquals(Constant.of(100), query.getLimit());
        assertEquals(Constant.of(20), query.getOffset());
    }

    @Test
    void limitWithCommaOffset() {
        SelectQuery query = selectQuery("SELECT a FROM t LIMIT 10, 20");

        assertEquals(Constant.of(10), query.getLimit());
        assertEquals(Constant.of(20), query.getOffset());
    }

    @Test
    void limitBy() {
        SelectQuery query = selectQuery("SELECT a FROM t LIMIT 5 BY a, b");

        assertEquals(Constant.of(5), query.getLimit());
        assertEquals(List.of(field("a"), field("b")), query.getLimitBy());
        assertFalse(query.isLimitWithTies());
    }

    @Test
    void limitWithTies() {
        SelectQuery query = selectQuery("SELECT a FROM t ORDER BY a LIMIT 5 WITH TIES");

        assertTrue(query.isLimitWithTies());
    }

    @Test
    void offsetWithoutLimit() {
        SelectQuery query = selectQuery("SELECT a FROM t OFFSET 3");

        assertNull(query.getLimit());
        assertEquals(Constant.of(3), query.getOffset());
    }

    @Test
    void limitExpressionsAreFullExpressions() {
        SelectQuery query = selectQuery("SELECT a FROM t LIMIT 2 + 3");

        assertInstanceOf(ArithmeticOperation.class, query.getLimit());
    }

    @Test
    void subqueryCte() {
        SelectQuery query = selectQuery("WITH recent AS (SELECT 1) SELECT * FROM recent");

        Map<String, CTE> ctes = query.getCtes();
        assertEquals(1, ctes.size());
        CTE cte = ctes.get("recent");
        assertEquals(CTE.CteType.SUBQUERY, cte.getCteType());
        assertInstanceOf(SelectQuery.class, cte.getExpr());
    }

    @Test
    void columnCte() {
        SelectQuery query = selectQuery("WITH 1 + 1 AS two SELECT two");

        CTE cte = query.getCtes().get("two");
        assertEquals(CTE.CteType.COLUMN, cte.getCteType());
        assertInstanceOf(ArithmeticOperation.class, cte.getExpr());
    }

    @Test
    void repeatedCteNameKeepsLastDefinition() {
        SelectQuery query = selectQuery("WITH 1 AS x, 2 AS x SELECT x");

        assertEquals(1, query.getCtes().size());
        assertEquals(Constant.of(2), query.getCtes().get("x").getExpr());
    }

    @Test
    void namedWindows() {
        SelectQuery query = selectQuery(
                "SELECT sum(a) OVER w1, sum(b) OVER w2 FROM t WINDOW w1 AS (PARTITION BY c), w2 AS (ORDER BY d)");

        Map<String, WindowExpr> windows = query.getWindowExprs();
        assertEquals(List.of("w1", "w2"), List.copyOf(windows.keySet()));
        assertEquals(List.of(field("c")), windows.get("w1").getPartitionBy());
        assertEquals(List.of(new OrderExpr(field("d"), OrderExpr.Order.ASC)), windows.get("w2").getOrderBy());
    }

    @Test
    void unionAllBecomesSelectSet() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class, select("SELECT 1 UNION ALL SELECT 2"));

        SelectQuery initial = assertInstanceOf(SelectQuery.class, set.getInitialSelectQuery());
        assertEquals(List.of(Constant.of(1)), initial.getSelect());
        assertEquals(1, set.getSubsequentSelectQueries().size());
        SelectSetNode second = set.getSubsequentSelectQueries().get(0);
        assertEquals(SetOperator.UNION_ALL, second.getSetOperator());
        assertEquals(List.of(Constant.of(2)), ((SelectQuery) second.getSelectQuery()).getSelect());
    }

    @Test
    void nestedUnionsAreFlattened() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class,
                select("SELECT 1 UNION ALL (SELECT 2 UNION ALL SELECT 3)"));

        assertEquals(3, set.getSelectQueries().size());
        for (Expr member : set.getSelectQueries()) {
            assertInstanceOf(SelectQuery.class, member);
        }
    }

    @Test
    void leadingParenthesizedUnionIsFlattened() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class,
                select("(SELECT 1 UNION ALL SELECT 2) UNION ALL SELECT 3"));

        assertInstanceOf(SelectQuery.class, set.getInitialSelectQuery());
        assertEquals(2, set.getSubsequentSelectQueries().size());
    }

    @Test
    void eachSetOperatorIsRecorded() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class, select(
                "SELECT 1 UNION DISTINCT SELECT 2 INTERSECT SELECT 3 INTERSECT DISTINCT SELECT 4 EXCEPT SELECT 5"));

        List<SetOperator> operators = new ArrayList<>();
        for (SelectSetNode node : set.getSubsequentSelectQueries()) {
            operators.add(node.getSetOperator());
        }
        assertEquals(List.of(SetOperator.UNION_DISTINCT, SetOperator.INTERSECT,
                SetOperator.INTERSECT_DISTINCT, SetOperator.EXCEPT), operators);
    }

    @Test
    void setOperatorsAreCaseInsensitive() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class, select("select 1 except select 2"));

        assertEquals(SetOperator.EXCEPT, set.getSubsequentSelectQueries().get(0).getSetOperator());
    }

    @Test
    void parenthesizedExceptKeepsItsGrouping() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class,
                select("SELECT 1 UNION ALL (SELECT 2 EXCEPT SELECT 3)"));

        assertEquals(1, set.getSubsequentSelectQueries().size());
        SelectSetNode node = set.getSubsequentSelectQueries().get(0);
        assertEquals(SetOperator.UNION_ALL, node.getSetOperator());
        SelectSetQuery nested = assertInstanceOf(SelectSetQuery.class, node.getSelectQuery());
        assertEquals(SetOperator.EXCEPT, nested.getSubsequentSelectQueries().get(0).getSetOperator());
    }

    @Test
    void unionAllInsideExceptIsNotSpliced() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class,
                select("SELECT 1 EXCEPT (SELECT 2 UNION ALL SELECT 3)"));

        assertEquals(1, set.getSubsequentSelectQueries().size());
        SelectSetNode node = set.getSubsequentSelectQueries().get(0);
        assertEquals(SetOperator.EXCEPT, node.getSetOperator());
        assertInstanceOf(SelectSetQuery.class, node.getSelectQuery());
    }

    @Test
    void leadingIntersectGroupStaysNested() {
        SelectSetQuery set = assertInstanceOf(SelectSetQuery.class,
                select("(SELECT 1 INTERSECT SELECT 2) UNION ALL SELECT 3"));

        SelectSetQuery initial = assertInstanceOf(SelectSetQuery.class, set.getInitialSelectQuery());
        assertEquals(SetOperator.INTERSECT, initial.getSubsequentSelectQueries().get(0).getSetOperator());
        assertEquals(1, set.getSubsequentSelectQueries().size());
    }

    @Test
    void setInSubqueryAndCte() {
        SelectQuery query = selectQuery(
                "WITH c AS (SELECT 1 INTERSECT SELECT 2) SELECT a FROM (SELECT 3 EXCEPT SELECT 4)");

        assertInstanceOf(SelectSetQuery.class, query.getCtes().get("c").getExpr());
        assertInstanceOf(SelectSetQuery.class, query.getSelectFrom().getTable());
    }

    @Test
    void parenthesizedSingleSelectIsPlainQuery() {
        assertInstanceOf(SelectQuery.class, select("(SELECT 1)"));
    }

    @Test
    void subqueryAsExpression() {
        SelectQuery query = selectQuery("SELECT a FROM t WHERE a IN (SELECT b FROM u)");

        CompareOperation where = assertInstanceOf(CompareOperation.class, query.getWhere());
        assertEquals(CompareOperationOp.IN, where.getOp());
        assertInstanceOf(SelectQuery.class, where.getRight());
    }

    @Test
    void arrayJoinWithAliases() {
        SelectQuery query = selectQuery("SELECT a FROM t ARRAY JOIN arr AS x, other AS y");

        assertEquals("ARRAY JOIN", query.getArrayJoinOp());
        assertEquals(List.of(new Alias("x", field("arr")), new Alias("y", field("other"))), query.getArrayJoinList());
    }

    @Test
    void leftAndInnerArrayJoin() {
        assertEquals("LEFT ARRAY JOIN", selectQuery("SELECT a FROM t LEFT ARRAY JOIN arr AS x").getArrayJoinOp());
        assertEquals("INNER ARRAY JOIN", selectQuery("SELECT a FROM t INNER ARRAY JOIN arr AS x").getArrayJoinOp());
    }

    // ========== VALIDATION ==========

    @Test
    void arrayJoinWithoutFromIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> select("SELECT a ARRAY JOIN arr AS x"));
        assertEquals("Using ARRAY JOIN without a FROM clause is not permitted", e.getMessage());
        assertTrue(e.hasSpan());
    }

    @Test
    void arrayJoinWithoutAliasIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> select("SELECT a FROM t ARRAY JOIN arr"));
        assertEquals("ARRAY JOIN arrays must have an alias", e.getMessage());
        assertEquals(27, e.getStart());
        assertEquals(30, e.getEnd());
    }

    @Test
    void arrayJoinWithOneUnaliasedMemberPointsAtThatMember() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> select("SELECT a FROM t ARRAY JOIN arr AS x, other"));

        assertEquals("ARRAY JOIN arrays must have an alias", e.getMessage());
        assertEquals(37, e.getStart());
        assertEquals(42, e.getEnd());
    }

    @Test
    void reservedColumnAliasIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> select("SELECT 1 AS `null`"));
        assertEquals("Alias 'null' is a reserved keyword", e.getMessage());
    }

    @Test
    void reservedTableAliasIsRejectedInAnyCase() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> select("SELECT 1 FROM t AS team_id"));
        assertEquals("Alias 'team_id' is a reserved keyword", e.getMessage());
        assertThrows(SyntaxException.class, () -> select("SELECT 1 FROM t AS Team_ID"));
    }

    @Test
    void topClauseIsNotImplemented() {
        NotImplementedException e = assertThrows(NotImplementedException.class, () -> select("SELECT TOP 5 a FROM t"));
        assertEquals("Unsupported: SelectStmt.topClause()", e.getMessage());
    }

    @Test
    void settingsClauseIsNotImplemented() {
        NotImplementedException e = assertThrows(NotImplementedException.class,
                () -> select("SELECT a FROM t SETTINGS max_threads = 1"));
        assertEquals("Unsupported: SelectStmt.settingsClause()", e.getMessage());
    }

    @Test
    void customReservedKeywordsApply() {
        ParseResult parseResult = parser.parseSelect("SELECT 1 AS total");
        AstBuilder builder = new AstBuilder(new ParseContext(
                new ReservedKeywords(List.of("total"), true)));

        assertThrows(SyntaxException.class, () -> builder.visit(parseResult.getTree()));
    }
}
