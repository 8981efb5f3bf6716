package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.ast.expression.And;
import me.christianrobert.hogql.ast.expression.ArithmeticOperation;
import me.christianrobert.hogql.ast.expression.ArithmeticOperationOp;
import me.christianrobert.hogql.ast.expression.Array;
import me.christianrobert.hogql.ast.expression.ArrayAccess;
import me.christianrobert.hogql.ast.expression.BetweenExpr;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.CompareOperation;
import me.christianrobert.hogql.ast.expression.CompareOperationOp;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.expression.Lambda;
import me.christianrobert.hogql.ast.expression.Not;
import me.christianrobert.hogql.ast.expression.Or;
import me.christianrobert.hogql.ast.expression.Placeholder;
import me.christianrobert.hogql.ast.expression.Tuple;
import me.christianrobert.hogql.ast.expression.TupleAccess;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.expression.WindowFrameExpr;
import me.christianrobert.hogql.ast.expression.WindowFunction;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.context.ParseContext;
import me.christianrobert.hogql.context.SyntaxException;
import me.christianrobert.hogql.parser.AntlrParser;
import me.christianrobert.hogql.parser.ParseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Column expression translation: precedence tiers, chain flattening, access forms,
 * BETWEEN, function-call sugar and aliases.
 */
class ExpressionBuilderTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private Expr expr(String source) {
        ParseResult parseResult = parser.parseExpr(source);
        assertFalse(parseResult.hasErrors(), "Parse should succeed: " + parseResult.getErrorMessage());
        return (Expr) new AstBuilder(ParseContext.defaults()).visit(parseResult.getTree());
    }

    private static Field field(String... chain) {
        return new Field(List.of(chain));
    }

    // ========== ARITHMETIC ==========

    @Test
    void multiplicationBindsTighterThanAddition() {
        Expr result = expr("1 + 2 * 3");

        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.ADD,
                Constant.of(1),
                new ArithmeticOperation(ArithmeticOperationOp.MULT, Constant.of(2), Constant.of(3))), result);
    }

    @Test
    void subtractionIsLeftAssociative() {
        Expr result = expr("a - b - c");

        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.SUB,
                new ArithmeticOperation(ArithmeticOperationOp.SUB, field("a"), field("b")),
                field("c")), result);
    }

    @Test
    void divisionAndModulo() {
        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.DIV, field("a"), Constant.of(2)), expr("a / 2"));
        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.MOD, field("a"), Constant.of(2)), expr("a % 2"));
    }

    @Test
    void negationOfColumnSubtractsFromZero() {
        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.SUB, Constant.of(0), field("x")), expr("-x"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        Expr result = expr("(1 + 2) * 3");

        assertEquals(new ArithmeticOperation(ArithmeticOperationOp.MULT,
                new ArithmeticOperation(ArithmeticOperationOp.ADD, Constant.of(1), Constant.of(2)),
                Constant.of(3)), result);
    }

    // ========== CONCAT ==========

    @Test
    @DisplayName("a || b || c collapses into one concat call")
    void concatChainIsFlattened() {
        assertEquals(new Call("concat", List.of(field("a"), field("b"), field("c"))), expr("a || b || c"));
    }

    @Test
    void concatAbsorbsExplicitConcatCall() {
        assertEquals(new Call("concat", List.of(field("a"), field("b"), field("c"))), expr("concat(a, b) || c"));
    }

    // ========== LOGICAL ==========

    @Test
    void andChainIsFlattened() {
        assertEquals(new And(List.of(field("a"), field("b"), field("c"))), expr("a AND b AND c"));
    }

    @Test
    void parenthesizedAndIsFlattenedToo() {
        assertEquals(new And(List.of(field("a"), field("b"), field("c"))), expr("a AND (b AND c)"));
    }

    @Test
    void orChainIsFlattened() {
        assertEquals(new Or(List.of(field("a"), field("b"), field("c"))), expr("a OR b OR c"));
    }

    @Test
    void andBindsTighterThanOr() {
        Expr result = expr("a OR b AND c");

        assertEquals(new Or(List.of(field("a"), new And(List.of(field("b"), field("c"))))), result);
    }

    @Test
    void mixedConnectivesAreNotMerged() {
        Expr result = expr("(a OR b) AND (c OR d)");

        And and = assertInstanceOf(And.class, result);
        assertEquals(2, and.getExprs().size());
        assertInstanceOf(Or.class, and.getExprs().get(0));
        assertInstanceOf(Or.class, and.getExprs().get(1));
    }

    @Test
    void notWrapsOperand() {
        assertEquals(new Not(field("a")), expr("NOT a"));
    }

    // ========== COMPARISON ==========

    @Test
    void singleAndDoubleEqualsAreTheSame() {
        CompareOperation expected = new CompareOperation(CompareOperationOp.EQ, field("a"), Constant.of(1));
        assertEquals(expected, expr("a = 1"));
        assertEquals(expected, expr("a == 1"));
    }

    @Test
    void comparisonOperators() {
        assertEquals(CompareOperationOp.NOT_EQ, compareOp("a != 1"));
        assertEquals(CompareOperationOp.LT, compareOp("a < 1"));
        assertEquals(CompareOperationOp.LT_EQ, compareOp("a <= 1"));
        assertEquals(CompareOperationOp.GT, compareOp("a > 1"));
        assertEquals(CompareOperationOp.GT_EQ, compareOp("a >= 1"));
    }

    @Test
    void likeFamily() {
        assertEquals(CompareOperationOp.LIKE, compareOp("a LIKE 'x%'"));
        assertEquals(CompareOperationOp.NOT_LIKE, compareOp("a NOT LIKE 'x%'"));
        assertEquals(CompareOperationOp.ILIKE, compareOp("a ILIKE 'x%'"));
        assertEquals(CompareOperationOp.NOT_ILIKE, compareOp("a NOT ILIKE 'x%'"));
    }

    @Test
    void regexFamily() {
        assertEquals(CompareOperationOp.REGEX, compareOp("a =~ 'x'"));
        assertEquals(CompareOperationOp.REGEX, compareOp("a ~ 'x'"));
        assertEquals(CompareOperationOp.NOT_REGEX, compareOp("a !~ 'x'"));
        assertEquals(CompareOperationOp.IREGEX, compareOp("a =~* 'x'"));
        assertEquals(CompareOperationOp.IREGEX, compareOp("a ~* 'x'"));
        assertEquals(CompareOperationOp.NOT_IREGEX, compareOp("a !~* 'x'"));
    }

    @Test
    void inFamily() {
        assertEquals(CompareOperationOp.IN, compareOp("a IN (1, 2)"));
        assertEquals(CompareOperationOp.NOT_IN, compareOp("a NOT IN (1, 2)"));
        assertEquals(CompareOperationOp.IN_COHORT, compareOp("person_id IN COHORT 5"));
        assertEquals(CompareOperationOp.NOT_IN_COHORT, compareOp("person_id NOT IN COHORT 5"));
    }

    @Test
    void inListRightSideIsTuple() {
        CompareOperation result = assertInstanceOf(CompareOperation.class, expr("a IN (1, 2)"));
        assertEquals(new Tuple(List.of(Constant.of(1), Constant.of(2))), result.getRight());
    }

    @Test
    void isNullComparesWithNullConstant() {
        assertEquals(new CompareOperation(CompareOperationOp.EQ, field("a"), Constant.ofNull()), expr("a IS NULL"));
        assertEquals(new CompareOperation(CompareOperationOp.NOT_EQ, field("a"), Constant.ofNull()),
                expr("a IS NOT NULL"));
    }

    private CompareOperationOp compareOp(String source) {
        return assertInstanceOf(CompareOperation.class, expr(source)).getOp();
    }

    @Test
    void betweenKeepsOperandOrder() {
        assertEquals(new BetweenExpr(field("a"), Constant.of(1), Constant.of(10), false),
                expr("a BETWEEN 1 AND 10"));
    }

    @Test
    void notBetweenIsNegated() {
        assertEquals(new BetweenExpr(field("a"), Constant.of(1), field("b"), true),
                expr("a NOT BETWEEN 1 AND b"));
    }

    @Test
    void betweenBoundsMayBeExpressions() {
        BetweenExpr between = assertInstanceOf(BetweenExpr.class, expr("x between y - 1 and y + 1"));

        assertInstanceOf(ArithmeticOperation.class, between.getLow());
        assertInstanceOf(ArithmeticOperation.class, between.getHigh());
        assertFalse(between.isNegated());
    }

    // ========== ACCESS ==========

    @Test
    void arrayAccessWithOneBasedIndex() {
        assertEquals(new ArrayAccess(field("arr"), Constant.of(1)), expr("arr[1]"));
    }

    @Test
    void arrayAccessWithZeroIndexIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> expr("arr[0]"));
        assertEquals("SQL indexes start from one, not from zero. E.g: array[1]", e.getMessage());
        assertTrue(e.hasSpan(), "Error should carry a span");
        assertEquals(0, e.getStart());
        assertEquals(6, e.getEnd());
    }

    @Test
    void arrayAccessWithFloatZeroIsRejected() {
        assertThrows(SyntaxException.class, () -> expr("arr[0.0]"));
    }

    @Test
    void arrayAccessWithExpressionIndexIsAccepted() {
        Expr result = expr("arr[i - 1]");
        assertInstanceOf(ArrayAccess.class, result);
    }

    @Test
    void tupleAccess() {
        assertEquals(new TupleAccess(field("t"), BigInteger.ONE), expr("t.1"));
    }

    @Test
    void tupleAccessWithZeroIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> expr("t.0"));
        assertEquals(VisitAccessExpression.ZERO_INDEX_MESSAGE, e.getMessage());
    }

    @Test
    void propertyAccessOnExpressionBecomesArrayAccess() {
        Expr result = expr("f(x).name");
        assertEquals(new ArrayAccess(new Call("f", List.of(field("x"))), new Constant("name")), result);
    }

    @Test
    void nullSafeArrayAccess() {
        assertEquals(new ArrayAccess(field("a"), Constant.of(1), true), expr("a?.[1]"));
    }

    @Test
    void nullSafeArrayAccessWithZeroIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> expr("a?.[0]"));
        assertEquals(VisitAccessExpression.ZERO_INDEX_MESSAGE, e.getMessage());
    }

    @Test
    void nullSafeTupleAccess() {
        assertEquals(new TupleAccess(field("t"), BigInteger.valueOf(2), true), expr("t?.2"));
        assertThrows(SyntaxException.class, () -> expr("t?.0"));
    }

    @Test
    void nullSafePropertyAccess() {
        assertEquals(new ArrayAccess(field("a"), new Constant("b"), true), expr("a?.b"));
    }

    @Test
    void plainAccessIsNotNullish() {
        ArrayAccess access = assertInstanceOf(ArrayAccess.class, expr("a[1]"));
        assertFalse(access.isNullish());
        assertNotEquals(new ArrayAccess(field("a"), Constant.of(1), true), access);
    }

    // ========== IDENTIFIERS ==========

    @Test
    void dottedIdentifierIsOneFieldChain() {
        assertEquals(field("properties", "$browser"), expr("properties.`$browser`"));
        assertEquals(field("a", "b", "c"), expr("a.b.c"));
    }

    @Test
    void booleanIdentifiersBecomeConstants() {
        assertEquals(new Constant(Boolean.TRUE), expr("true"));
        assertEquals(new Constant(Boolean.FALSE), expr("FALSE"));
    }

    @Test
    void qualifiedTrueStaysAField() {
        assertEquals(field("t", "true"), expr("t.true"));
    }

    @Test
    void quotedIdentifiersAreUnquoted() {
        assertEquals(field("my column"), expr("`my column`"));
        assertEquals(field("my column"), expr("\"my column\""));
    }

    @Test
    void keywordsCanBeIdentifiers() {
        assertEquals(field("event", "timestamp"), expr("event.timestamp"));
    }

    @Test
    void placeholder() {
        assertEquals(new Placeholder("filters"), expr("{filters}"));
    }

    @Test
    void asterisk() {
        assertEquals(field("*"), expr("*"));
        assertEquals(field("events", "*"), expr("events.*"));
    }

    // ========== COLLECTIONS ==========

    @Test
    void tupleAndArrayLiterals() {
        assertEquals(new Tuple(List.of(Constant.of(1), Constant.of(2))), expr("(1, 2)"));
        assertEquals(new Array(List.of(Constant.of(1), Constant.of(2))), expr("[1, 2]"));
        assertEquals(new Array(List.of()), expr("[]"));
    }

    // ========== FUNCTION CALLS ==========

    @Test
    void plainCall() {
        Call call = assertInstanceOf(Call.class, expr("count()"));
        assertEquals("count", call.getName());
        assertTrue(call.getArgs().isEmpty());
        assertNull(call.getParams());
        assertFalse(call.isDistinct());
    }

    @Test
    void distinctCall() {
        Call call = assertInstanceOf(Call.class, expr("count(DISTINCT person_id)"));
        assertTrue(call.isDistinct());
        assertEquals(List.of(field("person_id")), call.getArgs());
    }

    @Test
    void parametricCall() {
        Call call = assertInstanceOf(Call.class, expr("quantile(0.95)(duration)"));
        assertEquals("quantile", call.getName());
        assertEquals(List.of(new Constant(0.95)), call.getParams());
        assertEquals(List.of(field("duration")), call.getArgs());
    }

    @Test
    void lambdaArguments() {
        Call call = assertInstanceOf(Call.class, expr("arrayMap(x -> x * 2, arr)"));
        assertEquals(new Lambda(List.of("x"),
                new ArithmeticOperation(ArithmeticOperationOp.MULT, field("x"), Constant.of(2))), call.getArgs().get(0));
        assertEquals(field("arr"), call.getArgs().get(1));
    }

    @Test
    void lambdaWithSeveralArguments() {
        Call call = assertInstanceOf(Call.class, expr("arrayFilter((x, y) -> x > y, a, b)"));
        Lambda lambda = assertInstanceOf(Lambda.class, call.getArgs().get(0));
        assertEquals(List.of("x", "y"), lambda.getArgs());
    }

    @Test
    void intervalBecomesConversionCall() {
        assertEquals(new Call("toIntervalDay", List.of(Constant.of(3))), expr("INTERVAL 3 DAY"));
        assertEquals(new Call("toIntervalMonth", List.of(field("n"))), expr("INTERVAL n MONTH"));
        assertEquals(new Call("toIntervalSecond", List.of(Constant.of(1))), expr("INTERVAL 1 SECOND"));
    }

    @Test
    void ternaryBecomesIf() {
        assertEquals(new Call("if", List.of(field("a"), Constant.of(1), Constant.of(2))), expr("a ? 1 : 2"));
    }

    @Test
    void nullishBecomesIfNull() {
        assertEquals(new Call("ifNull", List.of(field("a"), field("b"))), expr("a ?? b"));
    }

    @Test
    void windowFunctionWithInlineWindow() {
        WindowFunction fn = assertInstanceOf(WindowFunction.class,
                expr("row_number() OVER (PARTITION BY a ORDER BY b DESC ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW)"));

        assertEquals("row_number", fn.getName());
        assertNull(fn.getOverIdentifier());
        WindowExpr window = fn.getOverExpr();
        assertEquals(List.of(field("a")), window.getPartitionBy());
        assertEquals(List.of(new OrderExpr(field("b"), OrderExpr.Order.DESC)), window.getOrderBy());
        assertEquals(WindowExpr.FrameMethod.ROWS, window.getFrameMethod());
        assertEquals(new WindowFrameExpr(WindowFrameExpr.FrameType.PRECEDING, null), window.getFrameStart());
        assertEquals(new WindowFrameExpr(WindowFrameExpr.FrameType.CURRENT_ROW, null), window.getFrameEnd());
    }

    @Test
    void windowFunctionWithSingleBound() {
        WindowFunction fn = assertInstanceOf(WindowFunction.class, expr("sum(x) OVER (RANGE 3 PRECEDING)"));

        WindowExpr window = fn.getOverExpr();
        assertEquals(WindowExpr.FrameMethod.RANGE, window.getFrameMethod());
        assertEquals(new WindowFrameExpr(WindowFrameExpr.FrameType.PRECEDING, BigInteger.valueOf(3)),
                window.getFrameStart());
        assertNull(window.getFrameEnd());
    }

    @Test
    void windowFunctionWithNamedWindow() {
        WindowFunction fn = assertInstanceOf(WindowFunction.class, expr("sum(x) OVER w"));
        assertEquals("w", fn.getOverIdentifier());
        assertNull(fn.getOverExpr());
        assertEquals(List.of(field("x")), fn.getArgs());
    }

    @Test
    void trimLeadingBecomesTrimLeft() {
        assertEquals(new Call("trimLeft", List.of(field("s"), new Constant("x"))),
                expr("TRIM(LEADING 'x' FROM s)"));
    }

    @Test
    void trimTrailingAndBoth() {
        assertEquals(new Call("trimRight", List.of(field("s"), new Constant(" "))),
                expr("trim(trailing ' ' FROM s)"));
        assertEquals(new Call("trim", List.of(field("s"), new Constant("ab"))),
                expr("TRIM(BOTH 'ab' FROM s)"));
    }

    // ========== ALIASES ==========

    @Test
    void aliasForms() {
        Alias expected = new Alias("b", field("a"));
        assertEquals(expected, expr("a AS b"));
        assertEquals(expected, expr("a b"));
        assertEquals(expected, expr("a AS `b`"));
        assertEquals(new Alias("my b", field("a")), expr("a AS 'my b'"));
    }

    @Test
    void reservedAliasIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> expr("x AS team_id"));
        assertEquals("Alias 'team_id' is a reserved keyword", e.getMessage());
        assertTrue(e.hasSpan());
    }

    @Test
    void quotedReservedAliasIsRejected() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> expr("x AS `true`"));
        assertEquals("Alias 'true' is a reserved keyword", e.getMessage());
    }

    @Test
    void reservedAliasMatchingIgnoresCase() {
        assertThrows(SyntaxException.class, () -> expr("x AS TEAM_ID"));
        assertThrows(SyntaxException.class, () -> expr("x AS \"Null\""));
        assertThrows(SyntaxException.class, () -> expr("x AS 'FALSE'"));
    }

    @Test
    void sqlKeywordsAreNotReservedAliases() {
        assertEquals(new Alias("select", Constant.of(1)), expr("1 AS select"));
        assertEquals(new Alias("team", field("x")), expr("x AS team"));
    }
}
