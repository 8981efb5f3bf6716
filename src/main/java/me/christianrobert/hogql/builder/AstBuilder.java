package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.antlr.HogQLParser;
import me.christianrobert.hogql.antlr.HogQLParserBaseVisitor;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.Array;
import me.christianrobert.hogql.ast.expression.Placeholder;
import me.christianrobert.hogql.ast.expression.Tuple;
import me.christianrobert.hogql.ast.query.SelectSetNode;
import me.christianrobert.hogql.context.ParseContext;
import me.christianrobert.hogql.context.ParsingException;
import me.christianrobert.hogql.context.SyntaxException;
import me.christianrobert.hogql.util.StringLiterals;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts a HogQL parse tree into the AST.
 *
 * <p>One instance per call. Rule families with real logic delegate to {@code Visit*} handler
 * classes; pass-through rules are handled inline. Every rule the grammar can produce has an
 * override here, and rules without a translation throw via {@link UnsupportedRule}.
 *
 * <p>Visit results are untyped ({@code Object}) because rules yield AST nodes, strings,
 * identifier chains or lists; the {@code visitAs*} helpers check the shape at each use site.
 */
public class AstBuilder extends HogQLParserBaseVisitor<Object> {

    // no logging is desired, this would create an overkill of logs

    public static final int MAX_NESTING_DEPTH = 2000;
    public static final String TOO_DEEPLY_NESTED_MESSAGE = "Query is too deeply nested";

    private final ParseContext context;
    private int depth;

    public AstBuilder(ParseContext context) {
        if (context == null) {
            throw new IllegalArgumentException("ParseContext cannot be null");
        }
        this.context = context;
    }

    public ParseContext getContext() {
        return context;
    }

    /**
     * Visits a rule, attaching the rule's source span to any span-less syntax error raised beneath it.
     * Rules nested deeper than {@link #MAX_NESTING_DEPTH} are rejected with a {@link ParsingException}.
     */
    @Override
    public Object visit(ParseTree tree) {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new ParsingException(TOO_DEEPLY_NESTED_MESSAGE);
        }
        depth++;
        try {
            return super.visit(tree);
        } catch (SyntaxException e) {
            if (e.hasSpan() || !(tree instanceof ParserRuleContext)) {
                throw e;
            }
            ParserRuleContext ctx = (ParserRuleContext) tree;
            int start = ctx.getStart().getStartIndex();
            int end = ctx.getStop() != null ? ctx.getStop().getStopIndex() + 1 : start;
            throw e.withSpan(start, Math.max(start, end));
        } finally {
            depth--;
        }
    }

    // ========== TYPED VISIT HELPERS ==========

    public <T> T visitAs(ParseTree tree, Class<T> type) {
        if (tree == null) {
            throw new ParsingException("Expected " + type.getSimpleName() + " but the rule is missing");
        }
        Object result = visit(tree);
        if (!type.isInstance(result)) {
            throw new ParsingException("Expected " + type.getSimpleName() + " from rule "
                    + tree.getClass().getSimpleName() + ", got "
                    + (result == null ? "null" : result.getClass().getSimpleName()));
        }
        return type.cast(result);
    }

    public Expr visitAsExpr(ParseTree tree) {
        return visitAs(tree, Expr.class);
    }

    public Expr visitAsExprOrNull(ParseTree tree) {
        return tree == null ? null : visitAsExpr(tree);
    }

    public String visitAsString(ParseTree tree) {
        return visitAs(tree, String.class);
    }

    /**
     * Visits a list-producing rule and checks every element is an {@code Expr}.
     */
    public List<Expr> visitAsExprList(ParseTree tree) {
        List<?> raw = visitAs(tree, List.class);
        List<Expr> result = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (!(item instanceof Expr)) {
                throw new ParsingException("Expected a list of expressions, found "
                        + (item == null ? "null" : item.getClass().getSimpleName()));
            }
            result.add((Expr) item);
        }
        return result;
    }

    public List<Expr> visitAsExprListOrNull(ParseTree tree) {
        return tree == null ? null : visitAsExprList(tree);
    }

    public List<Expr> visitAsExprListOrEmpty(ParseTree tree) {
        return tree == null ? new ArrayList<>() : visitAsExprList(tree);
    }

    @SuppressWarnings("unchecked")
    public List<String> visitAsStringList(ParseTree tree) {
        return (List<String>) visitAs(tree, List.class);
    }

    public List<Expr> visitEach(List<? extends ParseTree> trees) {
        List<Expr> result = new ArrayList<>(trees.size());
        for (ParseTree tree : trees) {
            result.add(visitAsExpr(tree));
        }
        return result;
    }

    // ========== ENTRY RULES ==========

    @Override
    public Object visitSelect(HogQLParser.SelectContext ctx) {
        return ctx.selectSetStmt() != null ? visit(ctx.selectSetStmt()) : visit(ctx.selectStmt());
    }

    @Override
    public Object visitExpr(HogQLParser.ExprContext ctx) {
        return visit(ctx.columnExpr());
    }

    // ========== SELECT STATEMENT ==========

    @Override
    public Object visitSelectSetStmt(HogQLParser.SelectSetStmtContext ctx) {
        return VisitSelectSetStmt.v(ctx, this);
    }

    @Override
    public Object visitSubsequentSelectSetClause(HogQLParser.SubsequentSelectSetClauseContext ctx) {
        // consumed by visitSelectSetStmt, which needs the operator alongside the member
        return new SelectSetNode(VisitSelectSetStmt.operator(ctx), visitAsExpr(ctx.selectStmtWithParens()));
    }

    @Override
    public Object visitSelectStmtWithParens(HogQLParser.SelectStmtWithParensContext ctx) {
        return ctx.selectStmt() != null ? visit(ctx.selectStmt()) : visit(ctx.selectSetStmt());
    }

    @Override
    public Object visitSelectStmt(HogQLParser.SelectStmtContext ctx) {
        return VisitSelectStmt.v(ctx, this);
    }

    // ========== WITH CLAUSE (CTEs) ==========

    @Override
    public Object visitWithClause(HogQLParser.WithClauseContext ctx) {
        return visit(ctx.withExprList());
    }

    @Override
    public Object visitWithExprList(HogQLParser.WithExprListContext ctx) {
        return VisitWithClause.v(ctx, this);
    }

    @Override
    public Object visitWithExprSubquery(HogQLParser.WithExprSubqueryContext ctx) {
        return VisitWithClause.v(ctx, this);
    }

    @Override
    public Object visitWithExprColumn(HogQLParser.WithExprColumnContext ctx) {
        return VisitWithClause.v(ctx, this);
    }

    // ========== CLAUSES ==========

    @Override
    public Object visitFromClause(HogQLParser.FromClauseContext ctx) {
        return visit(ctx.joinExpr());
    }

    @Override
    public Object visitPrewhereClause(HogQLParser.PrewhereClauseContext ctx) {
        return visit(ctx.columnExpr());
    }

    @Override
    public Object visitWhereClause(HogQLParser.WhereClauseContext ctx) {
        return visit(ctx.columnExpr());
    }

    @Override
    public Object visitGroupByClause(HogQLParser.GroupByClauseContext ctx) {
        return visit(ctx.columnExprList());
    }

    @Override
    public Object visitHavingClause(HogQLParser.HavingClauseContext ctx) {
        return visit(ctx.columnExpr());
    }

    @Override
    public Object visitOrderByClause(HogQLParser.OrderByClauseContext ctx) {
        return visit(ctx.orderExprList());
    }

    @Override
    public Object visitOffsetOnlyClause(HogQLParser.OffsetOnlyClauseContext ctx) {
        return visit(ctx.columnExpr());
    }

    // Clauses read positionally by VisitSelectStmt; reaching them through the dispatcher is unsupported.

    @Override
    public Object visitTopClause(HogQLParser.TopClauseContext ctx) {
        throw UnsupportedRule.TOP_CLAUSE.exception();
    }

    @Override
    public Object visitArrayJoinClause(HogQLParser.ArrayJoinClauseContext ctx) {
        throw UnsupportedRule.ARRAY_JOIN_CLAUSE.exception();
    }

    @Override
    public Object visitWindowClause(HogQLParser.WindowClauseContext ctx) {
        throw UnsupportedRule.WINDOW_CLAUSE.exception();
    }

    @Override
    public Object visitProjectionOrderByClause(HogQLParser.ProjectionOrderByClauseContext ctx) {
        throw UnsupportedRule.PROJECTION_ORDER_BY_CLAUSE.exception();
    }

    @Override
    public Object visitLimitAndOffsetClause(HogQLParser.LimitAndOffsetClauseContext ctx) {
        throw UnsupportedRule.LIMIT_AND_OFFSET_CLAUSE.exception();
    }

    @Override
    public Object visitSettingsClause(HogQLParser.SettingsClauseContext ctx) {
        throw UnsupportedRule.SETTINGS_CLAUSE.exception();
    }

    @Override
    public Object visitSettingExprList(HogQLParser.SettingExprListContext ctx) {
        throw UnsupportedRule.SETTING_EXPR_LIST.exception();
    }

    @Override
    public Object visitSettingExpr(HogQLParser.SettingExprContext ctx) {
        throw UnsupportedRule.SETTING_EXPR.exception();
    }

    // ========== JOINS ==========

    @Override
    public Object visitJoinExprOp(HogQLParser.JoinExprOpContext ctx) {
        return VisitJoinExpr.v(ctx, this);
    }

    @Override
    public Object visitJoinExprCrossOp(HogQLParser.JoinExprCrossOpContext ctx) {
        return VisitJoinExpr.v(ctx, this);
    }

    @Override
    public Object visitJoinExprTable(HogQLParser.JoinExprTableContext ctx) {
        return VisitJoinExpr.v(ctx, this);
    }

    @Override
    public Object visitJoinExprParens(HogQLParser.JoinExprParensContext ctx) {
        return visit(ctx.joinExpr());
    }

    @Override
    public Object visitJoinOpInner(HogQLParser.JoinOpInnerContext ctx) {
        return VisitJoinOp.v(ctx, this);
    }

    @Override
    public Object visitJoinOpLeftRight(HogQLParser.JoinOpLeftRightContext ctx) {
        return VisitJoinOp.v(ctx, this);
    }

    @Override
    public Object visitJoinOpFull(HogQLParser.JoinOpFullContext ctx) {
        return VisitJoinOp.v(ctx, this);
    }

    @Override
    public Object visitJoinOpCross(HogQLParser.JoinOpCrossContext ctx) {
        throw UnsupportedRule.JOIN_OP_CROSS.exception();
    }

    @Override
    public Object visitJoinConstraintClause(HogQLParser.JoinConstraintClauseContext ctx) {
        return VisitJoinConstraintClause.v(ctx, this);
    }

    @Override
    public Object visitSampleClause(HogQLParser.SampleClauseContext ctx) {
        return VisitSampleClause.v(ctx, this);
    }

    @Override
    public Object visitRatioExpr(HogQLParser.RatioExprContext ctx) {
        return VisitSampleClause.v(ctx, this);
    }

    // ========== TABLES ==========

    @Override
    public Object visitTableExprIdentifier(HogQLParser.TableExprIdentifierContext ctx) {
        return VisitTableExpr.v(ctx, this);
    }

    @Override
    public Object visitTableExprFunction(HogQLParser.TableExprFunctionContext ctx) {
        return visit(ctx.tableFunctionExpr());
    }

    @Override
    public Object visitTableExprSubquery(HogQLParser.TableExprSubqueryContext ctx) {
        return visit(ctx.selectSetStmt());
    }

    @Override
    public Object visitTableExprAlias(HogQLParser.TableExprAliasContext ctx) {
        return VisitTableExpr.v(ctx, this);
    }

    @Override
    public Object visitTableExprPlaceholder(HogQLParser.TableExprPlaceholderContext ctx) {
        return new Placeholder(StringLiterals.parseString(ctx.PLACEHOLDER().getText()));
    }

    @Override
    public Object visitTableFunctionExpr(HogQLParser.TableFunctionExprContext ctx) {
        return VisitTableExpr.v(ctx, this);
    }

    @Override
    public Object visitTableIdentifier(HogQLParser.TableIdentifierContext ctx) {
        return VisitTableExpr.v(ctx, this);
    }

    @Override
    public Object visitTableArgList(HogQLParser.TableArgListContext ctx) {
        return visitEach(ctx.columnExpr());
    }

    @Override
    public Object visitDatabaseIdentifier(HogQLParser.DatabaseIdentifierContext ctx) {
        return visit(ctx.identifier());
    }

    // ========== ORDER BY / WINDOWS ==========

    @Override
    public Object visitOrderExprList(HogQLParser.OrderExprListContext ctx) {
        return visitEach(ctx.orderExpr());
    }

    @Override
    public Object visitOrderExpr(HogQLParser.OrderExprContext ctx) {
        return VisitOrderExpr.v(ctx, this);
    }

    @Override
    public Object visitWindowExpr(HogQLParser.WindowExprContext ctx) {
        return VisitWindowExpr.v(ctx, this);
    }

    @Override
    public Object visitWinPartitionByClause(HogQLParser.WinPartitionByClauseContext ctx) {
        return visit(ctx.columnExprList());
    }

    @Override
    public Object visitWinOrderByClause(HogQLParser.WinOrderByClauseContext ctx) {
        return visit(ctx.orderExprList());
    }

    @Override
    public Object visitWinFrameClause(HogQLParser.WinFrameClauseContext ctx) {
        return visit(ctx.winFrameExtend());
    }

    @Override
    public Object visitFrameStart(HogQLParser.FrameStartContext ctx) {
        return Collections.singletonList(visit(ctx.winFrameBound()));
    }

    @Override
    public Object visitFrameBetween(HogQLParser.FrameBetweenContext ctx) {
        List<Object> bounds = new ArrayList<>(2);
        bounds.add(visit(ctx.winFrameBound(0)));
        bounds.add(visit(ctx.winFrameBound(1)));
        return bounds;
    }

    @Override
    public Object visitWinFrameBound(HogQLParser.WinFrameBoundContext ctx) {
        return VisitWindowExpr.v(ctx, this);
    }

    // ========== COLUMN TYPES ==========

    @Override
    public Object visitColumnTypeExprSimple(HogQLParser.ColumnTypeExprSimpleContext ctx) {
        throw UnsupportedRule.COLUMN_TYPE_EXPR_SIMPLE.exception();
    }

    @Override
    public Object visitColumnTypeExprNested(HogQLParser.ColumnTypeExprNestedContext ctx) {
        throw UnsupportedRule.COLUMN_TYPE_EXPR_NESTED.exception();
    }

    @Override
    public Object visitColumnTypeExprEnum(HogQLParser.ColumnTypeExprEnumContext ctx) {
        throw UnsupportedRule.COLUMN_TYPE_EXPR_ENUM.exception();
    }

    @Override
    public Object visitColumnTypeExprComplex(HogQLParser.ColumnTypeExprComplexContext ctx) {
        throw UnsupportedRule.COLUMN_TYPE_EXPR_COMPLEX.exception();
    }

    @Override
    public Object visitColumnTypeExprParam(HogQLParser.ColumnTypeExprParamContext ctx) {
        throw UnsupportedRule.COLUMN_TYPE_EXPR_PARAM.exception();
    }

    // ========== EXPRESSION HIERARCHY ==========

    @Override
    public Object visitColumnExprList(HogQLParser.ColumnExprListContext ctx) {
        return visitEach(ctx.columnExpr());
    }

    @Override
    public Object visitColumnExprCase(HogQLParser.ColumnExprCaseContext ctx) {
        return VisitCaseExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprPrecedence1(HogQLParser.ColumnExprPrecedence1Context ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprPrecedence2(HogQLParser.ColumnExprPrecedence2Context ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNegate(HogQLParser.ColumnExprNegateContext ctx) {
        return VisitArithmeticExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprPrecedence3(HogQLParser.ColumnExprPrecedence3Context ctx) {
        return VisitComparisonExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprIsNull(HogQLParser.ColumnExprIsNullContext ctx) {
        return VisitComparisonExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprAnd(HogQLParser.ColumnExprAndContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprOr(HogQLParser.ColumnExprOrContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNot(HogQLParser.ColumnExprNotContext ctx) {
        return VisitLogicalExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprArrayAccess(HogQLParser.ColumnExprArrayAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprTupleAccess(HogQLParser.ColumnExprTupleAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprPropertyAccess(HogQLParser.ColumnExprPropertyAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNullArrayAccess(HogQLParser.ColumnExprNullArrayAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNullTupleAccess(HogQLParser.ColumnExprNullTupleAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNullPropertyAccess(HogQLParser.ColumnExprNullPropertyAccessContext ctx) {
        return VisitAccessExpression.v(ctx, this);
    }

    @Override
    public Object visitColumnExprAlias(HogQLParser.ColumnExprAliasContext ctx) {
        return VisitAlias.v(ctx, this);
    }

    @Override
    public Object visitColumnExprLiteral(HogQLParser.ColumnExprLiteralContext ctx) {
        return visit(ctx.literal());
    }

    @Override
    public Object visitColumnExprIdentifier(HogQLParser.ColumnExprIdentifierContext ctx) {
        return visit(ctx.columnIdentifier());
    }

    @Override
    public Object visitColumnExprAsterisk(HogQLParser.ColumnExprAsteriskContext ctx) {
        return VisitColumnIdentifier.v(ctx, this);
    }

    @Override
    public Object visitColumnExprSubquery(HogQLParser.ColumnExprSubqueryContext ctx) {
        return visit(ctx.selectSetStmt());
    }

    @Override
    public Object visitColumnExprParens(HogQLParser.ColumnExprParensContext ctx) {
        return visit(ctx.columnExpr());
    }

    @Override
    public Object visitColumnExprTuple(HogQLParser.ColumnExprTupleContext ctx) {
        return new Tuple(visitAsExprListOrEmpty(ctx.columnExprList()));
    }

    @Override
    public Object visitColumnExprArray(HogQLParser.ColumnExprArrayContext ctx) {
        return new Array(visitAsExprListOrEmpty(ctx.columnExprList()));
    }

    // ========== FUNCTIONS ==========

    @Override
    public Object visitColumnExprFunction(HogQLParser.ColumnExprFunctionContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprWinFunction(HogQLParser.ColumnExprWinFunctionContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprWinFunctionTarget(HogQLParser.ColumnExprWinFunctionTargetContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprInterval(HogQLParser.ColumnExprIntervalContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprTernaryOp(HogQLParser.ColumnExprTernaryOpContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprNullish(HogQLParser.ColumnExprNullishContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnArgList(HogQLParser.ColumnArgListContext ctx) {
        return visitEach(ctx.columnArgExpr());
    }

    @Override
    public Object visitColumnArgExpr(HogQLParser.ColumnArgExprContext ctx) {
        return ctx.columnLambdaExpr() != null ? visit(ctx.columnLambdaExpr()) : visit(ctx.columnExpr());
    }

    @Override
    public Object visitColumnLambdaExpr(HogQLParser.ColumnLambdaExprContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprTrim(HogQLParser.ColumnExprTrimContext ctx) {
        return VisitFunctionCall.v(ctx, this);
    }

    @Override
    public Object visitColumnExprBetween(HogQLParser.ColumnExprBetweenContext ctx) {
        return VisitComparisonExpression.v(ctx, this);
    }

    // Syntax forms without an AST translation

    @Override
    public Object visitColumnExprExtract(HogQLParser.ColumnExprExtractContext ctx) {
        throw UnsupportedRule.COLUMN_EXPR_EXTRACT.exception();
    }

    @Override
    public Object visitColumnExprSubstring(HogQLParser.ColumnExprSubstringContext ctx) {
        throw UnsupportedRule.COLUMN_EXPR_SUBSTRING.exception();
    }

    @Override
    public Object visitColumnExprCast(HogQLParser.ColumnExprCastContext ctx) {
        throw UnsupportedRule.COLUMN_EXPR_CAST.exception();
    }

    @Override
    public Object visitColumnExprTimestamp(HogQLParser.ColumnExprTimestampContext ctx) {
        throw UnsupportedRule.COLUMN_EXPR_TIMESTAMP.exception();
    }

    @Override
    public Object visitColumnExprDate(HogQLParser.ColumnExprDateContext ctx) {
        throw UnsupportedRule.COLUMN_EXPR_DATE.exception();
    }

    // ========== IDENTIFIERS ==========

    @Override
    public Object visitColumnIdentifier(HogQLParser.ColumnIdentifierContext ctx) {
        return VisitColumnIdentifier.v(ctx, this);
    }

    @Override
    public Object visitNestedIdentifier(HogQLParser.NestedIdentifierContext ctx) {
        return VisitColumnIdentifier.v(ctx, this);
    }

    @Override
    public Object visitAlias(HogQLParser.AliasContext ctx) {
        return VisitIdentifier.v(ctx, this);
    }

    @Override
    public Object visitIdentifier(HogQLParser.IdentifierContext ctx) {
        return VisitIdentifier.v(ctx, this);
    }

    @Override
    public Object visitInterval(HogQLParser.IntervalContext ctx) {
        throw UnsupportedRule.INTERVAL.exception();
    }

    @Override
    public Object visitKeyword(HogQLParser.KeywordContext ctx) {
        throw UnsupportedRule.KEYWORD.exception();
    }

    @Override
    public Object visitKeywordForAlias(HogQLParser.KeywordForAliasContext ctx) {
        throw UnsupportedRule.KEYWORD_FOR_ALIAS.exception();
    }

    @Override
    public Object visitEnumValue(HogQLParser.EnumValueContext ctx) {
        throw UnsupportedRule.ENUM_VALUE.exception();
    }

    // ========== CONSTANTS ==========

    @Override
    public Object visitLiteral(HogQLParser.LiteralContext ctx) {
        return VisitLiteral.v(ctx, this);
    }

    @Override
    public Object visitNumberLiteral(HogQLParser.NumberLiteralContext ctx) {
        return VisitLiteral.v(ctx, this);
    }

    @Override
    public Object visitFloatingLiteral(HogQLParser.FloatingLiteralContext ctx) {
        throw UnsupportedRule.FLOATING_LITERAL.exception();
    }
}
