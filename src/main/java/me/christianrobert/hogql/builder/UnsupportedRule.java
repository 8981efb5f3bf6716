package me.christianrobert.hogql.builder;

import me.christianrobert.hogql.context.NotImplementedException;

/**
 * Grammar rules that parse but have no AST translation yet.
 *
 * <p>Reaching one of these during a visit aborts the call with a {@link NotImplementedException}
 * naming the rule. Supporting a rule means removing it from this list and adding a handler.
 */
public enum UnsupportedRule {
    TOP_CLAUSE("TopClause"),
    ARRAY_JOIN_CLAUSE("ArrayJoinClause"),
    WINDOW_CLAUSE("WindowClause"),
    PROJECTION_ORDER_BY_CLAUSE("ProjectionOrderByClause"),
    LIMIT_AND_OFFSET_CLAUSE("LimitAndOffsetClause"),
    SETTINGS_CLAUSE("SettingsClause"),
    JOIN_OP_CROSS("JoinOpCross"),
    SETTING_EXPR_LIST("SettingExprList"),
    SETTING_EXPR("SettingExpr"),
    COLUMN_TYPE_EXPR_SIMPLE("ColumnTypeExprSimple"),
    COLUMN_TYPE_EXPR_NESTED("ColumnTypeExprNested"),
    COLUMN_TYPE_EXPR_ENUM("ColumnTypeExprEnum"),
    COLUMN_TYPE_EXPR_COMPLEX("ColumnTypeExprComplex"),
    COLUMN_TYPE_EXPR_PARAM("ColumnTypeExprParam"),
    COLUMN_EXPR_EXTRACT("ColumnExprExtract"),
    COLUMN_EXPR_SUBSTRING("ColumnExprSubstring"),
    COLUMN_EXPR_CAST("ColumnExprCast"),
    COLUMN_EXPR_TIMESTAMP("ColumnExprTimestamp"),
    COLUMN_EXPR_DATE("ColumnExprDate"),
    FLOATING_LITERAL("FloatingLiteral"),
    INTERVAL("Interval"),
    KEYWORD("Keyword"),
    KEYWORD_FOR_ALIAS("KeywordForAlias"),
    ENUM_VALUE("EnumValue");

    private final String ruleName;

    UnsupportedRule(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }

    public NotImplementedException exception() {
        return new NotImplementedException("Unsupported rule: " + ruleName);
    }
}
