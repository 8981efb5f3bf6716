package me.christianrobert.hogql.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.expression.Alias;
import me.christianrobert.hogql.ast.expression.And;
import me.christianrobert.hogql.ast.expression.ArithmeticOperation;
import me.christianrobert.hogql.ast.expression.Array;
import me.christianrobert.hogql.ast.expression.ArrayAccess;
import me.christianrobert.hogql.ast.expression.BetweenExpr;
import me.christianrobert.hogql.ast.expression.Call;
import me.christianrobert.hogql.ast.expression.CompareOperation;
import me.christianrobert.hogql.ast.expression.Constant;
import me.christianrobert.hogql.ast.expression.Field;
import me.christianrobert.hogql.ast.expression.Lambda;
import me.christianrobert.hogql.ast.expression.Not;
import me.christianrobert.hogql.ast.expression.Or;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.Placeholder;
import me.christianrobert.hogql.ast.expression.Tuple;
import me.christianrobert.hogql.ast.expression.TupleAccess;
import me.christianrobert.hogql.ast.expression.WindowExpr;
import me.christianrobert.hogql.ast.expression.WindowFrameExpr;
import me.christianrobert.hogql.ast.expression.WindowFunction;
import me.christianrobert.hogql.ast.query.CTE;
import me.christianrobert.hogql.ast.query.JoinConstraint;
import me.christianrobert.hogql.ast.query.JoinExpr;
import me.christianrobert.hogql.ast.query.RatioExpr;
import me.christianrobert.hogql.ast.query.SampleExpr;
import me.christianrobert.hogql.ast.query.SelectQuery;
import me.christianrobert.hogql.ast.query.SelectSetNode;
import me.christianrobert.hogql.ast.query.SelectSetQuery;
import me.christianrobert.hogql.context.HogQLException;
import me.christianrobert.hogql.context.ParsingException;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Renders AST nodes as Jackson trees.
 *
 * <p>Every node becomes an object with a {@code "node"} discriminator holding the variant name
 * and one snake_case property per field, e.g.
 * <pre>
 * {"node": "CompareOperation", "op": "==", "left": {"node": "Field", "chain": ["a"]},
 *  "right": {"node": "Constant", "value": 1}}
 * </pre>
 *
 * <p>Infinite and NaN doubles have no JSON number form; they are written as the strings
 * {@code Infinity}, {@code -Infinity} and {@code NaN} together with {@code "value_type": "number"}.
 */
public class AstJsonWriter implements AstVisitor<JsonNode> {

    private final ObjectMapper objectMapper;

    public AstJsonWriter() {
        this(new ObjectMapper());
    }

    public AstJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode toJson(AstNode node) {
        if (node == null) {
            return objectMapper.nullNode();
        }
        return node.accept(this);
    }

    public String toJsonString(AstNode node) {
        try {
            return objectMapper.writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new ParsingException("Failed to serialize AST: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Error object in the form {@code {"error": true, "type", "message", "start", "end"}}.
     * Positions are offsets only; line and column are reported as 0.
     */
    public ObjectNode errorJson(HogQLException exception) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("error", true);
        json.put("type", exception.getErrorType());
        json.put("message", exception.getMessage());
        json.set("start", position(exception.getStart()));
        json.set("end", position(exception.getEnd()));
        return json;
    }

    private ObjectNode position(Integer offset) {
        ObjectNode pos = objectMapper.createObjectNode();
        pos.put("line", 0);
        pos.put("column", 0);
        pos.put("offset", offset != null ? offset : 0);
        return pos;
    }

    private ObjectNode node(String name) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("node", name);
        return json;
    }

    private JsonNode list(List<? extends AstNode> nodes) {
        if (nodes == null) {
            return objectMapper.nullNode();
        }
        ArrayNode array = objectMapper.createArrayNode();
        for (AstNode n : nodes) {
            array.add(toJson(n));
        }
        return array;
    }

    private JsonNode strings(List<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    private JsonNode map(Map<String, ? extends AstNode> nodes) {
        if (nodes == null) {
            return objectMapper.nullNode();
        }
        ObjectNode json = objectMapper.createObjectNode();
        for (Map.Entry<String, ? extends AstNode> entry : nodes.entrySet()) {
            json.set(entry.getKey(), toJson(entry.getValue()));
        }
        return json;
    }

    // ========== EXPRESSIONS ==========

    @Override
    public JsonNode visitConstant(Constant node) {
        ObjectNode json = node("Constant");
        Object value = node.getValue();
        if (value == null) {
            json.putNull("value");
        } else if (value instanceof Boolean) {
            json.put("value", (Boolean) value);
        } else if (value instanceof BigInteger) {
            json.put("value", (BigInteger) value);
        } else if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d)) {
                json.put("value", "NaN");
                json.put("value_type", "number");
            } else if (Double.isInfinite(d)) {
                json.put("value", d > 0 ? "Infinity" : "-Infinity");
                json.put("value_type", "number");
            } else {
                json.put("value", d);
            }
        } else {
            json.put("value", (String) value);
        }
        return json;
    }

    @Override
    public JsonNode visitField(Field node) {
        ObjectNode json = node("Field");
        json.set("chain", strings(node.getChain()));
        return json;
    }

    @Override
    public JsonNode visitPlaceholder(Placeholder node) {
        ObjectNode json = node("Placeholder");
        json.put("field", node.getField());
        return json;
    }

    @Override
    public JsonNode visitCall(Call node) {
        ObjectNode json = node("Call");
        json.put("name", node.getName());
        json.set("params", list(node.getParams()));
        json.set("args", list(node.getArgs()));
        json.put("distinct", node.isDistinct());
        return json;
    }

    @Override
    public JsonNode visitArithmeticOperation(ArithmeticOperation node) {
        ObjectNode json = node("ArithmeticOperation");
        json.put("op", node.getOp().getSymbol());
        json.set("left", toJson(node.getLeft()));
        json.set("right", toJson(node.getRight()));
        return json;
    }

    @Override
    public JsonNode visitCompareOperation(CompareOperation node) {
        ObjectNode json = node("CompareOperation");
        json.put("op", node.getOp().getSymbol());
        json.set("left", toJson(node.getLeft()));
        json.set("right", toJson(node.getRight()));
        return json;
    }

    @Override
    public JsonNode visitBetweenExpr(BetweenExpr node) {
        ObjectNode json = node("BetweenExpr");
        json.set("expr", toJson(node.getExpr()));
        json.set("low", toJson(node.getLow()));
        json.set("high", toJson(node.getHigh()));
        json.put("negated", node.isNegated());
        return json;
    }

    @Override
    public JsonNode visitAnd(And node) {
        ObjectNode json = node("And");
        json.set("exprs", list(node.getExprs()));
        return json;
    }

    @Override
    public JsonNode visitOr(Or node) {
        ObjectNode json = node("Or");
        json.set("exprs", list(node.getExprs()));
        return json;
    }

    @Override
    public JsonNode visitNot(Not node) {
        ObjectNode json = node("Not");
        json.set("expr", toJson(node.getExpr()));
        return json;
    }

    @Override
    public JsonNode visitAlias(Alias node) {
        ObjectNode json = node("Alias");
        json.put("alias", node.getAlias());
        json.set("expr", toJson(node.getExpr()));
        return json;
    }

    @Override
    public JsonNode visitTuple(Tuple node) {
        ObjectNode json = node("Tuple");
        json.set("exprs", list(node.getExprs()));
        return json;
    }

    @Override
    public JsonNode visitArray(Array node) {
        ObjectNode json = node("Array");
        json.set("exprs", list(node.getExprs()));
        return json;
    }

    @Override
    public JsonNode visitArrayAccess(ArrayAccess node) {
        ObjectNode json = node("ArrayAccess");
        json.set("array", toJson(node.getArray()));
        json.set("property", toJson(node.getProperty()));
        json.put("nullish", node.isNullish());
        return json;
    }

    @Override
    public JsonNode visitTupleAccess(TupleAccess node) {
        ObjectNode json = node("TupleAccess");
        json.set("tuple", toJson(node.getTuple()));
        json.put("index", node.getIndex());
        json.put("nullish", node.isNullish());
        return json;
    }

    @Override
    public JsonNode visitLambda(Lambda node) {
        ObjectNode json = node("Lambda");
        json.set("args", strings(node.getArgs()));
        json.set("expr", toJson(node.getExpr()));
        return json;
    }

    @Override
    public JsonNode visitWindowFunction(WindowFunction node) {
        ObjectNode json = node("WindowFunction");
        json.put("name", node.getName());
        json.set("args", list(node.getArgs()));
        json.set("over_expr", toJson(node.getOverExpr()));
        json.put("over_identifier", node.getOverIdentifier());
        return json;
    }

    @Override
    public JsonNode visitOrderExpr(OrderExpr node) {
        ObjectNode json = node("OrderExpr");
        json.set("expr", toJson(node.getExpr()));
        json.put("order", node.getOrder().name());
        return json;
    }

    @Override
    public JsonNode visitWindowExpr(WindowExpr node) {
        ObjectNode json = node("WindowExpr");
        json.set("partition_by", list(node.getPartitionBy()));
        json.set("order_by", list(node.getOrderBy()));
        json.put("frame_method", node.getFrameMethod() != null ? node.getFrameMethod().name() : null);
        json.set("frame_start", toJson(node.getFrameStart()));
        json.set("frame_end", toJson(node.getFrameEnd()));
        return json;
    }

    @Override
    public JsonNode visitWindowFrameExpr(WindowFrameExpr node) {
        ObjectNode json = node("WindowFrameExpr");
        json.put("frame_type", node.getFrameType().getKeyword());
        Number frameValue = node.getFrameValue();
        if (frameValue == null) {
            json.putNull("frame_value");
        } else if (frameValue instanceof BigInteger) {
            json.put("frame_value", (BigInteger) frameValue);
        } else {
            json.put("frame_value", frameValue.doubleValue());
        }
        return json;
    }

    // ========== QUERIES ==========

    @Override
    public JsonNode visitSelectQuery(SelectQuery node) {
        ObjectNode json = node("SelectQuery");
        json.set("ctes", map(node.getCtes()));
        json.set("select", list(node.getSelect()));
        json.put("distinct", node.isDistinct());
        json.set("select_from", toJson(node.getSelectFrom()));
        json.put("array_join_op", node.getArrayJoinOp());
        json.set("array_join_list", list(node.getArrayJoinList()));
        json.set("prewhere", toJson(node.getPrewhere()));
        json.set("where", toJson(node.getWhere()));
        json.set("group_by", list(node.getGroupBy()));
        json.set("having", toJson(node.getHaving()));
        json.set("window_exprs", map(node.getWindowExprs()));
        json.set("order_by", list(node.getOrderBy()));
        json.set("limit", toJson(node.getLimit()));
        json.set("offset", toJson(node.getOffset()));
        json.set("limit_by", list(node.getLimitBy()));
        json.put("limit_with_ties", node.isLimitWithTies());
        return json;
    }

    @Override
    public JsonNode visitSelectSetQuery(SelectSetQuery node) {
        ObjectNode json = node("SelectSetQuery");
        json.set("initial_select_query", toJson(node.getInitialSelectQuery()));
        json.set("subsequent_select_queries", list(node.getSubsequentSelectQueries()));
        return json;
    }

    @Override
    public JsonNode visitSelectSetNode(SelectSetNode node) {
        ObjectNode json = node("SelectSetNode");
        json.put("set_operator", node.getSetOperator().getKeyword());
        json.set("select_query", toJson(node.getSelectQuery()));
        return json;
    }

    @Override
    public JsonNode visitJoinExpr(JoinExpr node) {
        ObjectNode json = node("JoinExpr");
        json.put("join_type", node.getJoinType());
        json.set("table", toJson(node.getTable()));
        json.set("table_args", list(node.getTableArgs()));
        json.put("alias", node.getAlias());
        if (node.getTableFinal() == null) {
            json.putNull("table_final");
        } else {
            json.put("table_final", node.getTableFinal());
        }
        json.set("sample", toJson(node.getSample()));
        json.set("constraint", toJson(node.getConstraint()));
        json.set("next_join", toJson(node.getNextJoin()));
        return json;
    }

    @Override
    public JsonNode visitJoinConstraint(JoinConstraint node) {
        ObjectNode json = node("JoinConstraint");
        json.set("expr", toJson(node.getExpr()));
        json.put("constraint_type", "ON");
        return json;
    }

    @Override
    public JsonNode visitSampleExpr(SampleExpr node) {
        ObjectNode json = node("SampleExpr");
        json.set("sample_value", toJson(node.getSampleValue()));
        json.set("offset_value", toJson(node.getOffsetValue()));
        return json;
    }

    @Override
    public JsonNode visitRatioExpr(RatioExpr node) {
        ObjectNode json = node("RatioExpr");
        json.set("left", toJson(node.getLeft()));
        json.set("right", toJson(node.getRight()));
        return json;
    }

    @Override
    public JsonNode visitCTE(CTE node) {
        ObjectNode json = node("CTE");
        json.put("name", node.getName());
        json.set("expr", toJson(node.getExpr()));
        json.put("cte_type", node.getCteType().getValue());
        return json;
    }
}
