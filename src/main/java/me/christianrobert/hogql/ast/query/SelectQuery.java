package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;
import me.christianrobert.hogql.ast.expression.OrderExpr;
import me.christianrobert.hogql.ast.expression.WindowExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single SELECT statement.
 *
 * <p>Optional clauses are null when absent. Maps keep source order. Construct through {@link #builder()}.
 */
public class SelectQuery implements Expr {

    private final Map<String, CTE> ctes;
    private final List<Expr> select;
    private final boolean distinct;
    private final JoinExpr selectFrom;
    private final Expr where;
    private final Expr prewhere;
    private final Expr having;
    private final List<Expr> groupBy;
    private final List<OrderExpr> orderBy;
    private final Map<String, WindowExpr> windowExprs;
    private final Expr limit;
    private final Expr offset;
    private final List<Expr> limitBy;
    private final boolean limitWithTies;
    private final String arrayJoinOp;
    private final List<Expr> arrayJoinList;

    private SelectQuery(Builder builder) {
        if (builder.select == null) {
            throw new IllegalArgumentException("SelectQuery select list cannot be null");
        }
        if (builder.arrayJoinList != null && builder.selectFrom == null) {
            throw new IllegalArgumentException("SelectQuery arrayJoinList requires selectFrom");
        }
        this.ctes = copyOf(builder.ctes);
        this.select = Collections.unmodifiableList(new ArrayList<>(builder.select));
        this.distinct = builder.distinct;
        this.selectFrom = builder.selectFrom;
        this.where = builder.where;
        this.prewhere = builder.prewhere;
        this.having = builder.having;
        this.groupBy = copyOf(builder.groupBy);
        this.orderBy = copyOf(builder.orderBy);
        this.windowExprs = copyOf(builder.windowExprs);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.limitBy = copyOf(builder.limitBy);
        this.limitWithTies = builder.limitWithTies;
        this.arrayJoinOp = builder.arrayJoinOp;
        this.arrayJoinList = copyOf(builder.arrayJoinList);
    }

    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static <V> Map<String, V> copyOf(Map<String, V> map) {
        return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, CTE> getCtes() {
        return ctes;
    }

    public List<Expr> getSelect() {
        return select;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public JoinExpr getSelectFrom() {
        return selectFrom;
    }

    public Expr getWhere() {
        return where;
    }

    public Expr getPrewhere() {
        return prewhere;
    }

    public Expr getHaving() {
        return having;
    }

    public List<Expr> getGroupBy() {
        return groupBy;
    }

    public List<OrderExpr> getOrderBy() {
        return orderBy;
    }

    public Map<String, WindowExpr> getWindowExprs() {
        return windowExprs;
    }

    public Expr getLimit() {
        return limit;
    }

    public Expr getOffset() {
        return offset;
    }

    public List<Expr> getLimitBy() {
        return limitBy;
    }

    public boolean isLimitWithTies() {
        return limitWithTies;
    }

    public String getArrayJoinOp() {
        return arrayJoinOp;
    }

    public List<Expr> getArrayJoinList() {
        return arrayJoinList;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitSelectQuery(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectQuery that = (SelectQuery) o;
        return distinct == that.distinct
                && limitWithTies == that.limitWithTies
                && Objects.equals(ctes, that.ctes)
                && select.equals(that.select)
                && Objects.equals(selectFrom, that.selectFrom)
                && Objects.equals(where, that.where)
                && Objects.equals(prewhere, that.prewhere)
                && Objects.equals(having, that.having)
                && Objects.equals(groupBy, that.groupBy)
                && Objects.equals(orderBy, that.orderBy)
                && Objects.equals(windowExprs, that.windowExprs)
                && Objects.equals(limit, that.limit)
                && Objects.equals(offset, that.offset)
                && Objects.equals(limitBy, that.limitBy)
                && Objects.equals(arrayJoinOp, that.arrayJoinOp)
                && Objects.equals(arrayJoinList, that.arrayJoinList);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ctes, select, distinct, selectFrom, where, prewhere, having, groupBy, orderBy,
                windowExprs, limit, offset, limitBy, limitWithTies, arrayJoinOp, arrayJoinList);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SelectQuery{select=").append(select);
        if (distinct) sb.append(", distinct=true");
        if (ctes != null) sb.append(", ctes=").append(ctes);
        if (selectFrom != null) sb.append(", selectFrom=").append(selectFrom);
        if (arrayJoinOp != null) sb.append(", arrayJoinOp='").append(arrayJoinOp).append("', arrayJoinList=").append(arrayJoinList);
        if (prewhere != null) sb.append(", prewhere=").append(prewhere);
        if (where != null) sb.append(", where=").append(where);
        if (groupBy != null) sb.append(", groupBy=").append(groupBy);
        if (having != null) sb.append(", having=").append(having);
        if (windowExprs != null) sb.append(", windowExprs=").append(windowExprs);
        if (orderBy != null) sb.append(", orderBy=").append(orderBy);
        if (limit != null) sb.append(", limit=").append(limit);
        if (offset != null) sb.append(", offset=").append(offset);
        if (limitBy != null) sb.append(", limitBy=").append(limitBy);
        if (limitWithTies) sb.append(", limitWithTies=true");
        return sb.append("}").toString();
    }

    public static class Builder {
        private Map<String, CTE> ctes;
        private List<Expr> select = new ArrayList<>();
        private boolean distinct;
        private JoinExpr selectFrom;
        private Expr where;
        private Expr prewhere;
        private Expr having;
        private List<Expr> groupBy;
        private List<OrderExpr> orderBy;
        private Map<String, WindowExpr> windowExprs;
        private Expr limit;
        private Expr offset;
        private List<Expr> limitBy;
        private boolean limitWithTies;
        private String arrayJoinOp;
        private List<Expr> arrayJoinList;

        private Builder() {
        }

        public Builder ctes(Map<String, CTE> ctes) {
            this.ctes = ctes;
            return this;
        }

        public Builder select(List<Expr> select) {
            this.select = select;
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder selectFrom(JoinExpr selectFrom) {
            this.selectFrom = selectFrom;
            return this;
        }

        public Builder where(Expr where) {
            this.where = where;
            return this;
        }

        public Builder prewhere(Expr prewhere) {
            this.prewhere = prewhere;
            return this;
        }

        public Builder having(Expr having) {
            this.having = having;
            return this;
        }

        public Builder groupBy(List<Expr> groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder orderBy(List<OrderExpr> orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder windowExprs(Map<String, WindowExpr> windowExprs) {
            this.windowExprs = windowExprs;
            return this;
        }

        public Builder limit(Expr limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Expr offset) {
            this.offset = offset;
            return this;
        }

        public Builder limitBy(List<Expr> limitBy) {
            this.limitBy = limitBy;
            return this;
        }

        public Builder limitWithTies(boolean limitWithTies) {
            this.limitWithTies = limitWithTies;
            return this;
        }

        public Builder arrayJoin(String arrayJoinOp, List<Expr> arrayJoinList) {
            this.arrayJoinOp = arrayJoinOp;
            this.arrayJoinList = arrayJoinList;
            return this;
        }

        public JoinExpr getSelectFrom() {
            return selectFrom;
        }

        public SelectQuery build() {
            return new SelectQuery(this);
        }
    }
}
