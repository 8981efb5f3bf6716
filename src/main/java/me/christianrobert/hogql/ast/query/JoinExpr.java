package me.christianrobert.hogql.ast.query;

import me.christianrobert.hogql.ast.AstNode;
import me.christianrobert.hogql.ast.AstVisitor;
import me.christianrobert.hogql.ast.Expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One member of a FROM clause join chain.
 *
 * <p>Chains are left-deep linked lists: the head is the first table in FROM, and every
 * following member is reached through {@link #getNextJoin()}. A member's {@code joinType}
 * and {@code constraint} describe how it joins onto everything before it, so the head
 * carries neither.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 */
public class JoinExpr implements AstNode {

    private final Expr table;
    private final List<Expr> tableArgs;
    private final String alias;
    private final Boolean tableFinal;
    private final SampleExpr sample;
    private final String joinType;
    private final JoinConstraint constraint;
    private final JoinExpr nextJoin;

    public JoinExpr(Expr table) {
        this(table, null, null, null, null, null, null, null);
    }

    public JoinExpr(Expr table, List<Expr> tableArgs) {
        this(table, tableArgs, null, null, null, null, null, null);
    }

    private JoinExpr(Expr table, List<Expr> tableArgs, String alias, Boolean tableFinal, SampleExpr sample,
                     String joinType, JoinConstraint constraint, JoinExpr nextJoin) {
        if (table == null) {
            throw new IllegalArgumentException("JoinExpr table cannot be null");
        }
        this.table = table;
        this.tableArgs = tableArgs == null ? null : Collections.unmodifiableList(new ArrayList<>(tableArgs));
        this.alias = alias;
        this.tableFinal = tableFinal;
        this.sample = sample;
        this.joinType = joinType;
        this.constraint = constraint;
        this.nextJoin = nextJoin;
    }

    public Expr getTable() {
        return table;
    }

    public List<Expr> getTableArgs() {
        return tableArgs;
    }

    public String getAlias() {
        return alias;
    }

    public Boolean getTableFinal() {
        return tableFinal;
    }

    public SampleExpr getSample() {
        return sample;
    }

    public String getJoinType() {
        return joinType;
    }

    public JoinConstraint getConstraint() {
        return constraint;
    }

    public JoinExpr getNextJoin() {
        return nextJoin;
    }

    public JoinExpr withAlias(String alias) {
        return new JoinExpr(table, tableArgs, alias, tableFinal, sample, joinType, constraint, nextJoin);
    }

    public JoinExpr withFinalAndSample(Boolean tableFinal, SampleExpr sample) {
        return new JoinExpr(table, tableArgs, alias, tableFinal, sample, joinType, constraint, nextJoin);
    }

    public JoinExpr withJoin(String joinType, JoinConstraint constraint) {
        return new JoinExpr(table, tableArgs, alias, tableFinal, sample, joinType, constraint, nextJoin);
    }

    /**
     * Returns a copy of this chain with {@code next} linked after the current tail.
     * Members of this chain are relinked from the tail backwards; {@code next} is shared as is.
     */
    public JoinExpr appendToChain(JoinExpr next) {
        if (next == null) {
            throw new IllegalArgumentException("Appended join cannot be null");
        }
        List<JoinExpr> members = chain();
        JoinExpr tail = next;
        for (int i = members.size() - 1; i >= 0; i--) {
            tail = members.get(i).withNextJoin(tail);
        }
        return tail;
    }

    private JoinExpr withNextJoin(JoinExpr nextJoin) {
        return new JoinExpr(table, tableArgs, alias, tableFinal, sample, joinType, constraint, nextJoin);
    }

    /**
     * Flattens the chain starting at this member, head first.
     */
    public List<JoinExpr> chain() {
        List<JoinExpr> members = new ArrayList<>();
        JoinExpr current = this;
        while (current != null) {
            members.add(current);
            current = current.nextJoin;
        }
        return members;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitJoinExpr(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JoinExpr left = this;
        JoinExpr right = (JoinExpr) o;
        while (left != null && right != null) {
            if (left == right) return true;
            if (!left.sameMember(right)) return false;
            left = left.nextJoin;
            right = right.nextJoin;
        }
        return left == null && right == null;
    }

    private boolean sameMember(JoinExpr that) {
        return table.equals(that.table)
                && Objects.equals(tableArgs, that.tableArgs)
                && Objects.equals(alias, that.alias)
                && Objects.equals(tableFinal, that.tableFinal)
                && Objects.equals(sample, that.sample)
                && Objects.equals(joinType, that.joinType)
                && Objects.equals(constraint, that.constraint);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (JoinExpr member = this; member != null; member = member.nextJoin) {
            result = 31 * result + Objects.hash(member.table, member.tableArgs, member.alias, member.tableFinal,
                    member.sample, member.joinType, member.constraint);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int open = 0;
        for (JoinExpr member = this; member != null; member = member.nextJoin) {
            if (open > 0) {
                sb.append(", nextJoin=");
            }
            sb.append("JoinExpr{table=").append(member.table);
            if (member.alias != null) {
                sb.append(", alias='").append(member.alias).append("'");
            }
            if (member.joinType != null) {
                sb.append(", joinType='").append(member.joinType).append("'");
            }
            if (member.constraint != null) {
                sb.append(", constraint=").append(member.constraint);
            }
            open++;
        }
        for (int i = 0; i < open; i++) {
            sb.append("}");
        }
        return sb.toString();
    }
}
