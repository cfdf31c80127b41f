package com.sql2kql.logical;

import com.sql2kql.expression.Expression;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * A single SELECT block.
 *
 * <p>SQL form:
 * <pre>
 *   SELECT [DISTINCT] items FROM source [joins]
 *   [WHERE condition] [GROUP BY keys] [ORDER BY sort] [LIMIT n]
 * </pre>
 *
 * <p>The block is translated into pipeline stages in a fixed order:
 * source and joins, {@code where}, then either {@code summarize} or
 * {@code extend}/{@code project}, then {@code order by}, {@code distinct} and {@code limit}.
 */
public final class SelectQuery extends QueryNode {

    private final SelectClause select;
    private final FromClause from;
    private final Expression where;
    private final List<Expression> groupBy;

    /**
     * Creates a select query.
     *
     * @param select the SELECT list
     * @param from the FROM clause
     * @param where the WHERE condition (may be null)
     * @param groupBy the GROUP BY keys (empty when absent)
     * @param orderBy the ORDER BY items (empty when absent)
     * @param limit the LIMIT row count
     */
    public SelectQuery(SelectClause select, FromClause from, Expression where,
                       List<Expression> groupBy, List<SortOrder> orderBy, OptionalLong limit) {
        super(orderBy, limit);
        this.select = Objects.requireNonNull(select, "select must not be null");
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.where = where;
        this.groupBy = List.copyOf(Objects.requireNonNull(groupBy, "groupBy must not be null"));
    }

    public SelectQuery(SelectClause select, FromClause from, Expression where) {
        this(select, from, where, List.of(), List.of(), OptionalLong.empty());
    }

    public SelectClause select() {
        return select;
    }

    public FromClause from() {
        return from;
    }

    /**
     * Returns the WHERE condition.
     *
     * @return the condition, or null if absent
     */
    public Expression where() {
        return where;
    }

    public List<Expression> groupBy() {
        return groupBy;
    }

    public boolean hasGroupBy() {
        return !groupBy.isEmpty();
    }

    @Override
    public String toSQL() {
        StringBuilder sb = new StringBuilder(select.toSQL());
        sb.append(' ').append(from.toSQL());
        if (where != null) {
            sb.append(" WHERE ").append(where.toSQL());
        }
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ");
            sb.append(groupBy.stream().map(Expression::toSQL).collect(Collectors.joining(", ")));
        }
        sb.append(organizationSQL());
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectQuery)) return false;
        SelectQuery that = (SelectQuery) obj;
        return select.equals(that.select) &&
               from.equals(that.from) &&
               Objects.equals(where, that.where) &&
               groupBy.equals(that.groupBy) &&
               orderBy.equals(that.orderBy) &&
               limit.equals(that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(select, from, where, groupBy, orderBy, limit);
    }
}
