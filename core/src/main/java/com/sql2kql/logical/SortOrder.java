package com.sql2kql.logical;

import com.sql2kql.expression.Expression;
import java.util.Objects;

/**
 * One ORDER BY item: a sort key with a direction and an optional null ordering.
 */
public final class SortOrder {

    private final Expression expression;
    private final SortDirection direction;
    private final NullOrdering nullOrdering;

    public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering must not be null");
    }

    public SortOrder(Expression expression, SortDirection direction) {
        this(expression, direction, NullOrdering.UNSPECIFIED);
    }

    public Expression expression() {
        return expression;
    }

    public SortDirection direction() {
        return direction;
    }

    public NullOrdering nullOrdering() {
        return nullOrdering;
    }

    public String toSQL() {
        StringBuilder sb = new StringBuilder(expression.toSQL());
        sb.append(direction == SortDirection.ASCENDING ? " ASC" : " DESC");
        if (nullOrdering == NullOrdering.NULLS_FIRST) {
            sb.append(" NULLS FIRST");
        } else if (nullOrdering == NullOrdering.NULLS_LAST) {
            sb.append(" NULLS LAST");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return expression.equals(that.expression) &&
               direction == that.direction &&
               nullOrdering == that.nullOrdering;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, direction, nullOrdering);
    }

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering. {@code UNSPECIFIED} leaves the target language's default in place.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST,
        UNSPECIFIED
    }
}
