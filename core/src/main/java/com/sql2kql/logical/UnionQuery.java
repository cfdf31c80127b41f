package com.sql2kql.logical;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A UNION or UNION ALL of two query branches.
 *
 * <p>ORDER BY and LIMIT on this node apply to the combined result. UNION (without ALL)
 * is translated as UNION ALL followed by {@code distinct *}.
 */
public final class UnionQuery extends QueryNode {

    private final QueryNode left;
    private final QueryNode right;
    private final boolean all;

    public UnionQuery(QueryNode left, QueryNode right, boolean all,
                      List<SortOrder> orderBy, OptionalLong limit) {
        super(orderBy, limit);
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.all = all;
    }

    public UnionQuery(QueryNode left, QueryNode right, boolean all) {
        this(left, right, all, List.of(), OptionalLong.empty());
    }

    public QueryNode left() {
        return left;
    }

    public QueryNode right() {
        return right;
    }

    /**
     * Returns whether duplicates are kept.
     *
     * @return true for UNION ALL, false for UNION
     */
    public boolean isAll() {
        return all;
    }

    /**
     * Returns a copy of this union carrying different ORDER BY / LIMIT.
     *
     * @param newOrderBy the new ORDER BY items
     * @param newLimit the new LIMIT
     * @return the new union node
     */
    public UnionQuery withOrganization(List<SortOrder> newOrderBy, OptionalLong newLimit) {
        return new UnionQuery(left, right, all, newOrderBy, newLimit);
    }

    @Override
    public String toSQL() {
        return "(" + left.toSQL() + ") UNION " + (all ? "ALL " : "") + "(" + right.toSQL() + ")"
            + organizationSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnionQuery)) return false;
        UnionQuery that = (UnionQuery) obj;
        return all == that.all &&
               left.equals(that.left) &&
               right.equals(that.right) &&
               orderBy.equals(that.orderBy) &&
               limit.equals(that.limit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, all, orderBy, limit);
    }
}
