package com.sql2kql.logical;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Base class for the parsed form of a query.
 *
 * <p>A query is either a single {@link SelectQuery} block or a {@link UnionQuery} of two
 * branches. Both shapes carry the ORDER BY and LIMIT that apply to their own result.
 * Nodes are immutable; the same tree can be translated any number of times, from any
 * number of threads.
 *
 * <p>The query is translated to the target language by
 * {@link com.sql2kql.generator.KQLGenerator#generate(QueryNode)}.
 */
public abstract class QueryNode {

    /** ORDER BY items, empty when absent */
    protected final List<SortOrder> orderBy;

    /** LIMIT row count, empty when absent */
    protected final OptionalLong limit;

    protected QueryNode(List<SortOrder> orderBy, OptionalLong limit) {
        this.orderBy = List.copyOf(Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.limit = Objects.requireNonNull(limit, "limit must not be null");
    }

    /**
     * Returns the ORDER BY items.
     *
     * @return an unmodifiable list of sort orders
     */
    public List<SortOrder> orderBy() {
        return orderBy;
    }

    public OptionalLong limit() {
        return limit;
    }

    /**
     * Renders this query back to SQL for diagnostics.
     *
     * @return the SQL text
     */
    public abstract String toSQL();

    /**
     * Renders the ORDER BY / LIMIT suffix shared by both query shapes.
     *
     * @return the suffix, starting with a space, or an empty string
     */
    protected String organizationSQL() {
        StringBuilder sb = new StringBuilder();
        if (!orderBy.isEmpty()) {
            sb.append(" ORDER BY ");
            sb.append(orderBy.stream().map(SortOrder::toSQL).collect(Collectors.joining(", ")));
        }
        if (limit.isPresent()) {
            sb.append(" LIMIT ").append(limit.getAsLong());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
