package com.sql2kql.logical;

import java.util.List;
import java.util.Objects;

/**
 * A FROM clause: one leading source followed by its joins in source order.
 */
public final class FromClause {

    private final Relation source;
    private final List<JoinClause> joins;

    public FromClause(Relation source, List<JoinClause> joins) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.joins = List.copyOf(Objects.requireNonNull(joins, "joins must not be null"));
    }

    public FromClause(Relation source) {
        this(source, List.of());
    }

    public Relation source() {
        return source;
    }

    public List<JoinClause> joins() {
        return joins;
    }

    public boolean hasJoins() {
        return !joins.isEmpty();
    }

    public String toSQL() {
        StringBuilder sb = new StringBuilder("FROM ").append(source.toSQL());
        for (JoinClause join : joins) {
            sb.append(' ').append(join.toSQL());
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
        if (!(obj instanceof FromClause)) return false;
        FromClause that = (FromClause) obj;
        return source.equals(that.source) && joins.equals(that.joins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, joins);
    }
}
