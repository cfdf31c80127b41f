package com.sql2kql.logical;

import java.util.Objects;

/**
 * A parenthesized subquery used as a source, optionally aliased.
 */
public final class SubqueryRelation implements Relation {

    private final QueryNode query;
    private final String alias;

    public SubqueryRelation(QueryNode query, String alias) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.alias = alias;
    }

    public QueryNode query() {
        return query;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public String toSQL() {
        String sql = "(" + query.toSQL() + ")";
        return alias == null ? sql : sql + " AS " + alias;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubqueryRelation)) return false;
        SubqueryRelation that = (SubqueryRelation) obj;
        return query.equals(that.query) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, alias);
    }
}
