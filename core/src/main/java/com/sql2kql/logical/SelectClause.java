package com.sql2kql.logical;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The SELECT list of a query block, with its whole-list DISTINCT flag.
 */
public final class SelectClause {

    private final boolean distinct;
    private final List<SelectItem> items;

    public SelectClause(boolean distinct, List<SelectItem> items) {
        this.distinct = distinct;
        this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<SelectItem> items() {
        return items;
    }

    public String toSQL() {
        return "SELECT " + (distinct ? "DISTINCT " : "") +
            items.stream().map(SelectItem::toSQL).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectClause)) return false;
        SelectClause that = (SelectClause) obj;
        return distinct == that.distinct && items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(distinct, items);
    }
}
