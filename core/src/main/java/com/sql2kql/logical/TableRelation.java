package com.sql2kql.logical;

import java.util.Objects;

/**
 * A named table, optionally aliased. The name may be dotted ({@code db.table}).
 */
public final class TableRelation implements Relation {

    private final String name;
    private final String alias;

    public TableRelation(String name, String alias) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.alias = alias;
    }

    public TableRelation(String name) {
        this(name, null);
    }

    public String name() {
        return name;
    }

    @Override
    public String alias() {
        return alias;
    }

    @Override
    public String toSQL() {
        return alias == null ? name : name + " AS " + alias;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableRelation)) return false;
        TableRelation that = (TableRelation) obj;
        return name.equals(that.name) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias);
    }
}
