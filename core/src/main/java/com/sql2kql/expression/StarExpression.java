package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a star (*) in SELECT lists and function arguments.
 *
 * <p>This can be unqualified (*) or qualified (table.*).
 *
 * <p>Examples:
 * <pre>
 *   SELECT * FROM table
 *   SELECT t1.* FROM table1 t1 JOIN table2 t2 ON t1.id = t2.id
 *   SELECT count(*) FROM table
 * </pre>
 */
public final class StarExpression implements Expression {

    private final String qualifier;

    /**
     * Creates an unqualified star expression (*).
     */
    public StarExpression() {
        this.qualifier = null;
    }

    /**
     * Creates a qualified star expression (table.*).
     *
     * @param qualifier the table name or alias
     */
    public StarExpression(String qualifier) {
        this.qualifier = qualifier;
    }

    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    @Override
    public String toSQL() {
        if (qualifier != null) {
            return qualifier + ".*";
        } else {
            return "*";
        }
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StarExpression)) return false;
        StarExpression that = (StarExpression) obj;
        return Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifier);
    }
}
