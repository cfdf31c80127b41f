package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a (possibly qualified) column reference.
 *
 * <p>The optional qualifier is the table name or alias written before the dot
 * ({@code t1.x}). Join translation rewrites qualifiers to the {@code $left} /
 * {@code $right} markers of the target language.
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final String qualifier;

    /**
     * Creates a column reference with a qualifier.
     *
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     */
    public ColumnReference(String columnName, String qualifier) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        if (columnName.isEmpty()) {
            throw new IllegalArgumentException("columnName must not be empty");
        }
        this.qualifier = qualifier;
    }

    /**
     * Creates a simple column reference without a qualifier.
     *
     * @param columnName the column name
     */
    public ColumnReference(String columnName) {
        this(columnName, null);
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the qualifier (table or alias).
     *
     * @return the qualifier, or null if not qualified
     */
    public String qualifier() {
        return qualifier;
    }

    public boolean isQualified() {
        return qualifier != null;
    }

    /**
     * Returns a copy of this reference with a different qualifier.
     *
     * @param newQualifier the new qualifier (null drops it)
     * @return the re-qualified reference
     */
    public ColumnReference withQualifier(String newQualifier) {
        return new ColumnReference(columnName, newQualifier);
    }

    @Override
    public String toSQL() {
        if (qualifier != null) {
            return qualifier + "." + columnName;
        }
        return columnName;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, qualifier);
    }
}
