package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression wrapping syntax that the translator does not model.
 *
 * <p>The parser accepts CASE, CAST and EXISTS so that queries using them still parse;
 * they are carried as their original SQL text and rendered as an
 * {@code EXPRESSION ... not resolved} placeholder with a warning.
 */
public final class UnresolvedExpression implements Expression {

    private final String sqlText;
    private final String construct;

    /**
     * Creates an unresolved expression.
     *
     * @param sqlText the original SQL text of the expression
     * @param construct the construct name (for example "CASE")
     */
    public UnresolvedExpression(String sqlText, String construct) {
        this.sqlText = Objects.requireNonNull(sqlText, "sqlText must not be null");
        this.construct = Objects.requireNonNull(construct, "construct must not be null");
    }

    public String sqlText() {
        return sqlText;
    }

    public String construct() {
        return construct;
    }

    @Override
    public String toSQL() {
        return sqlText;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnresolvedExpression)) return false;
        UnresolvedExpression that = (UnresolvedExpression) obj;
        return sqlText.equals(that.sqlText) && construct.equals(that.construct);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sqlText, construct);
    }
}
