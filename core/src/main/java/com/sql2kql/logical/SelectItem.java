package com.sql2kql.logical;

import com.sql2kql.expression.Expression;
import java.util.Objects;

/**
 * One entry of a SELECT list: an expression with an optional alias.
 */
public final class SelectItem {

    private final Expression expression;
    private final String alias;

    /**
     * Creates a select item.
     *
     * @param expression the selected expression
     * @param alias the alias (may be null)
     */
    public SelectItem(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = alias;
    }

    public SelectItem(Expression expression) {
        this(expression, null);
    }

    public Expression expression() {
        return expression;
    }

    /**
     * Returns the alias.
     *
     * @return the alias, or null if none was given
     */
    public String alias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    public String toSQL() {
        return alias == null ? expression.toSQL() : expression.toSQL() + " AS " + alias;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SelectItem)) return false;
        SelectItem that = (SelectItem) obj;
        return expression.equals(that.expression) && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
