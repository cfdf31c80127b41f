package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a SQL LIKE predicate.
 *
 * <p>SQL form: {@code value LIKE pattern} / {@code value NOT LIKE pattern}
 *
 * <p>The pattern is kept as a general expression so that a non-literal pattern
 * survives parsing and is rejected during translation with a precise message.
 */
public final class LikeExpression implements Expression {

    private final Expression value;
    private final Expression pattern;
    private final boolean negated;

    public LikeExpression(Expression value, Expression pattern, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.negated = negated;
    }

    public LikeExpression(Expression value, Expression pattern) {
        this(value, pattern, false);
    }

    public Expression value() {
        return value;
    }

    public Expression pattern() {
        return pattern;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public String toSQL() {
        return String.format("(%s %sLIKE %s)",
            value.toSQL(), negated ? "NOT " : "", pattern.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LikeExpression)) return false;
        LikeExpression that = (LikeExpression) obj;
        return negated == that.negated &&
               value.equals(that.value) &&
               pattern.equals(that.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern, negated);
    }
}
