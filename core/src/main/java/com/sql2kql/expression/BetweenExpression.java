package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a BETWEEN predicate.
 *
 * <p>SQL form: {@code value BETWEEN lower AND upper}
 * <p>SQL form (negated): {@code value NOT BETWEEN lower AND upper}
 *
 * <p>Both bounds are inclusive, which matches the target language's
 * {@code between (lower .. upper)} range.
 */
public final class BetweenExpression implements Expression {

    private final Expression value;
    private final Expression lower;
    private final Expression upper;
    private final boolean negated;

    /**
     * Creates a BETWEEN expression.
     *
     * @param value the tested expression
     * @param lower the inclusive lower bound
     * @param upper the inclusive upper bound
     * @param negated true for NOT BETWEEN
     */
    public BetweenExpression(Expression value, Expression lower, Expression upper, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.lower = Objects.requireNonNull(lower, "lower must not be null");
        this.upper = Objects.requireNonNull(upper, "upper must not be null");
        this.negated = negated;
    }

    public BetweenExpression(Expression value, Expression lower, Expression upper) {
        this(value, lower, upper, false);
    }

    public Expression value() {
        return value;
    }

    public Expression lower() {
        return lower;
    }

    public Expression upper() {
        return upper;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public String toSQL() {
        return String.format("(%s %sBETWEEN %s AND %s)",
            value.toSQL(), negated ? "NOT " : "", lower.toSQL(), upper.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BetweenExpression)) return false;
        BetweenExpression that = (BetweenExpression) obj;
        return negated == that.negated &&
               value.equals(that.value) &&
               lower.equals(that.lower) &&
               upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, lower, upper, negated);
    }
}
