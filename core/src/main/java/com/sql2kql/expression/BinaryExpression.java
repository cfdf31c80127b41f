package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a binary operation (two operands with an operator).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: +, -, *, /, %</li>
 *   <li>Comparison: =, ==, !=, &lt;&gt;, &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>Regex match: SIMILAR TO (also reached through RLIKE / REGEXP)</li>
 * </ul>
 *
 * <p>The operator is held as the source token, lower-cased, exactly as the parser saw it.
 * Mapping it to the target language goes through
 * {@link com.sql2kql.generator.OperatorTable}, where an unknown token is a hard error.
 * AND / OR are not binary expressions; see {@link ConjunctionExpression}.
 */
public final class BinaryExpression implements Expression {

    private final Expression left;
    private final String operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the source operator token
     * @param right the right operand
     */
    public BinaryExpression(Expression left, String operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (operator.isBlank()) {
            throw new IllegalArgumentException("operator must not be blank");
        }
        this.operator = operator.trim().toLowerCase();
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    /**
     * Returns the source operator token.
     *
     * @return the lower-cased operator token
     */
    public String operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public String toSQL() {
        return String.format("(%s %s %s)", left.toSQL(), operator.toUpperCase(), right.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               Objects.equals(operator, that.operator) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, "=", right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, "<>", right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, "<", right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, ">", right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, "+", right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, "*", right);
    }
}
