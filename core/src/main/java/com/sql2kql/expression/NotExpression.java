package com.sql2kql.expression;

import java.util.Objects;

/**
 * Expression representing a logical negation: {@code NOT operand}.
 */
public final class NotExpression implements Expression {

    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public String toSQL() {
        return "(NOT " + operand.toSQL() + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NotExpression)) return false;
        return operand.equals(((NotExpression) obj).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand);
    }
}
