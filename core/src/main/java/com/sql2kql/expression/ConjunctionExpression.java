package com.sql2kql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a chain of AND or OR operands.
 *
 * <p>Operands of the same connective are flattened on construction, so
 * {@code a AND (b AND c)} is held as a single conjunction with three operands.
 * Operand order is preserved.
 */
public final class ConjunctionExpression implements Expression {

    /**
     * Boolean connectives.
     */
    public enum Connective {
        AND("AND"),
        OR("OR");

        private final String symbol;

        Connective(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Connective connective;
    private final List<Expression> operands;

    /**
     * Creates a conjunction.
     *
     * @param connective AND or OR
     * @param operands at least two operands
     */
    public ConjunctionExpression(Connective connective, List<Expression> operands) {
        this.connective = Objects.requireNonNull(connective, "connective must not be null");
        Objects.requireNonNull(operands, "operands must not be null");
        if (operands.size() < 2) {
            throw new IllegalArgumentException(connective + " requires at least two operands");
        }
        List<Expression> flattened = new ArrayList<>();
        for (Expression operand : operands) {
            Objects.requireNonNull(operand, "operand must not be null");
            if (operand instanceof ConjunctionExpression
                    && ((ConjunctionExpression) operand).connective == connective) {
                flattened.addAll(((ConjunctionExpression) operand).operands);
            } else {
                flattened.add(operand);
            }
        }
        this.operands = Collections.unmodifiableList(flattened);
    }

    public Connective connective() {
        return connective;
    }

    /**
     * Returns the operands in source order.
     *
     * @return an unmodifiable list of operands
     */
    public List<Expression> operands() {
        return operands;
    }

    @Override
    public String toSQL() {
        return operands.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(" " + connective.symbol() + " ", "(", ")"));
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ConjunctionExpression)) return false;
        ConjunctionExpression that = (ConjunctionExpression) obj;
        return connective == that.connective && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connective, operands);
    }

    // ==================== Factory Methods ====================

    public static ConjunctionExpression and(Expression left, Expression right) {
        return new ConjunctionExpression(Connective.AND, List.of(left, right));
    }

    public static ConjunctionExpression or(Expression left, Expression right) {
        return new ConjunctionExpression(Connective.OR, List.of(left, right));
    }
}
