package com.sql2kql.expression;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 3.14</li>
 *   <li>String literals: 'hello'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Null literal: null</li>
 * </ul>
 *
 * <p>String values are held unquoted; quoting for the target language is the job of
 * {@link com.sql2kql.generator.KQLQuoting}.
 */
public final class Literal implements Expression {

    /**
     * Literal kinds.
     */
    public enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        NULL
    }

    private final Object value;
    private final Kind kind;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (null only for {@link Kind#NULL})
     * @param kind the literal kind
     */
    public Literal(Object value, Kind kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind == Kind.NULL) {
            if (value != null) {
                throw new IllegalArgumentException("NULL literal must not carry a value");
            }
        } else {
            Objects.requireNonNull(value, "value must not be null for " + kind + " literal");
        }
        this.value = value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Returns the string value of a STRING literal.
     *
     * @return the unquoted string value
     * @throws IllegalStateException if this is not a string literal
     */
    public String stringValue() {
        if (kind != Kind.STRING) {
            throw new IllegalStateException("Not a string literal: " + toSQL());
        }
        return (String) value;
    }

    @Override
    public String toSQL() {
        switch (kind) {
            case NULL:
                return "NULL";
            case STRING:
                return "'" + value.toString().replace("'", "''") + "'";
            case BOOLEAN:
                return value.toString().toUpperCase();
            default:
                return value instanceof BigDecimal
                    ? ((BigDecimal) value).toPlainString()
                    : value.toString();
        }
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, kind);
    }

    // ==================== Factory Methods ====================

    public static Literal of(long value) {
        return new Literal(BigDecimal.valueOf(value), Kind.NUMBER);
    }

    public static Literal of(BigDecimal value) {
        return new Literal(value, Kind.NUMBER);
    }

    public static Literal of(String value) {
        return new Literal(value, Kind.STRING);
    }

    public static Literal of(boolean value) {
        return new Literal(value, Kind.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, Kind.NULL);
    }
}
