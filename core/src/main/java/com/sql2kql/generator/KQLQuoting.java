package com.sql2kql.generator;

import com.sql2kql.expression.Literal;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Utilities for quoting KQL string literals and identifiers.
 *
 * <p>Example usage:
 * <pre>
 *   KQLQuoting.quoteLiteral("O'Reilly");   // 'O\'Reilly'
 *   KQLQuoting.quoteLiteral("'done'");     // 'done'   (already quoted, unchanged)
 *   KQLQuoting.quoteIdentifier("Host");    // Host
 *   KQLQuoting.quoteIdentifier("my col");  // ['my col']
 * </pre>
 *
 * @see KQLGenerator
 */
public final class KQLQuoting {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private KQLQuoting() {}

    /**
     * Quotes a string literal with single quotes.
     *
     * <p>A value that already starts and ends with a single quote is returned unchanged, so
     * quoting is idempotent. Otherwise backslashes and single quotes are backslash-escaped.
     *
     * @param value the string value to quote
     * @return the quoted literal
     * @throws IllegalArgumentException if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal value cannot be null");
        }
        if (isQuoted(value)) {
            return value;
        }
        return escapeAndQuote(value);
    }

    /**
     * Escapes backslashes and single quotes and wraps the result in single quotes,
     * whatever the value looks like. Used for the values of parsed literals, which are
     * never pre-quoted.
     *
     * @param value the raw string value
     * @return the quoted literal
     */
    static String escapeAndQuote(String value) {
        String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + escaped + "'";
    }

    /**
     * Checks whether a value is already wrapped in single quotes.
     *
     * @param value the value to check
     * @return true if the value starts and ends with a single quote
     */
    public static boolean isQuoted(String value) {
        return value != null && value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
    }

    /**
     * Renders a literal expression as KQL.
     *
     * <p>Strings are always escaped and quoted, numbers are written in plain notation, booleans as
     * {@code true}/{@code false} and NULL as {@code dynamic(null)}.
     *
     * @param literal the literal to render
     * @return the KQL text
     */
    public static String renderLiteral(Literal literal) {
        switch (literal.kind()) {
            case STRING:
                return escapeAndQuote(literal.stringValue());
            case BOOLEAN:
                return literal.value().toString().toLowerCase();
            case NULL:
                return "dynamic(null)";
            default:
                Object value = literal.value();
                return value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString();
        }
    }

    /**
     * Quotes an identifier (table or column name) if needed.
     *
     * <p>Names made of letters, digits and underscores (not starting with a digit) are
     * returned as-is; anything else is written in bracket notation {@code ['name']}.
     *
     * @param identifier the identifier
     * @return the identifier, quoted if needed
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return "['" + identifier.replace("\\", "\\\\").replace("'", "\\'") + "']";
    }

    /**
     * Quotes each part of a dotted name ({@code database.table}).
     *
     * @param dottedName the name
     * @return the name with every part quoted if needed
     */
    public static String quoteQualifiedName(String dottedName) {
        if (dottedName == null || dottedName.isEmpty()) {
            throw new IllegalArgumentException("Name cannot be null or empty");
        }
        String[] parts = dottedName.split("\\.", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(quoteIdentifier(parts[i]));
        }
        return sb.toString();
    }
}
