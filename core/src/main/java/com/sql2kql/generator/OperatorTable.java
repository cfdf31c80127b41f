package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Collections;

/**
 * Mapping from source operator tokens to KQL operators.
 *
 * <p>The table is total over the operators the translator supports; any other token
 * is a hard error. {@code similar to} is the target of the RLIKE / REGEXP keyword
 * remapping done before parsing, and maps back to a regex match.
 */
public final class OperatorTable {

    private static final Map<String, String> OPERATORS;

    static {
        Map<String, String> ops = new LinkedHashMap<>();
        // Comparison
        ops.put("=", "==");
        ops.put("==", "==");
        ops.put("<>", "!=");
        ops.put("!=", "!=");
        ops.put("<", "<");
        ops.put("<=", "<=");
        ops.put(">", ">");
        ops.put(">=", ">=");

        // Arithmetic
        ops.put("+", "+");
        ops.put("-", "-");
        ops.put("*", "*");
        ops.put("/", "/");
        ops.put("%", "%");

        // Regex match
        ops.put("similar to", "matches regex");
        OPERATORS = Collections.unmodifiableMap(ops);
    }

    private OperatorTable() {}

    /**
     * Translates a source operator token.
     *
     * @param operator the source token (case and surrounding whitespace ignored)
     * @return the KQL operator
     * @throws TranslationException if the operator is not in the table
     */
    public static String translate(String operator) {
        String kql = operator == null ? null : OPERATORS.get(normalize(operator));
        if (kql == null) {
            throw new TranslationException(
                DiagnosticKind.UNKNOWN_OPERATOR,
                "Operator '" + operator + "' has no KQL equivalent",
                operator);
        }
        return kql;
    }

    public static boolean isSupported(String operator) {
        return operator != null && OPERATORS.containsKey(normalize(operator));
    }

    /**
     * Returns the whole table.
     *
     * @return an unmodifiable map from source token to KQL operator
     */
    public static Map<String, String> operators() {
        return OPERATORS;
    }

    private static String normalize(String operator) {
        return operator.trim().replaceAll("\\s+", " ").toLowerCase();
    }
}
