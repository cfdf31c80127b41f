package com.sql2kql.expression;

import com.sql2kql.functions.FunctionRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Function calls invoke built-in functions with zero or more arguments.
 *
 * <p>Examples:
 * <pre>
 *   upper(name)                -- string function
 *   regexp_extract(cmd, 'x')   -- regex function, arguments reordered on translation
 *   count(*)                   -- aggregate function
 *   count(DISTINCT host)       -- aggregate with DISTINCT quantifier
 * </pre>
 *
 * <p>The function name is mapped to the target language using {@link FunctionRegistry}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final boolean distinct;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name as written in the source query
     * @param arguments the function arguments
     * @param distinct whether DISTINCT is applied to arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments, boolean distinct) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.distinct = distinct;
    }

    /**
     * Creates a function call expression (non-distinct).
     *
     * @param functionName the function name
     * @param arguments the function arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        this(functionName, arguments, false);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int argumentCount() {
        return arguments.size();
    }

    /**
     * Returns whether DISTINCT is applied to arguments.
     *
     * @return true if DISTINCT is applied
     */
    public boolean distinct() {
        return distinct;
    }

    @Override
    public String toSQL() {
        String argList = arguments.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", "));
        return functionName + "(" + (distinct ? "DISTINCT " : "") + argList + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return distinct == that.distinct &&
               functionName.equalsIgnoreCase(that.functionName) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName.toLowerCase(), arguments, distinct);
    }

    // ==================== Factory Methods ====================

    public static FunctionCall of(String functionName, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments));
    }
}
