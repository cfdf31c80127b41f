package com.sql2kql.functions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of SQL functions mapped to KQL functions.
 *
 * <p>Lookups are case-insensitive. Functions with no entry are not an error: the
 * {@link FunctionTranslator} passes them through with a warning marker.
 *
 * <p>Function categories:
 * <ul>
 *   <li>String functions: lower, upper, trim, substring, concat, replace, etc.</li>
 *   <li>Math functions: abs, ceil, floor, round, sqrt, pow, etc.</li>
 *   <li>Date/time functions: to_date, to_timestamp, now</li>
 *   <li>Aggregate functions: count, sum, avg, min, max, stddev, etc.</li>
 *   <li>Conditional and null-handling functions: if, ifnull, coalesce, isnull</li>
 * </ul>
 *
 * <p>The table is built once, in the static initializer, and is read-only afterwards.
 *
 * @see FunctionMapping
 * @see FunctionTranslator
 */
public final class FunctionRegistry {

    private static final Map<String, FunctionMapping> FUNCTIONS;

    static {
        Map<String, FunctionMapping> mappings = new HashMap<>();
        initializeStringFunctions(mappings);
        initializeMathFunctions(mappings);
        initializeDateFunctions(mappings);
        initializeAggregateFunctions(mappings);
        initializeConditionalFunctions(mappings);
        initializeConversionFunctions(mappings);
        FUNCTIONS = Collections.unmodifiableMap(mappings);
    }

    private FunctionRegistry() {}

    /**
     * Looks up the mapping for a source function.
     *
     * @param functionName the source function name (any case)
     * @return the mapping, or empty if the function is not mapped
     */
    public static Optional<FunctionMapping> lookup(String functionName) {
        if (functionName == null || functionName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(FUNCTIONS.get(normalize(functionName)));
    }

    /**
     * Checks if a function is mapped.
     *
     * @param functionName the function name
     * @return true if mapped, false otherwise
     */
    public static boolean isSupported(String functionName) {
        return lookup(functionName).isPresent();
    }

    /**
     * Maps a source function name to its KQL name.
     *
     * <p>Returns the target name if a direct or reorder mapping exists, otherwise the
     * original name unchanged. Override mappings have no single target name.
     *
     * @param functionName the source function name
     * @return the KQL function name (or original if no mapping)
     */
    public static String mapFunctionName(String functionName) {
        if (functionName == null) {
            return null;
        }
        return lookup(functionName)
            .map(FunctionMapping::target)
            .orElse(functionName);
    }

    public static int registeredFunctionCount() {
        return FUNCTIONS.size();
    }

    /**
     * Returns the names of all mapped functions.
     *
     * @return an unmodifiable set of lower-case names
     */
    public static Set<String> registeredFunctionNames() {
        return FUNCTIONS.keySet();
    }

    private static String normalize(String functionName) {
        return functionName.trim().toLowerCase();
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions(Map<String, FunctionMapping> m) {
        // Case conversion
        m.put("lower", FunctionMapping.direct("tolower"));
        m.put("lcase", FunctionMapping.direct("tolower"));
        m.put("upper", FunctionMapping.direct("toupper"));
        m.put("ucase", FunctionMapping.direct("toupper"));

        // Trimming: KQL trims by regex
        m.put("trim", FunctionMapping.override("trim(@'\\s+', {p0})"));
        m.put("ltrim", FunctionMapping.override("trim_start(@'\\s+', {p0})"));
        m.put("rtrim", FunctionMapping.override("trim_end(@'\\s+', {p0})"));

        // Substrings: SQL positions are 1-based, KQL positions 0-based
        m.put("substring", FunctionMapping.reorder("substring", "{p0}, {p1} - 1, {p2}")
            .withArityTemplate(2, "{p0}, {p1} - 1"));
        m.put("substr", FunctionMapping.reorder("substring", "{p0}, {p1} - 1, {p2}")
            .withArityTemplate(2, "{p0}, {p1} - 1"));
        m.put("left", FunctionMapping.reorder("substring", "{p0}, 0, {p1}"));
        m.put("right", FunctionMapping.override("substring({p0}, strlen({p0}) - {p1})"));

        m.put("length", FunctionMapping.direct("strlen"));
        m.put("concat", FunctionMapping.direct("strcat"));
        m.put("replace", FunctionMapping.direct("replace_string"));
        m.put("reverse", FunctionMapping.direct("reverse"));
        m.put("split", FunctionMapping.direct("split"));
        m.put("translate", FunctionMapping.reorder("translate", "{p1}, {p2}, {p0}"));

        // Position and search: SQL returns 1-based position or 0, KQL 0-based or -1
        m.put("instr", FunctionMapping.override("indexof({p0}, {p1}) + 1"));
        m.put("locate", FunctionMapping.override("indexof({p1}, {p0}) + 1"));
        m.put("position", FunctionMapping.override("indexof({p1}, {p0}) + 1"));

        // Regular expressions: extract(regex, [group,] source)
        m.put("regexp_extract", FunctionMapping.reorder("extract", "{p1}, {p0}")
            .withArityTemplate(3, "{p1}, {p2}, {p0}"));

        // Encoding
        m.put("base64", FunctionMapping.direct("base64_encode_tostring"));
        m.put("unbase64", FunctionMapping.direct("base64_decode_tostring"));
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions(Map<String, FunctionMapping> m) {
        m.put("abs", FunctionMapping.direct("abs"));
        m.put("round", FunctionMapping.direct("round"));
        m.put("floor", FunctionMapping.direct("floor"));
        m.put("ceil", FunctionMapping.direct("ceiling"));
        m.put("ceiling", FunctionMapping.direct("ceiling"));
        m.put("sqrt", FunctionMapping.direct("sqrt"));
        m.put("pow", FunctionMapping.direct("pow"));
        m.put("power", FunctionMapping.direct("pow"));
        m.put("exp", FunctionMapping.direct("exp"));
        m.put("ln", FunctionMapping.direct("log"));
        m.put("log", FunctionMapping.direct("log"));
        m.put("log10", FunctionMapping.direct("log10"));
    }

    // ==================== Date Functions ====================

    private static void initializeDateFunctions(Map<String, FunctionMapping> m) {
        m.put("to_date", FunctionMapping.direct("todatetime"));
        m.put("to_timestamp", FunctionMapping.direct("todatetime"));
        m.put("todatetime", FunctionMapping.direct("todatetime"));
        m.put("now", FunctionMapping.direct("now"));
        m.put("current_timestamp", FunctionMapping.direct("now"));
    }

    // ==================== Aggregate Functions ====================

    private static void initializeAggregateFunctions(Map<String, FunctionMapping> m) {
        m.put("count", FunctionMapping.direct("count"));
        m.put("sum", FunctionMapping.direct("sum"));
        m.put("avg", FunctionMapping.direct("avg"));
        m.put("mean", FunctionMapping.direct("avg"));
        m.put("min", FunctionMapping.direct("min"));
        m.put("max", FunctionMapping.direct("max"));
        m.put("stddev", FunctionMapping.direct("stdev"));
        m.put("variance", FunctionMapping.direct("variance"));
        m.put("count_if", FunctionMapping.direct("countif"));
        m.put("approx_count_distinct", FunctionMapping.direct("dcount"));
        m.put("collect_list", FunctionMapping.direct("make_list"));
        m.put("collect_set", FunctionMapping.direct("make_set"));
        m.put("any_value", FunctionMapping.direct("take_any"));
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions(Map<String, FunctionMapping> m) {
        m.put("if", FunctionMapping.direct("iif"));
        m.put("iif", FunctionMapping.direct("iif"));
        m.put("ifnull", FunctionMapping.override("iif(isnull({p0}), {p1}, {p0})"));
        m.put("nvl", FunctionMapping.override("iif(isnull({p0}), {p1}, {p0})"));
        m.put("coalesce", FunctionMapping.direct("coalesce"));
        m.put("isnull", FunctionMapping.direct("isnull"));
        m.put("isnotnull", FunctionMapping.direct("isnotnull"));
    }

    // ==================== Conversion Functions ====================

    private static void initializeConversionFunctions(Map<String, FunctionMapping> m) {
        m.put("int", FunctionMapping.direct("toint"));
        m.put("string", FunctionMapping.direct("tostring"));
        m.put("str", FunctionMapping.direct("tostring"));
    }
}
