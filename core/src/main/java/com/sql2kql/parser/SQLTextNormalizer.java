package com.sql2kql.parser;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites raw SQL text before it reaches the parser.
 *
 * <p>Three rewrites are applied, in this order:
 * <ol>
 *   <li>unescaped double quotes become single quotes, so {@code "abc"} is a string literal</li>
 *   <li>source table names are replaced by their target names</li>
 *   <li>the {@code RLIKE} and {@code REGEXP} keywords become {@code SIMILAR TO}, which the
 *       operator table maps to {@code matches regex}</li>
 * </ol>
 *
 * <p>Table substitution is a plain substring replacement unless whole-word matching is
 * requested. Plain replacement also rewrites identifiers that merely contain a source
 * name: with {@code {"t": "T2"}} the column {@code status} becomes {@code sT2aT2us}.
 */
public final class SQLTextNormalizer {

    private static final Pattern UNESCAPED_DOUBLE_QUOTE = Pattern.compile("(?<![\\\\])\"");

    private static final Pattern REGEX_MATCH_KEYWORD = Pattern.compile("(?i)(?<=\\s)(RLIKE|REGEXP)(?=\\s)");

    private final boolean normalizeDoubleQuotes;
    private final boolean wholeWordTableSubstitution;

    /**
     * Creates a normalizer.
     *
     * @param normalizeDoubleQuotes whether to turn unescaped double quotes into single quotes
     * @param wholeWordTableSubstitution whether table names are only replaced as whole words
     */
    public SQLTextNormalizer(boolean normalizeDoubleQuotes, boolean wholeWordTableSubstitution) {
        this.normalizeDoubleQuotes = normalizeDoubleQuotes;
        this.wholeWordTableSubstitution = wholeWordTableSubstitution;
    }

    /**
     * Normalizes SQL text.
     *
     * @param sql the raw SQL
     * @param targetTables source table name to target table name (may be null or empty)
     * @return the normalized SQL
     */
    public String normalize(String sql, Map<String, String> targetTables) {
        Objects.requireNonNull(sql, "sql must not be null");
        String result = sql;
        if (normalizeDoubleQuotes) {
            result = singleQuoteStrings(result);
        }
        if (targetTables != null) {
            for (Map.Entry<String, String> entry : targetTables.entrySet()) {
                result = replaceTable(result, entry.getKey(), entry.getValue());
            }
        }
        return remapKeywords(result);
    }

    /**
     * Replaces every double quote not preceded by a backslash with a single quote.
     *
     * @param sql the SQL text
     * @return the rewritten text
     */
    public static String singleQuoteStrings(String sql) {
        return UNESCAPED_DOUBLE_QUOTE.matcher(sql).replaceAll("'");
    }

    /**
     * Rewrites {@code RLIKE} and {@code REGEXP}, when surrounded by whitespace, to
     * {@code SIMILAR TO}.
     *
     * @param sql the SQL text
     * @return the rewritten text
     */
    public static String remapKeywords(String sql) {
        return REGEX_MATCH_KEYWORD.matcher(sql).replaceAll("SIMILAR TO");
    }

    private String replaceTable(String sql, String source, String target) {
        if (source == null || source.isEmpty() || target == null) {
            return sql;
        }
        if (!wholeWordTableSubstitution) {
            return sql.replace(source, target);
        }
        Pattern word = Pattern.compile("\\b" + Pattern.quote(source) + "\\b");
        return word.matcher(sql).replaceAll(Matcher.quoteReplacement(target));
    }
}
