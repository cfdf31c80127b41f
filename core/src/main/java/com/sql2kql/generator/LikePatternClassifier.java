package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.Literal;
import java.util.regex.Pattern;

/**
 * Chooses the KQL string operator for a SQL LIKE pattern.
 *
 * <p>Classification by the position of the wildcards {@code %} and {@code _}, first
 * match wins:
 * <ul>
 *   <li>one wildcard, at the end only: {@code startswith}</li>
 *   <li>one wildcard, at the start only: {@code endswith}</li>
 *   <li>one wildcard at each end: {@code contains}</li>
 *   <li>anything else: {@code matches regex}, with {@code %} as {@code .*} and
 *       {@code _} as {@code .}</li>
 * </ul>
 * The first three strip the wildcards from the pattern.
 */
public final class LikePatternClassifier {

    private static final Pattern STARTS_WITH = Pattern.compile("^[^%_]+[%_]$");
    private static final Pattern ENDS_WITH = Pattern.compile("^[%_][^%_]+$");
    private static final Pattern CONTAINS = Pattern.compile("^[%_][^%_]+[%_]$");

    private static final String REGEX_METACHARACTERS = "\\.^$|?*+()[]{}";

    /**
     * The outcome of classifying one pattern.
     *
     * @param operator the KQL operator
     * @param pattern the pattern text to pass to the operator (unquoted)
     */
    public record LikeMatch(String operator, String pattern) {

        public boolean isRegex() {
            return operator.equals("matches regex");
        }
    }

    private LikePatternClassifier() {}

    /**
     * Classifies a LIKE pattern.
     *
     * @param pattern the raw SQL pattern
     * @return the operator and rewritten pattern
     */
    public static LikeMatch classify(String pattern) {
        if (STARTS_WITH.matcher(pattern).matches()) {
            return new LikeMatch("startswith", stripWildcards(pattern));
        }
        if (ENDS_WITH.matcher(pattern).matches()) {
            return new LikeMatch("endswith", stripWildcards(pattern));
        }
        if (CONTAINS.matcher(pattern).matches()) {
            return new LikeMatch("contains", stripWildcards(pattern));
        }
        return new LikeMatch("matches regex", toRegex(pattern));
    }

    /**
     * Renders a LIKE predicate.
     *
     * @param left the already-translated left operand
     * @param pattern the pattern expression, which must be a string literal
     * @param negated true for NOT LIKE
     * @param construct the SQL text of the whole predicate, for error messages
     * @return the KQL predicate
     * @throws TranslationException if the pattern is not a string literal
     */
    public static String translate(String left, Expression pattern, boolean negated, String construct) {
        if (!(pattern instanceof Literal literal) || !literal.isString()) {
            throw new TranslationException(
                DiagnosticKind.NON_LITERAL_LIKE_PATTERN,
                "Right side operand " + pattern.toSQL() + " isn't usable in a LIKE expression",
                construct);
        }
        LikeMatch match = classify(literal.stringValue());
        String quoted = KQLQuoting.escapeAndQuote(match.pattern());
        if (!negated) {
            return left + " " + match.operator() + " " + quoted;
        }
        if (match.isRegex()) {
            return "not (" + left + " matches regex " + quoted + ")";
        }
        return left + " !" + match.operator() + " " + quoted;
    }

    private static String stripWildcards(String pattern) {
        return pattern.replace("%", "").replace("_", "");
    }

    private static String toRegex(String pattern) {
        StringBuilder sb = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%') {
                sb.append(".*");
            } else if (c == '_') {
                sb.append('.');
            } else if (REGEX_METACHARACTERS.indexOf(c) >= 0) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
