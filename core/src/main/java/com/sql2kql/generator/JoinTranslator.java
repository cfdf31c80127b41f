package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.ExpressionUtils;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.Relation;
import com.sql2kql.logical.TableRelation;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one JOIN clause into a KQL {@code join} stage.
 *
 * <p>KQL joins see exactly two sides, so qualified column references in the ON
 * condition are rewritten: references to the right-hand source (by alias, else by table
 * name, else by the leading token of a subquery's translated text, compared
 * case-insensitively) become {@code $right.col}; every other qualifier becomes
 * {@code $left.col}.
 *
 * <p>Two-table model: when the condition names more than one left-side qualifier, or
 * never names the right side, the rewrite cannot be trusted and a
 * {@link DiagnosticKind#JOIN_PREFIX_AMBIGUOUS} warning is recorded. Cross joins have no
 * KQL kind and render an explicit unsupported marker.
 *
 * <p>Output: {@code join kind=<kind> (<right pipeline>) on <condition>}
 */
public final class JoinTranslator {

    private static final Logger logger = LoggerFactory.getLogger(JoinTranslator.class);

    /** Qualifier for columns of the left side of a join */
    public static final String LEFT_MARKER = "$left";

    /** Qualifier for columns of the right side of a join */
    public static final String RIGHT_MARKER = "$right";

    /** Kind written for cross joins, which KQL cannot express */
    public static final String UNSUPPORTED_CROSS_JOIN = "UNSUPPORTED_CROSS_JOIN";

    /** Inline marker for a cross join stage */
    public static final String CROSS_JOIN_MARKER = "// WARNING cross join is not supported";

    private JoinTranslator() {}

    /**
     * Translates a join clause.
     *
     * @param join the join clause
     * @param generator the generator, for the right-hand source
     * @param expressions the expression translator of the enclosing query
     * @param context the translation context
     * @return the join stage text (without the leading pipe)
     */
    public static String translate(JoinClause join, KQLGenerator generator,
                                   ExpressionTranslator expressions, TranslationContext context) {
        JoinKeywords.JoinKind kind = JoinKeywords.resolve(join.keyword());
        Pipeline right = generator.translateRelation(join.right(), context);
        String rightText = right.renderNested("  ");

        if (!kind.isSupported()) {
            context.warn(DiagnosticKind.UNSUPPORTED_CROSS_JOIN,
                "CROSS JOIN has no KQL equivalent", join.toSQL());
            context.markInline(CROSS_JOIN_MARKER);
            return "join kind=" + UNSUPPORTED_CROSS_JOIN + " (" + rightText + ")";
        }

        Set<String> rightNames = rightSideNames(join.right(), right);
        logger.debug("Translating {} join, right side {}", kind, rightNames);

        StringBuilder stage = new StringBuilder();
        stage.append("join kind=").append(kind.kqlName()).append(" (").append(rightText).append(")");

        if (!join.usingColumns().isEmpty()) {
            stage.append(" on ").append(join.usingColumns().stream()
                .map(KQLQuoting::quoteIdentifier)
                .collect(Collectors.joining(", ")));
        } else if (join.condition() != null) {
            Expression rewritten = rewriteTableReferences(join, rightNames, context);
            stage.append(" on ").append(expressions.translate(rewritten));
        }
        return stage.toString();
    }

    /**
     * Names the right side can be referred to by, lower-cased. An alias is the only name.
     * Without one, a table answers to its SQL name and to the last part of a dotted name;
     * a subquery answers to the leading token of its translated text.
     */
    static Set<String> rightSideNames(Relation relation, Pipeline translated) {
        Set<String> names = new LinkedHashSet<>();
        if (relation.alias() != null) {
            names.add(relation.alias().toLowerCase());
        } else if (relation instanceof TableRelation table) {
            String name = table.name();
            names.add(name.toLowerCase());
            names.add(name.substring(name.lastIndexOf('.') + 1).toLowerCase());
        } else {
            names.add(translated.leadingToken().toLowerCase());
        }
        return names;
    }

    /**
     * Rewrites the qualifiers of a join condition to {@code $left} / {@code $right}.
     *
     * @param join the join whose condition is rewritten
     * @param rightNames the lower-cased names the right side is referred to by
     * @param context the translation context, for the two-table warning
     * @return the rewritten condition
     */
    static Expression rewriteTableReferences(JoinClause join, Set<String> rightNames, TranslationContext context) {
        Expression condition = join.condition();
        Set<String> leftQualifiers = new LinkedHashSet<>();
        boolean rightReferenced = false;
        for (String qualifier : ExpressionUtils.collectQualifiers(condition)) {
            if (rightNames.contains(qualifier.toLowerCase())) {
                rightReferenced = true;
            } else {
                leftQualifiers.add(qualifier.toLowerCase());
            }
        }
        if (leftQualifiers.size() > 1 || !rightReferenced) {
            context.warn(DiagnosticKind.JOIN_PREFIX_AMBIGUOUS,
                String.format("Join condition does not fit the two-table model (right side %s, left qualifiers %s)",
                    rightNames, leftQualifiers),
                join.toSQL());
        }
        return ExpressionUtils.rewriteQualifiers(condition,
            qualifier -> rightNames.contains(qualifier.toLowerCase()) ? RIGHT_MARKER : LEFT_MARKER);
    }

    /**
     * Checks whether a qualifier is one of the join side markers.
     *
     * @param qualifier the qualifier
     * @return true for {@code $left} and {@code $right}
     */
    public static boolean isSideMarker(String qualifier) {
        return LEFT_MARKER.equals(qualifier) || RIGHT_MARKER.equals(qualifier);
    }
}
