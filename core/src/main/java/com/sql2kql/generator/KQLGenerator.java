package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.ExpressionUtils;
import com.sql2kql.expression.StarExpression;
import com.sql2kql.logical.FromClause;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.logical.Relation;
import com.sql2kql.logical.SelectClause;
import com.sql2kql.logical.SelectItem;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SortOrder;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.TableRelation;
import com.sql2kql.logical.UnionQuery;
import com.sql2kql.runtime.TranslationOptions;
import com.sql2kql.runtime.TranslationResult;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KQL generator that converts parsed SQL queries to KQL pipelines.
 *
 * <p>A SELECT block becomes stages in a fixed order:
 * <ol>
 *   <li>source (table name, or the stages of a FROM subquery) and one {@code join} per join</li>
 *   <li>{@code where}</li>
 *   <li>{@code summarize} for GROUP BY or aggregate-only select lists; otherwise
 *       {@code extend} for computed items and {@code project}</li>
 *   <li>{@code order by}</li>
 *   <li>{@code distinct}</li>
 *   <li>{@code limit}</li>
 * </ol>
 * A UNION ALL is its left branch followed by {@code union (<right branch>)}; a UNION adds
 * {@code distinct *}. The union's own ORDER BY and LIMIT follow.
 *
 * <p>Example usage:
 * <pre>
 *   QueryNode query = parser.parse("SELECT a FROM t WHERE a = 'x'");
 *   KQLGenerator generator = new KQLGenerator();
 *   String kql = generator.generate(query).kql();
 *   // t
 *   // | where a == 'x'
 *   // | project a
 * </pre>
 *
 * <p>The generator holds no per-call state and may be shared between threads.
 *
 * @see QueryNode
 */
public class KQLGenerator {

    private static final Logger logger = LoggerFactory.getLogger(KQLGenerator.class);

    /**
     * Clauses that one handler can absorb so that later handlers skip them.
     */
    private enum Clause {
        SELECT,
        DISTINCT
    }

    private final TranslationOptions options;

    /**
     * Creates a generator with default options.
     */
    public KQLGenerator() {
        this(TranslationOptions.defaults());
    }

    public KQLGenerator(TranslationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public TranslationOptions options() {
        return options;
    }

    /**
     * Generates KQL for a query.
     *
     * <p>This is the main entry point for KQL generation. Each call gets its own
     * {@link TranslationContext}, so calls are independent.
     *
     * @param query the query to translate
     * @return the translation result with the KQL text and any warnings
     * @throws TranslationException if the query cannot be translated
     */
    public TranslationResult generate(QueryNode query) {
        if (query == null) {
            throw new TranslationException(DiagnosticKind.UNRECOGNIZED_QUERY,
                "No query to translate", null);
        }
        TranslationContext context = new TranslationContext(options);
        try {
            Pipeline pipeline = translateQuery(query, context);
            String markers = context.drainMarkers();
            if (!markers.isEmpty()) {
                // Markers raised in a FROM subquery with no top-level stage after it
                pipeline.appendToLastStage(" " + markers);
            }
            logger.debug("Generated KQL:\n{}", pipeline.render());
            return new TranslationResult(pipeline, context.diagnostics());

        } catch (TranslationException | UnsupportedOperationException | IllegalArgumentException e) {
            // Already carry a precise message
            throw e;

        } catch (RuntimeException e) {
            throw new TranslationException(DiagnosticKind.INTERNAL_ERROR,
                "Unexpected error during KQL generation: " + e.getMessage(), query.toSQL(), e);
        }
    }

    /**
     * Translates a query at any nesting level: top level, FROM subquery, join source,
     * union branch or IN subquery.
     *
     * @param query the query
     * @param context the translation context
     * @return the query's pipeline
     */
    Pipeline translateQuery(QueryNode query, TranslationContext context) {
        context.enter(query.toSQL());
        try {
            if (query instanceof SelectQuery select) {
                return translateSelect(select, context);
            } else if (query instanceof UnionQuery union) {
                return translateUnion(union, context);
            }
            throw new TranslationException(DiagnosticKind.UNRECOGNIZED_QUERY,
                "Unrecognized query node: " + query.getClass().getSimpleName(), query.toSQL());
        } finally {
            context.exit();
        }
    }

    /**
     * Translates a FROM source or join right side.
     *
     * @param relation the relation
     * @param context the translation context
     * @return the relation's pipeline
     */
    Pipeline translateRelation(Relation relation, TranslationContext context) {
        if (relation instanceof TableRelation table) {
            return new Pipeline().add(KQLQuoting.quoteQualifiedName(table.name()));
        }
        if (relation instanceof SubqueryRelation subquery) {
            return translateQuery(subquery.query(), context);
        }
        throw new TranslationException(DiagnosticKind.UNRECOGNIZED_QUERY,
            "Unrecognized relation: " + relation.getClass().getSimpleName(), relation.toSQL());
    }

    // ==================== SELECT ====================

    private Pipeline translateSelect(SelectQuery query, TranslationContext context) {
        ExpressionTranslator expressions = new ExpressionTranslator(this, context);
        UnaryOperator<Expression> qualifiers = qualifierStripper(query.from());
        EnumSet<Clause> consumed = EnumSet.noneOf(Clause.class);
        Pipeline pipeline = new Pipeline();

        // FROM and JOIN
        pipeline.addAll(translateRelation(query.from().source(), context));
        for (JoinClause join : query.from().joins()) {
            addStage(pipeline, JoinTranslator.translate(join, this, expressions, context), context);
        }

        // WHERE
        if (query.where() != null) {
            addStage(pipeline, "where " + expressions.translate(qualifiers.apply(query.where())), context);
        }

        // GROUP BY, or aggregates over the whole input
        if (query.hasGroupBy() || containsAggregate(query.select())) {
            addStage(pipeline, summarize(query, expressions, qualifiers), context);
            consumed.add(Clause.SELECT);
            consumed.add(Clause.DISTINCT);
        }

        // SELECT
        if (!consumed.contains(Clause.SELECT)) {
            translateSelectList(query.select(), expressions, qualifiers, pipeline, context);
        }

        // ORDER BY
        if (!query.orderBy().isEmpty()) {
            addStage(pipeline, orderBy(query.orderBy(), expressions, qualifiers), context);
        }

        // DISTINCT
        if (query.select().isDistinct() && !consumed.contains(Clause.DISTINCT)) {
            addStage(pipeline, "distinct " + distinctList(query.select()), context);
        }

        // LIMIT
        if (query.limit().isPresent()) {
            addStage(pipeline, "limit " + query.limit().getAsLong(), context);
        }
        return pipeline;
    }

    /**
     * Builds the single {@code summarize} stage. Select items equal to a group key are
     * not repeated as aggregates; an alias on such an item renames the key instead.
     * Bare non-key columns are wrapped in {@code take_any()}.
     */
    private String summarize(SelectQuery query, ExpressionTranslator expressions,
                             UnaryOperator<Expression> qualifiers) {
        List<Expression> keys = new ArrayList<>();
        List<String> byItems = new ArrayList<>();
        for (Expression key : query.groupBy()) {
            Expression stripped = qualifiers.apply(key);
            keys.add(stripped);
            byItems.add(expressions.translate(stripped));
        }

        List<String> aggregates = new ArrayList<>();
        for (SelectItem item : query.select().items()) {
            Expression expr = qualifiers.apply(item.expression());
            if (expr instanceof StarExpression) {
                continue;
            }
            int keyIndex = keys.indexOf(expr);
            if (keyIndex >= 0) {
                if (item.hasAlias()) {
                    byItems.set(keyIndex, KQLQuoting.quoteIdentifier(item.alias()) + " = " + byItems.get(keyIndex));
                }
                continue;
            }
            String prefix = item.hasAlias() ? KQLQuoting.quoteIdentifier(item.alias()) + " = " : "";
            if (expr instanceof ColumnReference) {
                aggregates.add(prefix + "take_any(" + expressions.translate(expr) + ")");
            } else {
                aggregates.add(prefix + expressions.translate(expr));
            }
        }

        StringBuilder stage = new StringBuilder("summarize");
        if (!aggregates.isEmpty()) {
            stage.append(' ').append(String.join(", ", aggregates));
        }
        if (!byItems.isEmpty()) {
            stage.append(" by ").append(String.join(", ", byItems));
        }
        return stage.toString();
    }

    /**
     * Splits the select list into plain columns, which go straight to {@code project},
     * and computed items, which are added with {@code extend} and projected by name.
     */
    private void translateSelectList(SelectClause select, ExpressionTranslator expressions,
                                     UnaryOperator<Expression> qualifiers, Pipeline pipeline,
                                     TranslationContext context) {
        List<SelectItem> items = select.items();
        boolean hasStar = items.stream().anyMatch(item -> item.expression() instanceof StarExpression);

        // Names that already exist in the output, for de-duplicating generated aliases
        Set<String> usedNames = new HashSet<>();
        for (SelectItem item : items) {
            if (item.hasAlias()) {
                usedNames.add(item.alias());
            } else if (item.expression() instanceof ColumnReference col) {
                usedNames.add(col.columnName());
            }
        }

        List<String> extendItems = new ArrayList<>();
        List<String> projectItems = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            SelectItem item = items.get(i);
            Expression expr = qualifiers.apply(item.expression());
            if (expr instanceof StarExpression) {
                continue;
            }
            String value = expressions.translate(expr);
            if (ExpressionUtils.isTrivial(expr)) {
                projectItems.add(item.hasAlias()
                    ? KQLQuoting.quoteIdentifier(item.alias()) + " = " + value
                    : value);
                continue;
            }
            String name;
            if (item.hasAlias()) {
                name = item.alias();
            } else {
                name = uniqueName(options.aliasGenerator().aliasFor(expr, i + 1), usedNames);
                usedNames.add(name);
            }
            String quotedName = KQLQuoting.quoteIdentifier(name);
            extendItems.add(quotedName + " = " + value);
            projectItems.add(quotedName);
        }

        if (!extendItems.isEmpty()) {
            addStage(pipeline, "extend " + String.join(", ", extendItems), context);
        }
        if (!projectItems.isEmpty() && !hasStar) {
            addStage(pipeline, "project " + String.join(", ", projectItems), context);
        }
    }

    private static void addStage(Pipeline pipeline, String stage, TranslationContext context) {
        pipeline.add(context.attachMarkers(stage));
    }

    private static String uniqueName(String candidate, Set<String> usedNames) {
        if (!usedNames.contains(candidate)) {
            return candidate;
        }
        int suffix = 1;
        while (usedNames.contains(candidate + "_" + suffix)) {
            suffix++;
        }
        return candidate + "_" + suffix;
    }

    private static boolean containsAggregate(SelectClause select) {
        return select.items().stream()
            .anyMatch(item -> ExpressionUtils.containsAggregateFunction(item.expression()));
    }

    // ==================== ORDER BY / DISTINCT ====================

    private String orderBy(List<SortOrder> orders, ExpressionTranslator expressions,
                           UnaryOperator<Expression> qualifiers) {
        List<String> items = new ArrayList<>();
        for (SortOrder order : orders) {
            StringBuilder sb = new StringBuilder(expressions.translate(qualifiers.apply(order.expression())));
            // KQL sorts descending unless told otherwise
            sb.append(order.direction() == SortOrder.SortDirection.ASCENDING ? " asc" : " desc");
            if (order.nullOrdering() == SortOrder.NullOrdering.NULLS_FIRST) {
                sb.append(" nulls first");
            } else if (order.nullOrdering() == SortOrder.NullOrdering.NULLS_LAST) {
                sb.append(" nulls last");
            }
            items.add(sb.toString());
        }
        return "order by " + String.join(", ", items);
    }

    /**
     * Column list for {@code distinct}. Aliased items contribute their alias and bare
     * columns their name; a star or any other un-aliased expression reverts to
     * {@code distinct *}.
     */
    private static String distinctList(SelectClause select) {
        List<String> names = new ArrayList<>();
        for (SelectItem item : select.items()) {
            if (item.hasAlias()) {
                names.add(KQLQuoting.quoteIdentifier(item.alias()));
            } else if (item.expression() instanceof ColumnReference col) {
                names.add(KQLQuoting.quoteIdentifier(col.columnName()));
            } else {
                return "*";
            }
        }
        return String.join(", ", names);
    }

    // ==================== UNION ====================

    private Pipeline translateUnion(UnionQuery union, TranslationContext context) {
        Pipeline pipeline = new Pipeline();
        pipeline.addAll(translateQuery(union.left(), context));
        Pipeline right = translateQuery(union.right(), context);
        addStage(pipeline, "union (" + right.renderNested("  ") + ")", context);
        if (!union.isAll()) {
            addStage(pipeline, "distinct *", context);
        }

        if (!union.orderBy().isEmpty()) {
            // Set results are addressed by output column name only
            ExpressionTranslator expressions = new ExpressionTranslator(this, context);
            addStage(pipeline, orderBy(union.orderBy(), expressions, UnaryOperator.identity()), context);
        }
        if (union.limit().isPresent()) {
            addStage(pipeline, "limit " + union.limit().getAsLong(), context);
        }
        return pipeline;
    }

    // ==================== Qualifiers ====================

    /**
     * Without joins every qualifier must name the single source, and KQL has no use for
     * it: qualifiers matching the source table or alias are dropped. With joins the
     * expressions are left alone.
     */
    private static UnaryOperator<Expression> qualifierStripper(FromClause from) {
        if (from.hasJoins()) {
            return UnaryOperator.identity();
        }
        Relation source = from.source();
        Set<String> sourceNames = new HashSet<>();
        if (source.alias() != null) {
            sourceNames.add(source.alias().toLowerCase());
        }
        if (source instanceof TableRelation table) {
            sourceNames.add(table.name().toLowerCase());
            String name = table.name();
            sourceNames.add(name.substring(name.lastIndexOf('.') + 1).toLowerCase());
        }
        return expr -> ExpressionUtils.rewriteQualifiers(expr,
            qualifier -> sourceNames.contains(qualifier.toLowerCase()) ? null : qualifier);
    }
}
