package com.sql2kql.validation;

import com.sql2kql.exception.ValidationException;
import com.sql2kql.generator.JoinKeywords;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.logical.Relation;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.UnionQuery;
import java.util.Objects;

/**
 * Validates parsed queries before KQL generation.
 *
 * <p>Validation rules:
 * <ul>
 *   <li><b>SELECT validation:</b> the select list must not be empty</li>
 *   <li><b>JOIN validation:</b> non-CROSS joins must have an ON or USING criterion</li>
 *   <li><b>LIMIT validation:</b> the row count must not be negative</li>
 * </ul>
 * FROM subqueries, join sources and both union branches are validated recursively.
 *
 * <p>Example usage:
 * <pre>
 *   QueryNode query = parser.parse(sql);
 *   QueryValidator.validate(query);  // Throws ValidationException if invalid
 *   String kql = generator.generate(query).kql();
 * </pre>
 *
 * <p>Join keywords that are not recognized at all are left for the generator, which
 * reports them as translation errors.
 *
 * @see ValidationException
 * @see com.sql2kql.generator.KQLGenerator
 */
public class QueryValidator {

    private QueryValidator() {}

    /**
     * Validates a query and everything nested in it.
     *
     * @param query the query to validate
     * @throws ValidationException if validation fails
     * @throws NullPointerException if query is null
     */
    public static void validate(QueryNode query) {
        Objects.requireNonNull(query, "Query cannot be null");
        validateRecursive(query);
    }

    private static void validateRecursive(QueryNode query) {
        validateLimit(query);

        if (query instanceof SelectQuery select) {
            validateSelect(select);
            validateRelation(select.from().source());
            for (JoinClause join : select.from().joins()) {
                validateJoin(join);
                validateRelation(join.right());
            }
        } else if (query instanceof UnionQuery union) {
            validateRecursive(union.left());
            validateRecursive(union.right());
        }
    }

    private static void validateRelation(Relation relation) {
        if (relation instanceof SubqueryRelation subquery) {
            validateRecursive(subquery.query());
        }
    }

    private static void validateSelect(SelectQuery select) {
        if (select.select().items().isEmpty()) {
            throw new ValidationException(
                "SELECT list cannot be empty",
                "select validation",
                select.toSQL(),
                "Select at least one column or use SELECT *");
        }
    }

    /**
     * Validates a JOIN clause.
     *
     * @param join the join to validate
     * @throws ValidationException if a non-CROSS join has no criteria
     */
    private static void validateJoin(JoinClause join) {
        if (!JoinKeywords.isJoinKeyword(join.keyword())) {
            return;
        }
        JoinKeywords.JoinKind kind = JoinKeywords.resolve(join.keyword());
        if (kind != JoinKeywords.JoinKind.CROSS && !join.hasCriteria()) {
            throw new ValidationException(
                "JOIN condition cannot be null for " + join.keyword(),
                "join validation",
                join.toSQL(),
                "Add an ON or USING clause, or use CROSS JOIN");
        }
    }

    private static void validateLimit(QueryNode query) {
        if (query.limit().isPresent() && query.limit().getAsLong() < 0) {
            throw new ValidationException(
                "LIMIT must not be negative, got " + query.limit().getAsLong(),
                "limit validation",
                query.toSQL(),
                "Use a LIMIT of zero or more rows");
        }
    }
}
