package com.sql2kql.expression;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Utility methods for classifying, inspecting and rewriting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Known aggregate function names (lowercase). A select list containing one of these
     * is translated into a {@code summarize} stage instead of a projection.
     */
    public static final Set<String> AGGREGATE_FUNCTIONS = Set.of(
        "count", "sum", "avg", "mean", "min", "max",
        "stddev", "stdev", "variance",
        "any_value", "take_any",
        "collect_list", "collect_set",
        "approx_count_distinct", "dcount",
        "count_if", "countif"
    );

    /**
     * Returns true if the expression tree contains an aggregate function call.
     *
     * @param expr the expression to check
     * @return true if the expression contains an aggregate function
     */
    public static boolean containsAggregateFunction(Expression expr) {
        if (expr instanceof FunctionCall func) {
            if (AGGREGATE_FUNCTIONS.contains(func.functionName().toLowerCase())) {
                return true;
            }
            // e.g. coalesce(sum(x), 0)
            for (Expression arg : func.arguments()) {
                if (containsAggregateFunction(arg)) return true;
            }
            return false;
        }
        if (expr instanceof BinaryExpression bin) {
            return containsAggregateFunction(bin.left()) ||
                   containsAggregateFunction(bin.right());
        }
        if (expr instanceof ConjunctionExpression conj) {
            return conj.operands().stream().anyMatch(ExpressionUtils::containsAggregateFunction);
        }
        if (expr instanceof NotExpression not) {
            return containsAggregateFunction(not.operand());
        }
        return false;
    }

    /**
     * Returns true if the expression is a bare column reference, the only shape that
     * can be projected or listed in {@code distinct} without an {@code extend}.
     *
     * @param expr the expression to check
     * @return true for a plain (optionally qualified) column reference
     */
    public static boolean isTrivial(Expression expr) {
        return expr instanceof ColumnReference;
    }

    /**
     * Collects the distinct qualifiers of column references in an expression tree,
     * in first-seen order. Subqueries are not entered.
     *
     * @param expr the expression to scan
     * @return the qualifiers found
     */
    public static Set<String> collectQualifiers(Expression expr) {
        Set<String> qualifiers = new LinkedHashSet<>();
        rewriteQualifiers(expr, qualifier -> {
            qualifiers.add(qualifier);
            return qualifier;
        });
        return qualifiers;
    }

    /**
     * Rebuilds an expression tree with every column qualifier passed through a mapping.
     *
     * <p>Unqualified columns, literals, stars and unresolved expressions are returned
     * as-is. Subqueries of {@link InSubquery} keep their own qualifiers.
     *
     * @param expr the expression to rewrite
     * @param mapping qualifier mapping, applied to non-null qualifiers only
     * @return the rewritten expression
     */
    public static Expression rewriteQualifiers(Expression expr, Function<String, String> mapping) {
        if (expr instanceof ColumnReference col) {
            if (!col.isQualified()) {
                return col;
            }
            return col.withQualifier(mapping.apply(col.qualifier()));
        }
        if (expr instanceof ConjunctionExpression conj) {
            return new ConjunctionExpression(conj.connective(), rewriteAll(conj.operands(), mapping));
        }
        if (expr instanceof NotExpression not) {
            return new NotExpression(rewriteQualifiers(not.operand(), mapping));
        }
        if (expr instanceof BinaryExpression bin) {
            return new BinaryExpression(
                rewriteQualifiers(bin.left(), mapping),
                bin.operator(),
                rewriteQualifiers(bin.right(), mapping));
        }
        if (expr instanceof BetweenExpression between) {
            return new BetweenExpression(
                rewriteQualifiers(between.value(), mapping),
                rewriteQualifiers(between.lower(), mapping),
                rewriteQualifiers(between.upper(), mapping),
                between.isNegated());
        }
        if (expr instanceof InExpression in) {
            return new InExpression(
                rewriteQualifiers(in.testExpr(), mapping),
                rewriteAll(in.values(), mapping),
                in.isNegated());
        }
        if (expr instanceof InSubquery in) {
            return new InSubquery(rewriteQualifiers(in.testExpr(), mapping), in.subquery(), in.isNegated());
        }
        if (expr instanceof LikeExpression like) {
            return new LikeExpression(
                rewriteQualifiers(like.value(), mapping),
                rewriteQualifiers(like.pattern(), mapping),
                like.isNegated());
        }
        if (expr instanceof FunctionCall func) {
            return new FunctionCall(func.functionName(), rewriteAll(func.arguments(), mapping), func.distinct());
        }
        return expr;
    }

    private static List<Expression> rewriteAll(List<Expression> exprs, Function<String, String> mapping) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression e : exprs) {
            result.add(rewriteQualifiers(e, mapping));
        }
        return result;
    }
}
