package com.sql2kql.expression;

import com.sql2kql.logical.QueryNode;
import java.util.Objects;

/**
 * Expression representing an IN predicate whose right side is a subquery.
 *
 * <p>Examples:
 * <pre>
 *   user_id IN (SELECT id FROM active_users)
 *   host NOT IN (SELECT host FROM allow_list)
 * </pre>
 *
 * <p>The subquery is translated into its own nested pipeline and embedded in
 * parentheses after {@code in} / {@code !in}.
 */
public final class InSubquery implements Expression {

    private final Expression testExpr;
    private final QueryNode subquery;
    private final boolean negated;

    /**
     * Creates an IN subquery expression.
     *
     * @param testExpr the expression to test
     * @param subquery the subquery providing the value set
     * @param negated true for NOT IN
     */
    public InSubquery(Expression testExpr, QueryNode subquery, boolean negated) {
        this.testExpr = Objects.requireNonNull(testExpr, "testExpr must not be null");
        this.subquery = Objects.requireNonNull(subquery, "subquery must not be null");
        this.negated = negated;
    }

    public Expression testExpr() {
        return testExpr;
    }

    public QueryNode subquery() {
        return subquery;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public String toSQL() {
        return String.format("%s %sIN (%s)",
            testExpr.toSQL(), negated ? "NOT " : "", subquery.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InSubquery)) return false;
        InSubquery that = (InSubquery) obj;
        return negated == that.negated &&
               testExpr.equals(that.testExpr) &&
               subquery.equals(that.subquery);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, subquery, negated);
    }
}
