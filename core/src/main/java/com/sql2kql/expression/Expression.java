package com.sql2kql.expression;

/**
 * Base interface for all expressions in the sql2kql syntax tree.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Boolean connectives and predicates (AND, OR, NOT, BETWEEN, IN, LIKE)</li>
 *   <li>Binary operators (a + b, a = b)</li>
 *   <li>Function calls (upper(name), count(*))</li>
 * </ul>
 *
 * <p>Expressions are used in:
 * <ul>
 *   <li>SELECT clause (projections)</li>
 *   <li>WHERE clause (filters)</li>
 *   <li>JOIN ... ON conditions</li>
 *   <li>GROUP BY clause</li>
 *   <li>ORDER BY clause</li>
 * </ul>
 *
 * <p>All concrete implementations in this package are {@code final} and immutable.
 * Translation into KQL is done by {@link com.sql2kql.generator.ExpressionTranslator},
 * which dispatches over the concrete types; an expression only knows how to print
 * itself back as SQL, which is what diagnostics quote.
 */
public interface Expression {

    /**
     * Converts this expression back to its SQL string representation.
     *
     * <p>Used to name the offending construct in warnings and error messages.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
