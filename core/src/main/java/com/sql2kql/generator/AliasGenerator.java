package com.sql2kql.generator;

import com.sql2kql.expression.Expression;

/**
 * Names computed SELECT items that have no explicit alias.
 *
 * <p>The name becomes the column created by {@code extend} and is then referenced
 * from {@code project}. Implementations must be deterministic: the same expression
 * at the same position always gets the same name.
 */
public interface AliasGenerator {

    /**
     * Proposes a name for a computed select item.
     *
     * @param expression the un-aliased expression
     * @param position the 1-based position of the item in the select list
     * @return a column name (uniqueness is enforced by the caller)
     */
    String aliasFor(Expression expression, int position);
}
