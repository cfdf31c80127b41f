package com.sql2kql.logical;

/**
 * A source in a FROM clause or on the right side of a JOIN.
 *
 * @see TableRelation
 * @see SubqueryRelation
 */
public interface Relation {

    /**
     * Returns the alias given to this source.
     *
     * @return the alias, or null if none was given
     */
    String alias();

    /**
     * Renders this source back to SQL for diagnostics.
     *
     * @return the SQL text
     */
    String toSQL();
}
