package com.sql2kql.parser;

import com.sql2kql.logical.QueryNode;

/**
 * Turns SQL text into a {@link QueryNode}.
 *
 * <p>The translator only depends on this interface, so another front end can stand in
 * for the bundled ANTLR parser.
 *
 * @see SQLQueryParser
 */
public interface QueryParser {

    /**
     * Parses one SQL query.
     *
     * @param sql the query text
     * @return the parsed query
     * @throws SQLParseException if the text is not valid SQL for this parser
     * @throws UnsupportedOperationException if the query uses a recognized but unsupported feature
     */
    QueryNode parse(String sql);
}
