package com.sql2kql.parser;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.runtime.TranslationOptions;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The bundled {@link QueryParser}: restricted SQL text in, {@link QueryNode} out.
 *
 * <p>Each query is lexed once and then parsed with the fast SLL prediction mode. Only
 * when SLL gives up is the token stream rewound and parsed again in full LL mode, and it
 * is that second pass whose errors reach {@link SQLErrorListener}.
 *
 * <p>Before parsing, the token stream is scanned for parenthesis depth. Subqueries and
 * grouped expressions both nest through parentheses, and parsing recurses once per
 * level, so input nested deeper than the configured limit is refused up front.
 *
 * <p>Lexer and parser objects are reused between queries. They are not thread-safe, so
 * callers go through {@link #getInstance()}, which hands every thread its own instance.
 *
 * <pre>
 *   QueryNode query = SQLQueryParser.getInstance().parse("SELECT a FROM t WHERE a = 'x'");
 * </pre>
 */
public class SQLQueryParser implements QueryParser {

    private static final Logger logger = LoggerFactory.getLogger(SQLQueryParser.class);

    private static final ThreadLocal<SQLQueryParser> PARSER_POOL =
        ThreadLocal.withInitial(SQLQueryParser::new);

    private final RestrictedSqlLexer lexer;
    private final CommonTokenStream tokens;
    private final RestrictedSqlParser parser;

    public SQLQueryParser() {
        this.lexer = new RestrictedSqlLexer(CharStreams.fromString(""));
        this.tokens = new CommonTokenStream(lexer);
        this.parser = new RestrictedSqlParser(tokens);

        lexer.removeErrorListeners();
        lexer.addErrorListener(new SQLErrorListener());
        parser.removeErrorListeners();
        parser.addErrorListener(new SQLErrorListener());
    }

    /**
     * Returns the parser owned by the calling thread.
     *
     * @return parser for the current thread
     */
    public static SQLQueryParser getInstance() {
        return PARSER_POOL.get();
    }

    /**
     * Parses a query with the default nesting limit.
     *
     * @param sql the SQL query string
     * @return the parsed query
     * @throws SQLParseException if the SQL is syntactically invalid
     * @throws UnsupportedOperationException if the SQL uses unsupported features
     * @throws TranslationException if the query is nested too deeply
     */
    @Override
    public QueryNode parse(String sql) {
        return parse(sql, TranslationOptions.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Parses a query.
     *
     * @param sql the SQL query string
     * @param maxNestingDepth the deepest parenthesis nesting accepted
     * @return the parsed query
     * @throws SQLParseException if the SQL is syntactically invalid
     * @throws UnsupportedOperationException if the SQL uses unsupported features
     * @throws TranslationException if the query is nested too deeply
     */
    public QueryNode parse(String sql, int maxNestingDepth) {
        if (sql == null || sql.isBlank()) {
            throw new SQLParseException(0, 0, "", "SQL query must not be null or empty");
        }

        logger.debug("Parsing SQL: {}", sql);

        lexer.setInputStream(CharStreams.fromString(sql));
        tokens.setTokenSource(lexer);
        checkNestingDepth(sql, maxNestingDepth);
        parser.setTokenStream(tokens);

        // First pass: SLL, bailing out on the first conflict
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());

        RestrictedSqlParser.SingleStatementContext tree;
        try {
            tree = parser.singleStatement();
        } catch (ParseCancellationException e) {
            logger.debug("SLL pass gave up, reparsing in LL mode: {}", e.getMessage());
            tokens.seek(0);
            parser.reset();
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            parser.removeErrorListeners();
            parser.addErrorListener(new SQLErrorListener());
            parser.setErrorHandler(new DefaultErrorStrategy());

            tree = parser.singleStatement();
        }

        QueryNode query = (QueryNode) new SQLAstBuilder().visit(tree);
        logger.debug("Parsed query: {}", query);
        return query;
    }

    /**
     * Fills the token stream and rejects it if parentheses nest deeper than allowed.
     * Unbalanced parentheses are left for the parser to report.
     */
    private void checkNestingDepth(String sql, int maxNestingDepth) {
        tokens.fill();
        int depth = 0;
        for (Token token : tokens.getTokens()) {
            if (token.getType() == RestrictedSqlLexer.LEFT_PAREN) {
                depth++;
                if (depth > maxNestingDepth) {
                    throw new TranslationException(
                        DiagnosticKind.NESTING_TOO_DEEP,
                        String.format("Parentheses nest deeper than the maximum depth of %d (line %d, column %d)",
                            maxNestingDepth, token.getLine(), token.getCharPositionInLine()),
                        sql.length() > 80 ? sql.substring(0, 80) + "..." : sql);
                }
            } else if (token.getType() == RestrictedSqlLexer.RIGHT_PAREN && depth > 0) {
                depth--;
            }
        }
        tokens.seek(0);
    }
}
