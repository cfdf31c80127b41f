package com.sql2kql.runtime;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.generator.KQLGenerator;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.parser.QueryParser;
import com.sql2kql.parser.SQLQueryParser;
import com.sql2kql.parser.SQLTextNormalizer;
import com.sql2kql.validation.QueryValidator;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates SQL query text into a KQL pipeline.
 *
 * <p>Each call runs the full chain:
 * <ol>
 *   <li>{@link SQLTextNormalizer}: quotes, table-name substitution, keyword remapping</li>
 *   <li>{@link QueryParser}: SQL text to {@link QueryNode}</li>
 *   <li>{@link QueryValidator}: structural checks</li>
 *   <li>{@link KQLGenerator}: pipeline generation</li>
 * </ol>
 *
 * <p>Example usage:
 * <pre>
 *   SqlToKqlTranslator translator = new SqlToKqlTranslator();
 *   TranslationResult result = translator.translate(
 *       "SELECT host, count(*) AS n FROM events GROUP BY host",
 *       Map.of("events", "SecurityEvent"));
 *
 *   // SecurityEvent
 *   // | summarize n = count() by host
 *   System.out.println(result.kql());
 * </pre>
 *
 * <p>Instances are immutable. With the default parser, which is pooled per thread,
 * one translator may be used from several threads.
 *
 * @see TranslationOptions
 * @see TranslationResult
 */
public class SqlToKqlTranslator {

    private static final Logger logger = LoggerFactory.getLogger(SqlToKqlTranslator.class);

    private final QueryParser parser;
    private final TranslationOptions options;
    private final SQLTextNormalizer normalizer;
    private final KQLGenerator generator;

    /**
     * Creates a translator with the bundled parser and options read from system properties.
     */
    public SqlToKqlTranslator() {
        this(TranslationOptions.fromSystemProperties());
    }

    /**
     * Creates a translator with the bundled parser.
     *
     * @param options the translation options
     */
    public SqlToKqlTranslator(TranslationOptions options) {
        this(sql -> SQLQueryParser.getInstance().parse(sql, options.maxNestingDepth()), options);
    }

    /**
     * Creates a translator with a custom parser.
     *
     * @param parser the parser (a null parser fails every translation)
     * @param options the translation options
     */
    public SqlToKqlTranslator(QueryParser parser, TranslationOptions options) {
        this.parser = parser;
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.normalizer = new SQLTextNormalizer(
            options.normalizeDoubleQuotes(), options.wholeWordTableSubstitution());
        this.generator = new KQLGenerator(options);
    }

    public TranslationOptions options() {
        return options;
    }

    /**
     * Translates a SQL query.
     *
     * @param sql the SQL query
     * @return the translation result
     * @throws TranslationException if translation fails
     * @throws com.sql2kql.parser.SQLParseException if the SQL is syntactically invalid
     * @throws com.sql2kql.exception.ValidationException if the query is structurally invalid
     * @throws UnsupportedOperationException if the SQL uses unsupported features
     */
    public TranslationResult translate(String sql) {
        return translate(sql, Map.of());
    }

    /**
     * Translates a SQL query, replacing source table names first.
     *
     * @param sql the SQL query
     * @param targetTables source table name to target table name
     * @return the translation result
     * @throws TranslationException if translation fails, including input nested too deeply
     *         to process
     * @throws com.sql2kql.parser.SQLParseException if the SQL is syntactically invalid
     * @throws com.sql2kql.exception.ValidationException if the query is structurally invalid
     * @throws UnsupportedOperationException if the SQL uses unsupported features
     */
    public TranslationResult translate(String sql, Map<String, String> targetTables) {
        Objects.requireNonNull(sql, "sql must not be null");
        if (parser == null) {
            throw new TranslationException(DiagnosticKind.PARSER_UNAVAILABLE,
                "No SQL parser is configured", null);
        }

        String normalized = normalizer.normalize(sql, targetTables);
        logger.debug("Normalized SQL: {}", normalized);

        TranslationResult result;
        try {
            QueryNode query = parser.parse(normalized);
            if (query == null) {
                throw new TranslationException(DiagnosticKind.UNRECOGNIZED_QUERY,
                    "The parser returned no query", normalized);
            }

            QueryValidator.validate(query);

            result = generator.generate(query);
        } catch (StackOverflowError e) {
            // Long operator or UNION chains recurse without parentheses
            logger.warn("Translation ran out of stack for a query of {} characters", normalized.length());
            throw new TranslationException(DiagnosticKind.NESTING_TOO_DEEP,
                "The query is nested too deeply to translate", null, e);
        }
        if (result.hasWarnings()) {
            logger.debug("Translation finished with {} warning(s)", result.warnings().size());
        }
        return result;
    }
}
