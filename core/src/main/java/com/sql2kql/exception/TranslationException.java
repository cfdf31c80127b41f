package com.sql2kql.exception;

import java.util.Objects;

/**
 * Exception thrown when a query cannot be translated.
 *
 * <p>The exception carries a {@link TranslationDiagnostic} naming the kind of failure
 * and the offending construct, and offers both a user-facing and a technical message.
 *
 * <p>Common causes:
 * <ul>
 *   <li>An operator with no counterpart in the target language</li>
 *   <li>A LIKE whose pattern is not a string literal</li>
 *   <li>A function template referring to a missing argument</li>
 *   <li>Queries nested deeper than the configured limit</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       TranslationResult result = translator.translate(sql);
 *   } catch (TranslationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Offending construct: " + e.diagnostic().construct());
 *   }
 * </pre>
 *
 * @see com.sql2kql.generator.KQLGenerator
 */
public class TranslationException extends RuntimeException {

    private final TranslationDiagnostic diagnostic;

    /**
     * Creates a translation exception.
     *
     * @param kind the failure kind
     * @param message the error message
     * @param construct the offending construct (may be null)
     */
    public TranslationException(DiagnosticKind kind, String message, String construct) {
        this(new TranslationDiagnostic(kind, message, construct), null);
    }

    /**
     * Creates a translation exception with a cause.
     *
     * @param kind the failure kind
     * @param message the error message
     * @param construct the offending construct (may be null)
     * @param cause the underlying cause
     */
    public TranslationException(DiagnosticKind kind, String message, String construct, Throwable cause) {
        this(new TranslationDiagnostic(kind, message, construct), cause);
    }

    private TranslationException(TranslationDiagnostic diagnostic, Throwable cause) {
        super(diagnostic.construct() == null
                ? diagnostic.message()
                : diagnostic.message() + " (construct: " + diagnostic.construct() + ")",
            cause);
        this.diagnostic = Objects.requireNonNull(diagnostic);
    }

    public TranslationDiagnostic diagnostic() {
        return diagnostic;
    }

    public DiagnosticKind kind() {
        return diagnostic.kind();
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates the failure kind into actionable guidance for users.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        switch (diagnostic.kind()) {
            case UNKNOWN_OPERATOR:
                return "The query uses an operator that has no KQL equivalent: " +
                       diagnostic.construct() + ". " +
                       "Rewrite the expression with a supported comparison or arithmetic operator.";

            case NON_LITERAL_LIKE_PATTERN:
                return "LIKE patterns must be string literals when translated to KQL. " +
                       "Replace the pattern expression with a quoted literal.";

            case MALFORMED_TEMPLATE:
                return "A function was called with fewer arguments than its KQL translation needs: " +
                       diagnostic.construct() + ".";

            case UNKNOWN_JOIN_KEYWORD:
                return "The join type is not supported: " + diagnostic.construct() + ". " +
                       "Use INNER, LEFT, RIGHT or FULL joins.";

            case NESTING_TOO_DEEP:
                return "The query nests subqueries or parentheses too deeply to translate. " +
                       "Flatten the query or raise the nesting limit.";

            case PARSER_UNAVAILABLE:
            case UNRECOGNIZED_QUERY:
                return "The query could not be parsed into a translatable form. " +
                       "Check that it is a SELECT or UNION query.";

            default:
                return "Failed to translate query: " + diagnostic.message() + ". " +
                       "Please simplify your query.";
        }
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Translation Failed\n");
        sb.append("Kind: ").append(diagnostic.kind()).append("\n");
        sb.append("Error: ").append(diagnostic.message()).append("\n");

        if (diagnostic.construct() != null) {
            sb.append("Construct: ").append(diagnostic.construct()).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
