package com.sql2kql.exception;

/**
 * Classification of problems found while translating a query.
 *
 * <p>Error kinds abort translation with a {@link TranslationException}; warning kinds
 * are recorded on the result and translation continues with best-effort output.
 */
public enum DiagnosticKind {

    // Hard errors
    UNKNOWN_OPERATOR(Severity.ERROR),
    NON_LITERAL_LIKE_PATTERN(Severity.ERROR),
    MALFORMED_TEMPLATE(Severity.ERROR),
    UNKNOWN_JOIN_KEYWORD(Severity.ERROR),
    NESTING_TOO_DEEP(Severity.ERROR),
    PARSER_UNAVAILABLE(Severity.ERROR),
    UNRECOGNIZED_QUERY(Severity.ERROR),
    INTERNAL_ERROR(Severity.ERROR),

    // Soft warnings
    UNMAPPED_FUNCTION(Severity.WARNING),
    UNSUPPORTED_CROSS_JOIN(Severity.WARNING),
    JOIN_PREFIX_AMBIGUOUS(Severity.WARNING),
    UNRESOLVED_EXPRESSION(Severity.WARNING),
    DISTINCT_QUANTIFIER_DROPPED(Severity.WARNING);

    /**
     * Diagnostic severity.
     */
    public enum Severity {
        ERROR,
        WARNING
    }

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
