package com.sql2kql.exception;

import java.util.Objects;

/**
 * One structured problem report: what went wrong, and which construct caused it.
 *
 * <p>Diagnostics let callers test failure modes without matching on the inline
 * {@code // WARNING} markers of the output text.
 */
public final class TranslationDiagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final String construct;

    /**
     * Creates a diagnostic.
     *
     * @param kind the diagnostic kind
     * @param message a human-readable description
     * @param construct the offending construct, as source text (may be null)
     */
    public TranslationDiagnostic(DiagnosticKind kind, String message, String construct) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.construct = construct;
    }

    public DiagnosticKind kind() {
        return kind;
    }

    public DiagnosticKind.Severity severity() {
        return kind.severity();
    }

    public String message() {
        return message;
    }

    /**
     * Returns the offending construct.
     *
     * @return the construct text, or null if not available
     */
    public String construct() {
        return construct;
    }

    public boolean isWarning() {
        return kind.severity() == DiagnosticKind.Severity.WARNING;
    }

    @Override
    public String toString() {
        if (construct == null) {
            return kind.severity() + " " + kind + ": " + message;
        }
        return kind.severity() + " " + kind + ": " + message + " [" + construct + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TranslationDiagnostic)) return false;
        TranslationDiagnostic that = (TranslationDiagnostic) obj;
        return kind == that.kind &&
               message.equals(that.message) &&
               Objects.equals(construct, that.construct);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, construct);
    }
}
