package com.sql2kql.exception;

/**
 * Exception thrown when a parsed query is structurally unfit for translation.
 *
 * <p>Carries the validation phase that failed, the offending input and a suggestion
 * for fixing it.
 *
 * @see com.sql2kql.validation.QueryValidator
 */
public class ValidationException extends RuntimeException {

    private final String phase;
    private final String invalidInput;
    private final String suggestion;

    /**
     * Creates a validation exception.
     *
     * @param message the error message
     * @param phase the validation phase (for example "join validation")
     * @param invalidInput the offending input
     * @param suggestion how to fix the problem
     */
    public ValidationException(String message, String phase, String invalidInput, String suggestion) {
        super(message);
        this.phase = phase;
        this.invalidInput = invalidInput;
        this.suggestion = suggestion;
    }

    public String getPhase() {
        return phase;
    }

    public String getInvalidInput() {
        return invalidInput;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns the message together with the suggestion.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (suggestion == null) {
            return getMessage();
        }
        return getMessage() + ". " + suggestion;
    }
}
