package com.sql2kql.parser;

/**
 * Exception thrown when SQL text cannot be parsed.
 *
 * <p>Carries the position of the first syntax error and the offending token text.
 */
public class SQLParseException extends RuntimeException {

    private final int line;
    private final int charPositionInLine;
    private final String offendingText;

    /**
     * Creates a parse exception.
     *
     * @param line the 1-based line of the error (0 when unknown)
     * @param charPositionInLine the 0-based column of the error
     * @param offendingText the text of the offending token
     * @param message the error message
     */
    public SQLParseException(int line, int charPositionInLine, String offendingText, String message) {
        super(message);
        this.line = line;
        this.charPositionInLine = charPositionInLine;
        this.offendingText = offendingText;
    }

    public int getLine() {
        return line;
    }

    public int getCharPositionInLine() {
        return charPositionInLine;
    }

    public String getOffendingText() {
        return offendingText;
    }
}
