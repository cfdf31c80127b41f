package com.sql2kql.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * ANTLR error listener that fails fast with a {@link SQLParseException}.
 */
public class SQLErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        String offendingText = "";
        if (offendingSymbol instanceof Token token) {
            offendingText = token.getType() == Token.EOF ? "<EOF>" : token.getText();
        }
        String message = String.format("Syntax error at line %d:%d near '%s': %s",
            line, charPositionInLine, offendingText, msg);
        throw new SQLParseException(line, charPositionInLine, offendingText, message);
    }
}
