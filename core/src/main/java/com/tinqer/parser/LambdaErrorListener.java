package com.tinqer.parser;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.ParseStructureException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Turns ANTLR syntax errors into {@link ParseStructureException}s that name
 * the position of the offending token.
 */
public class LambdaErrorListener extends BaseErrorListener {

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        throw new ParseStructureException(
            "Syntax error at line " + line + ":" + charPositionInLine + ": " + msg,
            e,
            ErrorContext.method("parse"));
    }
}
