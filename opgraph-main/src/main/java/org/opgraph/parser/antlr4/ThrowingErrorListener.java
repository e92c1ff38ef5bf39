package org.opgraph.parser.antlr4;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.opgraph.ErrorKind;
import org.opgraph.ExpressionParseException;

/**
 * Turns the first lexer or parser error into an {@link ExpressionParseException}
 * instead of letting ANTLR recover and print to stderr.
 */
class ThrowingErrorListener extends BaseErrorListener {

    private final String expression;

    ThrowingErrorListener(String expression) {
        this.expression = expression;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        throw new ExpressionParseException(ErrorKind.INVALID_EXPRESSION,
                "Parse error at " + line + ":" + charPositionInLine + " " + msg,
                expression, line, charPositionInLine, e);
    }
}
