package org.opgraph;

public class ExpressionParseException extends OpGraphException {

    private final String expression;
    private final int line;
    private final int column;

    public ExpressionParseException(ErrorKind kind, String message, String expression, int line, int column) {
        super(kind, message);
        this.expression = expression;
        this.line = line;
        this.column = column;
    }

    public ExpressionParseException(ErrorKind kind, String message, String expression, int line, int column, Throwable cause) {
        super(kind, message, cause);
        this.expression = expression;
        this.line = line;
        this.column = column;
    }

    public static ExpressionParseException empty(String expression) {
        return new ExpressionParseException(ErrorKind.EMPTY_EXPRESSION,
                ErrorKind.EMPTY_EXPRESSION.getDescription(), expression, 0, 0);
    }

    public String getExpression() {
        return expression;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
