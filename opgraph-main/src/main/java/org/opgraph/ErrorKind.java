package org.opgraph;

/**
 * Failure categories reported by expression decomposition. Every
 * {@link OpGraphException} carries exactly one kind.
 */
public enum ErrorKind {

    EMPTY_EXPRESSION("expression is empty"),
    INVALID_EXPRESSION("invalid expression"),
    INVALID_PAREN_EXPRESSION("invalid parenthesized expression"),
    INVALID_BINARY_OPERATION("invalid binary operation"),
    UNSUPPORTED_OPERATOR("unsupported operator"),
    DIVISION_BY_ZERO("division by zero"),
    EXPRESSION_TOO_COMPLEX("expression too complex");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True for kinds raised because the input does not match the grammar,
     * as opposed to well-formed input the engine refuses to decompose.
     */
    public boolean isSyntaxError() {
        return this == EMPTY_EXPRESSION
                || this == INVALID_EXPRESSION
                || this == INVALID_PAREN_EXPRESSION
                || this == INVALID_BINARY_OPERATION;
    }
}
