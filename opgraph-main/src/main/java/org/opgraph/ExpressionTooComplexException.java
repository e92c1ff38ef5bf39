package org.opgraph;

/**
 * Raised when an expression exceeds either the operation limit or the
 * nesting limit. Counters for the limit that was not hit are zero.
 */
public class ExpressionTooComplexException extends OpGraphException {

    private final int operationCount;
    private final int maxOperations;
    private final int nestingDepth;
    private final int maxNestingDepth;

    public ExpressionTooComplexException(int operationCount, int maxOperations) {
        this("Expression too complex: " + operationCount + " operations exceed the limit of " + maxOperations,
             operationCount, maxOperations, 0, 0);
    }

    private ExpressionTooComplexException(String message, int operationCount, int maxOperations,
                                          int nestingDepth, int maxNestingDepth) {
        super(ErrorKind.EXPRESSION_TOO_COMPLEX, message);
        this.operationCount = operationCount;
        this.maxOperations = maxOperations;
        this.nestingDepth = nestingDepth;
        this.maxNestingDepth = maxNestingDepth;
    }

    public static ExpressionTooComplexException nestingTooDeep(int nestingDepth, int maxNestingDepth) {
        return new ExpressionTooComplexException(
                "Expression too complex: nesting depth " + nestingDepth + " exceeds the limit of " + maxNestingDepth,
                0, 0, nestingDepth, maxNestingDepth);
    }

    public int getOperationCount() {
        return operationCount;
    }

    public int getMaxOperations() {
        return maxOperations;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean isNestingLimit() {
        return maxNestingDepth > 0;
    }
}
