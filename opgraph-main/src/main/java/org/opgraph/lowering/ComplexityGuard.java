package org.opgraph.lowering;

import org.opgraph.ExpressionTooComplexException;

/**
 * Upper bounds on the size of one expression: the number of operations it
 * may produce and how deeply parentheses and prefix operators may nest.
 * Parsing, tree building and lowering all recurse on nesting, so the depth
 * limit also bounds their stack use.
 */
public final class ComplexityGuard {

    public static final int DEFAULT_MAX_OPERATIONS = 100;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final int maxOperations;
    private final int maxNestingDepth;

    /**
     * @param maxOperations limit; zero or negative selects {@link #DEFAULT_MAX_OPERATIONS}
     */
    public ComplexityGuard(int maxOperations) {
        this(maxOperations, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Zero or negative values select the respective default.
     */
    public ComplexityGuard(int maxOperations, int maxNestingDepth) {
        this.maxOperations = maxOperations > 0 ? maxOperations : DEFAULT_MAX_OPERATIONS;
        this.maxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
    }

    public int getMaxOperations() {
        return maxOperations;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void check(int operationCount) {
        if (operationCount > maxOperations) {
            throw new ExpressionTooComplexException(operationCount, maxOperations);
        }
    }

    public void checkNesting(int nestingDepth) {
        if (nestingDepth > maxNestingDepth) {
            throw ExpressionTooComplexException.nestingTooDeep(nestingDepth, maxNestingDepth);
        }
    }
}
