package org.opgraph;

import java.util.List;

import org.opgraph.model.Operation;

/**
 * Compiles infix arithmetic expressions into dependency-ordered operation
 * lists for distributed execution.
 * <p>
 * Implementations are immutable and safe for concurrent use. All failures
 * are reported as {@link OpGraphException} subtypes and leave no partial
 * output behind.
 */
public interface ExpressionDecomposer {

    /**
     * Checks that {@code expression} is well-formed without producing
     * operations.
     *
     * @throws ExpressionParseException kind {@link ErrorKind#EMPTY_EXPRESSION}
     *         or {@link ErrorKind#INVALID_EXPRESSION}
     */
    void validate(String expression);

    /**
     * Validates, parses and lowers {@code expression}. In the returned list
     * every referenced operation precedes the operations that consume it.
     *
     * @throws ExpressionParseException      if validation fails
     * @throws ExpressionLoweringException   for unsupported operators, literal
     *                                       zero divisors or malformed nodes
     * @throws ExpressionTooComplexException if more operations than allowed
     *                                       are produced
     */
    Decomposition decompose(String expression);

    /**
     * Binds every operation to the calculation created after decomposition.
     * Only {@code calculationId} is modified.
     */
    void setCalculationId(List<Operation> operations, String calculationId);
}
