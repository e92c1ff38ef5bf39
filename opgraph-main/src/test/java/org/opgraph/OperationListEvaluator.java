package org.opgraph;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.opgraph.model.OperandToken;
import org.opgraph.model.Operation;

/**
 * Computes an operation list front to back the way a worker pool would,
 * so tests can check that decomposition preserves the expression's value.
 */
final class OperationListEvaluator {

    private OperationListEvaluator() {
    }

    static BigDecimal evaluate(Decomposition decomposition) {
        Map<String, BigDecimal> results = new HashMap<>();
        for (Operation operation : decomposition.operations()) {
            BigDecimal left = resolve(operation.operand1Token(), results);
            BigDecimal right = resolve(operation.operand2Token(), results);
            results.put(operation.getId(), apply(operation, left, right));
        }
        return resolve(decomposition.result(), results);
    }

    static BigDecimal evaluate(List<Operation> operations, OperandToken result) {
        return evaluate(new Decomposition(operations, result));
    }

    private static BigDecimal resolve(OperandToken token, Map<String, BigDecimal> results) {
        if (token instanceof OperandToken.Reference reference) {
            BigDecimal value = results.get(reference.operationId());
            if (value == null) {
                throw new IllegalStateException("Unresolved reference " + reference.operationId());
            }
            return value;
        }
        return new BigDecimal(((OperandToken.Literal) token).text());
    }

    private static BigDecimal apply(Operation operation, BigDecimal left, BigDecimal right) {
        switch (operation.getOperationType()) {
            case ADDITION:
                return left.add(right);
            case SUBTRACTION:
                return left.subtract(right);
            case MULTIPLICATION:
                return left.multiply(right);
            case DIVISION:
                return left.divide(right, MathContext.DECIMAL64);
            default:
                throw new IllegalArgumentException("Unknown operation type " + operation.getOperationType());
        }
    }
}
