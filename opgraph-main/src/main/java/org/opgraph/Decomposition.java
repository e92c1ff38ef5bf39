package org.opgraph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.opgraph.model.OperandToken;
import org.opgraph.model.Operation;

/**
 * Output of one decomposition: the operations in dependency order and the
 * token holding the value of the whole expression.
 * <p>
 * The list belongs to the caller. When the expression folds to a bare
 * literal the list is empty and {@link #result()} is that literal.
 */
public record Decomposition(List<Operation> operations, OperandToken result) {

    public Decomposition {
        Objects.requireNonNull(operations, "operations must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    public boolean isConstant() {
        return operations.isEmpty();
    }

    /**
     * The operation producing the overall value, absent for a constant.
     */
    public Optional<Operation> finalOperation() {
        if (operations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(operations.get(operations.size() - 1));
    }

    public int size() {
        return operations.size();
    }
}
