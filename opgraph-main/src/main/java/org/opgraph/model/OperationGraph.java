package org.opgraph.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependency checks over an ordered operation list.
 */
public final class OperationGraph {

    private OperationGraph() {
    }

    /**
     * Ids of the operations whose results {@code operation} consumes, in
     * operand order.
     */
    public static List<String> dependenciesOf(Operation operation) {
        List<String> dependencies = new ArrayList<>(2);
        addReference(operation.operand1Token(), dependencies);
        addReference(operation.operand2Token(), dependencies);
        return dependencies;
    }

    /**
     * Checks that every reference names an operation appearing strictly
     * earlier in the list, so the list can be computed front to back.
     *
     * @throws IllegalStateException naming the first offending operation
     */
    public static void verifyOrder(List<Operation> operations) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < operations.size(); i++) {
            Operation operation = operations.get(i);
            for (String dependency : dependenciesOf(operation)) {
                if (!seen.contains(dependency)) {
                    throw new IllegalStateException("Operation " + operation.getId() + " at index " + i
                            + " references " + dependency + " which does not precede it");
                }
            }
            if (!seen.add(operation.getId())) {
                throw new IllegalStateException("Duplicate operation id " + operation.getId() + " at index " + i);
            }
        }
    }

    private static void addReference(OperandToken token, List<String> dependencies) {
        if (token instanceof OperandToken.Reference reference) {
            dependencies.add(reference.operationId());
        }
    }
}
