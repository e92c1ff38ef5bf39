package org.opgraph.model;

import java.util.Objects;

/**
 * One atomic binary arithmetic step. Identity, type and operands are fixed at
 * emission; the owning calculation may be bound later and the status is
 * advanced by whoever executes the operation.
 */
public final class Operation {

    private final String id;
    private final OperationType operationType;
    private final String operand1;
    private final String operand2;
    private String calculationId;
    private OperationStatus status;

    public Operation(String id, OperationType operationType, OperandToken operand1, OperandToken operand2) {
        this(id, null, operationType, operand1.encode(), operand2.encode(), OperationStatus.PENDING);
    }

    /**
     * Restores an operation from its stored form.
     */
    public Operation(String id, String calculationId, OperationType operationType,
                     String operand1, String operand2, OperationStatus status) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.calculationId = calculationId;
        this.operationType = Objects.requireNonNull(operationType, "operationType must not be null");
        this.operand1 = Objects.requireNonNull(operand1, "operand1 must not be null");
        this.operand2 = Objects.requireNonNull(operand2, "operand2 must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    public String getId() {
        return id;
    }

    public String getCalculationId() {
        return calculationId;
    }

    public void setCalculationId(String calculationId) {
        this.calculationId = calculationId;
    }

    public OperationType getOperationType() {
        return operationType;
    }

    public String getOperand1() {
        return operand1;
    }

    public String getOperand2() {
        return operand2;
    }

    public OperandToken operand1Token() {
        return OperandToken.decode(operand1);
    }

    public OperandToken operand2Token() {
        return OperandToken.decode(operand2);
    }

    public OperationStatus getStatus() {
        return status;
    }

    public void setStatus(OperationStatus status) {
        this.status = Objects.requireNonNull(status, "status must not be null");
    }

    /**
     * Reference token pointing at this operation's future result.
     */
    public OperandToken.Reference asReference() {
        return OperandToken.reference(id);
    }

    @Override
    public String toString() {
        return "Operation{" + id + ": " + operand1 + " " + operationType.symbol() + " " + operand2
                + ", status=" + status
                + (calculationId != null ? ", calculationId=" + calculationId : "")
                + "}";
    }
}
