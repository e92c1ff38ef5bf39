package org.opgraph.model;

/**
 * Lifecycle of an emitted operation. Only {@link #PENDING} is ever assigned
 * by decomposition; the other states belong to the execution layer.
 */
public enum OperationStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
