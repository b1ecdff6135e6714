package org.mides.fieldvisit.model;

/**
 * Lifecycle of a single visit. Moves forward only:
 * PENDING → IN_PROGRESS → COMPLETED, or PENDING/IN_PROGRESS → CANCELLED.
 */
public enum StopStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canStart() {
        return this == PENDING;
    }

    public boolean canFinalize() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
