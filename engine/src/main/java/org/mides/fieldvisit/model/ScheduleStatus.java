package org.mides.fieldvisit.model;

/**
 * Lifecycle of a day's route: DRAFT → APPROVED → IN_PROGRESS → COMPLETED.
 */
public enum ScheduleStatus {
    DRAFT,
    APPROVED,
    IN_PROGRESS,
    COMPLETED;

    public boolean canApprove() {
        return this == DRAFT;
    }

    public boolean canStart() {
        return this == APPROVED;
    }

    /**
     * Starting an already started or finished schedule is accepted as a no-op.
     */
    public boolean isStarted() {
        return this == IN_PROGRESS || this == COMPLETED;
    }

    public boolean canComplete() {
        return this == IN_PROGRESS;
    }

    public boolean isEditable() {
        return this == DRAFT;
    }
}
