package org.mides.fieldvisit.model;

public enum RequestStatus {
    PENDING,
    SCHEDULED,
    COMPLETED,
    SKIPPED;

    public boolean isSchedulable() {
        return this == PENDING || this == SKIPPED;
    }
}
