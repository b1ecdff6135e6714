package org.mides.fieldvisit.exception;

/**
 * Machine-readable failure codes returned to clients.
 */
public enum ErrorCode {
    INVALID_INPUT,
    EMPTY_STOP_SET,
    INVALID_COORDINATES,
    NON_MONOTONIC_TIMESTAMPS,
    NEGATIVE_QUANTITY,
    SKIP_REASON_TOO_SHORT,
    INVALID_REQUESTS,
    INVALID_STOP_ORDER,
    PHOTO_UPLOAD_FAILED,

    STOP_ALREADY_FINALIZED,
    SCHEDULE_NOT_FULLY_EXECUTED,
    INVALID_SCHEDULE_STATUS,
    DUPLICATE_SCHEDULE,

    SCHEDULE_NOT_FOUND,
    STOP_NOT_FOUND,
    REQUEST_NOT_FOUND,
    SIGNAL_NOT_FOUND,

    INTERNAL_ERROR
}
