package org.mides.fieldvisit.exception;

/**
 * The requested transition is not allowed from the current state. Nothing was changed.
 */
public class ConflictException extends FieldVisitException {
    public ConflictException(ErrorCode code, String message) {
        super(code, message);
    }
}
