package org.mides.fieldvisit.exception;

/**
 * Malformed input. Nothing was changed; safe to retry with corrected input.
 */
public class ValidationException extends FieldVisitException {
    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }

    public ValidationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
