package org.mides.fieldvisit.exception;

/**
 * A collaborator this service depends on failed before any state was changed.
 */
public class UpstreamException extends FieldVisitException {
    public UpstreamException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
