package org.mides.fieldvisit.exception;

public class NotFoundException extends FieldVisitException {
    public NotFoundException(ErrorCode code, String message) {
        super(code, message);
    }
}
