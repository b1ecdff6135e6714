package org.mides.fieldvisit.exception;

import lombok.Getter;

@Getter
public abstract class FieldVisitException extends RuntimeException {
    private final ErrorCode code;

    protected FieldVisitException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected FieldVisitException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
