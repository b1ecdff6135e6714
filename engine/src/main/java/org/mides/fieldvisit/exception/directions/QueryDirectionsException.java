package org.mides.fieldvisit.exception.directions;

public class QueryDirectionsException extends RuntimeException {
    public QueryDirectionsException(String message) {
        super(message);
    }

    public QueryDirectionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
