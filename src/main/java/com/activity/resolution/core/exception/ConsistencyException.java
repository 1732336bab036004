package com.activity.resolution.core.exception;

/**
 * Thrown when a write would break a store invariant (duplicate unique key,
 * dangling reference). Only the current unit of work is rolled back.
 */
public class ConsistencyException extends ResolutionException {

    public ConsistencyException(String message) {
        super(message);
    }

    public ConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
