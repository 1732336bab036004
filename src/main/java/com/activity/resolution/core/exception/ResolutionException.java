package com.activity.resolution.core.exception;

/**
 * Base class for all failures raised by the activity resolution engine.
 * Subclasses tell the caller how far the failure reaches: a single row,
 * a single unit of work, or the whole run.
 */
public abstract class ResolutionException extends RuntimeException {

    protected ResolutionException(String message) {
        super(message);
    }

    protected ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
