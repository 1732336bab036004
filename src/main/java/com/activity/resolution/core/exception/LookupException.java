package com.activity.resolution.core.exception;

/**
 * Thrown when a referenced thing does not exist: an unknown timezone id,
 * a missing canonical activity. The row is skipped and tagged, never fatal.
 */
public class LookupException extends ResolutionException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
