package com.activity.resolution.core.exception;

/**
 * Thrown when the store is not usable at all (missing table or column,
 * unreadable database). Fatal: the run halts before any mutation.
 */
public class SetupException extends ResolutionException {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
