package com.activity.resolution.core.exception;

/**
 * Thrown when a timestamp or numeric field cannot be parsed.
 * The offending row is skipped and counted; the run continues.
 */
public class ValueParseException extends ResolutionException {

    private final String rawValue;

    public ValueParseException(String message, String rawValue) {
        super(message);
        this.rawValue = rawValue;
    }

    public ValueParseException(String message, String rawValue, Throwable cause) {
        super(message, cause);
        this.rawValue = rawValue;
    }

    /**
     * Returns the raw text that failed to parse, for replay.
     */
    public String getRawValue() {
        return rawValue;
    }
}
