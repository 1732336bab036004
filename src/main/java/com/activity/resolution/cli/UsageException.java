package com.activity.resolution.cli;

/**
 * Bad command line. The CLI prints the message with the usage text and exits with code 2.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
