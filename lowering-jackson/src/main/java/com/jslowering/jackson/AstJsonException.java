package com.jslowering.jackson;

/**
 * Exception thrown when a tree cannot be written to or read from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public AstJsonException(Throwable cause) {
        super(cause);
    }
}
