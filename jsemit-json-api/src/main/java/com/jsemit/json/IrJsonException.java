package com.jsemit.json;

/**
 * Exception thrown when IR JSON serialization or deserialization fails.
 */
public class IrJsonException extends RuntimeException {

    public IrJsonException(String message) {
        super(message);
    }

    public IrJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
