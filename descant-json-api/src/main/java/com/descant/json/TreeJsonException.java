package com.descant.json;

/**
 * Exception thrown when JSON serialization or deserialization fails.
 */
public class TreeJsonException extends RuntimeException {

    public TreeJsonException(String message) {
        super(message);
    }

    public TreeJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
