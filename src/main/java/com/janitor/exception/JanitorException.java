package com.janitor.exception;

/**
 * Base exception for the janitor.
 */
public class JanitorException extends RuntimeException {

    public JanitorException(String message) {
        super(message);
    }

    public JanitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
