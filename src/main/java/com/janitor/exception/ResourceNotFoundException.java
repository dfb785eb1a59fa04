package com.janitor.exception;

/**
 * Thrown when the cluster reports that the addressed object does not exist.
 */
public class ResourceNotFoundException extends TransportException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
