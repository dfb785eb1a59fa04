package com.janitor.exception;

/**
 * Exception thrown when a call to the cluster API or a notification endpoint fails.
 */
public class TransportException extends JanitorException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
