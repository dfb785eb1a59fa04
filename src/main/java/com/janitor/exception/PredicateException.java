package com.janitor.exception;

/**
 * Exception thrown when a predicate fails to compile or to evaluate.
 */
public class PredicateException extends JanitorException {

    public PredicateException(String message) {
        super(message);
    }

    public PredicateException(String message, Throwable cause) {
        super(message, cause);
    }
}
