package com.janitor.exception;

/**
 * Exception thrown when configuration, the rules document or a hook name is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends JanitorException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
