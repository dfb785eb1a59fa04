package com.janitor.exception;

/**
 * Exception thrown when a TTL or expiry value does not match a supported format.
 */
public class InvalidFormatException extends JanitorException {

    private final String value;

    public InvalidFormatException(String value, String message) {
        super(message);
        this.value = value;
    }

    /**
     * The offending input.
     */
    public String getValue() {
        return value;
    }
}
