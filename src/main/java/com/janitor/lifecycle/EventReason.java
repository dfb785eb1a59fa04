package com.janitor.lifecycle;

/**
 * Reasons of the events recorded against objects.
 */
public enum EventReason {
    TTL_EXPIRED("TTLExpired"),
    RULE_TTL_EXPIRED("RuleTTLExpired"),
    EXPIRY_TIME_REACHED("ExpiryTimeReached"),
    DELETE_NOTIFICATION("DeleteNotification");

    private final String value;

    EventReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
