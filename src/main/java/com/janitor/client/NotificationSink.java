package com.janitor.client;

/**
 * Outbound delivery of deletion notices.
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * Deliver a message.
     *
     * @throws com.janitor.exception.TransportException if delivery fails
     */
    void send(String message);

    /**
     * Sink used when no endpoint is configured.
     */
    static NotificationSink noop() {
        return message -> { };
    }
}
