package com.janitor.lifecycle;

/**
 * Annotations the janitor reads and writes.
 */
public final class Markers {

    public static final String TTL = "janitor/ttl";
    public static final String EXPIRES = "janitor/expires";
    public static final String NOTIFIED = "janitor/notified";
    public static final String NOTIFIED_VALUE = "yes";

    private Markers() {
    }
}
