package com.janitor.dispatch;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Run-wide counters, mutated under one lock.
 */
public final class Counters {

    public static final String RESOURCES_PROCESSED = "resources-processed";

    private final Map<String, Integer> values = new HashMap<>();

    public synchronized void increment(String name) {
        values.merge(name, 1, Integer::sum);
    }

    public synchronized int get(String name) {
        return values.getOrDefault(name, 0);
    }

    /**
     * Copy of all counters ordered by name.
     */
    public synchronized Map<String, Integer> snapshot() {
        return new TreeMap<>(values);
    }
}
