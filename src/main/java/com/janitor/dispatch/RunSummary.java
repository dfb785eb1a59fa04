package com.janitor.dispatch;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Counters of a completed run.
 *
 * @param counters Counter values ordered by name
 * @param cancelled Whether the run stopped early on shutdown
 */
public record RunSummary(Map<String, Integer> counters, boolean cancelled) {

    public RunSummary {
        counters = new TreeMap<>(counters);
    }

    public int get(String name) {
        return counters.getOrDefault(name, 0);
    }

    /**
     * e.g. "Clean up run completed: deployments-deleted=1, resources-processed=12"
     */
    public String format() {
        return "Clean up run completed: " + counters.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
