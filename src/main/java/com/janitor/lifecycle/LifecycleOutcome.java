package com.janitor.lifecycle;

import java.util.List;

/**
 * A decision together with the counter increments it caused.
 *
 * @param decision   Combined decision
 * @param increments Counter names to increment by one each
 */
public record LifecycleOutcome(Decision decision, List<String> increments) {

    public LifecycleOutcome {
        increments = List.copyOf(increments);
    }
}
