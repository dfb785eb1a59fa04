package com.janitor.time;

import java.time.Duration;
import java.util.Objects;

/**
 * A parsed time-to-live: either a finite, non-negative duration or {@link #FOREVER}.
 *
 * @param raw      The string the value was parsed from
 * @param duration The duration, or null for {@link #FOREVER}
 */
public record Ttl(String raw, Duration duration) {

    /**
     * Sentinel meaning "never expires".
     */
    public static final Ttl FOREVER = new Ttl(TimeRules.FOREVER, null);

    public static Ttl of(String raw, Duration duration) {
        return new Ttl(raw, Objects.requireNonNull(duration, "duration"));
    }

    public boolean isForever() {
        return duration == null;
    }

    @Override
    public String toString() {
        return raw;
    }
}
