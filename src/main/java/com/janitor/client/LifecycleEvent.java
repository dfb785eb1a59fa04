package com.janitor.client;

import com.janitor.model.KubeResource;

import java.time.Instant;

/**
 * A lifecycle event to record against an object.
 *
 * @param involved  The object the event is about
 * @param reason    Short machine-readable reason, e.g. "TTLExpired"
 * @param message   Human-readable message
 * @param timestamp When the event occurred
 */
public record LifecycleEvent(KubeResource involved, String reason, String message, Instant timestamp) {

    public static final String GENERATE_NAME = "kube-janitor-";
    public static final String SOURCE_COMPONENT = "kube-janitor";
    public static final String TYPE_NORMAL = "Normal";
}
