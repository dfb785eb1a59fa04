package com.janitor.context;

import com.janitor.model.KubeResource;

import java.util.Map;

/**
 * Contributes facts about a resource to its evaluation context.
 * <p>
 * Called once per resource per run. Anything that should be computed at most once per run
 * belongs in the {@link RunCache}.
 */
@FunctionalInterface
public interface ContextHook {

    Map<String, Object> compute(KubeResource resource, RunCache cache);
}
