package com.janitor.context;

import com.janitor.model.KubeResource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Merges built-in analysis with the configured hook; hook facts overwrite built-in ones.
 */
public class DefaultContextProvider implements ContextProvider {

    private final PersistentVolumeClaimAnalyzer claimAnalyzer;
    private final ContextHook hook;

    public DefaultContextProvider(PersistentVolumeClaimAnalyzer claimAnalyzer, Optional<ContextHook> hook) {
        this.claimAnalyzer = claimAnalyzer;
        this.hook = hook.orElse(null);
    }

    @Override
    public Map<String, Object> getContext(KubeResource resource, RunCache cache) {
        Map<String, Object> context = new LinkedHashMap<>();

        if (claimAnalyzer.supports(resource)) {
            context.putAll(claimAnalyzer.analyze(resource));
        }

        if (hook != null) {
            Map<String, Object> facts = hook.compute(resource, cache);
            if (facts != null) {
                context.putAll(facts);
            }
        }
        return context;
    }
}
