package com.janitor.context;

import com.janitor.context.hook.RandomDiceHook;
import com.janitor.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name to {@link ContextHook} table. The configured hook is resolved once at startup.
 */
public final class HookRegistry {

    private final Map<String, ContextHook> hooks;

    public HookRegistry(Map<String, ContextHook> hooks) {
        this.hooks = Collections.unmodifiableMap(new LinkedHashMap<>(hooks));
    }

    /**
     * Registry with the built-in hooks.
     */
    public static HookRegistry builtin() {
        Map<String, ContextHook> hooks = new LinkedHashMap<>();
        hooks.put(RandomDiceHook.NAME, new RandomDiceHook());
        return new HookRegistry(hooks);
    }

    /**
     * Resolve a hook by name.
     *
     * @param name Hook name; null or blank means no hook
     * @return The hook, or empty when no name is given
     * @throws ConfigurationException if the name is not registered
     */
    public Optional<ContextHook> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        ContextHook hook = hooks.get(name);
        if (hook == null) {
            throw new ConfigurationException("Resource context hook '" + name + "' not found. Available: "
                    + hooks.keySet());
        }
        return Optional.of(hook);
    }

    public Set<String> names() {
        return hooks.keySet();
    }
}
