package com.janitor.context;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Memoization scope for one cleanup run, shared by all workers.
 * <p>
 * Values are write-once: the first writer for a key wins and later callers see the cached
 * value without recomputing it. Created at run start and discarded at run end.
 */
public final class RunCache {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    /**
     * Return the cached value for the key, computing and storing it on first access.
     */
    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(String key, Supplier<T> supplier) {
        return (T) values.computeIfAbsent(key, k -> supplier.get());
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public int size() {
        return values.size();
    }
}
