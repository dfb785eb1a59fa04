package com.janitor.context.hook;

import com.janitor.context.ContextHook;
import com.janitor.context.RunCache;
import com.janitor.model.KubeResource;

import java.util.Map;
import java.util.Random;

/**
 * Sets {@code random_dice} to a dice value (1-6), rolled once per run.
 */
public class RandomDiceHook implements ContextHook {

    public static final String NAME = "random_dice";
    public static final String CACHE_KEY = "random_dice";

    private final Random random;

    public RandomDiceHook() {
        this(new Random());
    }

    public RandomDiceHook(Random random) {
        this.random = random;
    }

    @Override
    public Map<String, Object> compute(KubeResource resource, RunCache cache) {
        Integer dice = cache.computeIfAbsent(CACHE_KEY, () -> random.nextInt(6) + 1);
        return Map.of(NAME, dice);
    }
}
