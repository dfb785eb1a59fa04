package com.janitor.context;

import com.janitor.client.FakeClusterClient;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceFixtures;
import com.janitor.model.ResourceTypeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for merging built-in facts with hook facts.
 */
class DefaultContextProviderTest {

    private final FakeClusterClient client = new FakeClusterClient();

    @Test
    @DisplayName("Objects other than claims get an empty context without a hook")
    void emptyContext() {
        DefaultContextProvider provider = new DefaultContextProvider(
                new PersistentVolumeClaimAnalyzer(client), Optional.empty());

        assertTrue(provider.getContext(deployment(), new RunCache()).isEmpty());
        assertEquals(0, client.getListCalls());
    }

    @Test
    @DisplayName("Hook facts overwrite built-in facts")
    void hookOverwritesBuiltins() {
        ContextHook hook = (resource, cache) -> Map.of(PersistentVolumeClaimAnalyzer.NOT_MOUNTED, false, "owner", "ops");
        DefaultContextProvider provider = new DefaultContextProvider(
                new PersistentVolumeClaimAnalyzer(client), Optional.of(hook));
        KubeResource claim = ResourceFixtures.resource(ResourceFixtures.PERSISTENT_VOLUME_CLAIMS,
                ResourceFixtures.claim("default", "data"));

        Map<String, Object> context = provider.getContext(claim, new RunCache());

        assertEquals(false, context.get(PersistentVolumeClaimAnalyzer.NOT_MOUNTED));
        assertEquals(true, context.get(PersistentVolumeClaimAnalyzer.NOT_REFERENCED));
        assertEquals("ops", context.get("owner"));
    }

    private static KubeResource deployment() {
        return ResourceFixtures.resource(ResourceTypeDescriptor.DEPLOYMENTS,
                ResourceFixtures.deployment("default", "web", Instant.parse("2024-05-01T08:00:00Z"), Map.of()));
    }
}
