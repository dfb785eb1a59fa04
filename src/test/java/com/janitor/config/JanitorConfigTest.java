package com.janitor.config;

import com.janitor.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for configuration defaults and validation.
 */
class JanitorConfigTest {

    @Test
    @DisplayName("Defaults match the documented command-line defaults")
    void defaults() {
        JanitorConfig config = JanitorConfig.builder().build();

        assertFalse(config.dryRun());
        assertFalse(config.once());
        assertEquals(Duration.ofSeconds(30), config.interval());
        assertEquals(Duration.ZERO, config.waitAfterDelete());
        assertFalse(config.notificationsEnabled());
        assertEquals(List.of("all"), config.includeResources());
        assertEquals(List.of("events", "controllerrevisions", "endpoints"), config.excludeResources());
        assertEquals(List.of("all"), config.includeNamespaces());
        assertEquals(List.of("kube-system"), config.excludeNamespaces());
        assertNull(config.rulesFile());
        assertFalse(config.includeClusterResources());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.parallelism());
        assertEquals(1000, config.queueCapacity());
    }

    @Test
    @DisplayName("Blank optional values become absent")
    void blankValuesAreAbsent() {
        JanitorConfig config = JanitorConfig.builder()
                .rulesFile("")
                .webhookUrl("  ")
                .contextName("")
                .resourceContextHook("")
                .deploymentTimeAnnotation(" ")
                .build();

        assertNull(config.rulesFile());
        assertNull(config.webhookUrl());
        assertNull(config.contextName());
        assertNull(config.resourceContextHook());
        assertNull(config.deploymentTimeAnnotation());
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void rejectsOutOfRange() {
        assertThrows(ConfigurationException.class, () -> JanitorConfig.builder().intervalSeconds(0).build());
        assertThrows(ConfigurationException.class, () -> JanitorConfig.builder().waitAfterDeleteSeconds(-1).build());
        assertThrows(ConfigurationException.class, () -> JanitorConfig.builder().deleteNotificationSeconds(-1).build());
        assertThrows(ConfigurationException.class, () -> JanitorConfig.builder().parallelism(-1).build());
        assertThrows(ConfigurationException.class, () -> JanitorConfig.builder().queueCapacity(0).build());
        assertThrows(ConfigurationException.class,
                () -> JanitorConfig.builder().queueCapacity(Integer.MAX_VALUE).parallelism(4).build());
        assertThrows(ConfigurationException.class,
                () -> JanitorConfig.builder().queueCapacity(JanitorConfig.MAX_QUEUE_CAPACITY + 1).build());
        assertThrows(ConfigurationException.class,
                () -> JanitorConfig.builder().parallelism(JanitorConfig.MAX_PARALLELISM + 1).build());
        assertEquals(JanitorConfig.MAX_QUEUE_CAPACITY, JanitorConfig.builder()
                .queueCapacity(JanitorConfig.MAX_QUEUE_CAPACITY).build().queueCapacity());
    }

    @Test
    @DisplayName("Comma-separated lists are trimmed and blanks dropped")
    void splitsLists() {
        assertEquals(List.of("deployments", "statefulsets"), JanitorConfig.splitList(" deployments, ,statefulsets "));
        assertEquals(List.of(), JanitorConfig.splitList(""));
        assertEquals(List.of(), JanitorConfig.splitList(null));
    }

    @Test
    @DisplayName("Properties convert to a validated configuration")
    void convertsProperties() {
        JanitorProperties properties = new JanitorProperties();
        properties.setDryRun(true);
        properties.setInterval(60);
        properties.setDeleteNotification(3600);
        properties.setIncludeResources("deployments,statefulsets");
        properties.setExcludeNamespaces("kube-system,kube-public");
        properties.setParallelism(4);

        JanitorConfig config = properties.toConfig();

        assertTrue(config.dryRun());
        assertEquals(Duration.ofMinutes(1), config.interval());
        assertEquals(Duration.ofHours(1), config.deleteNotification());
        assertTrue(config.notificationsEnabled());
        assertEquals(List.of("deployments", "statefulsets"), config.includeResources());
        assertEquals(List.of("kube-system", "kube-public"), config.excludeNamespaces());
        assertEquals(4, config.parallelism());
    }
}
