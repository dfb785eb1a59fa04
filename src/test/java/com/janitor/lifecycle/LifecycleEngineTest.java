package com.janitor.lifecycle;

import com.janitor.client.FakeClusterClient;
import com.janitor.client.LifecycleEvent;
import com.janitor.client.NotificationSink;
import com.janitor.config.JanitorConfig;
import com.janitor.context.ContextProvider;
import com.janitor.context.RunCache;
import com.janitor.exception.TransportException;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceFixtures;
import com.janitor.model.ResourceTypeDescriptor;
import com.janitor.rule.Rule;
import com.janitor.rule.RuleDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lifecycle decisions and their side effects.
 */
class LifecycleEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private FakeClusterClient client;
    private List<String> notifications;
    private NotificationSink sink;
    private ContextProvider noContext;

    @BeforeEach
    void setUp() {
        client = new FakeClusterClient();
        notifications = Collections.synchronizedList(new ArrayList<>());
        sink = notifications::add;
        noContext = (resource, cache) -> Map.of();
    }

    // =====================================================================
    // TTL annotation
    // =====================================================================

    @Test
    @DisplayName("Object older than its TTL is deleted")
    void expiredTtlDeletes() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(Markers.TTL, "1h"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        Decision.Expired expired = assertInstanceOf(Decision.Expired.class, outcome.decision());
        assertEquals(NOW.minus(Duration.ofHours(1)), expired.expiresAt());
        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
        assertEquals(List.of("deployments-deleted"), outcome.increments());

        LifecycleEvent event = client.getEvents().get(0);
        assertEquals(EventReason.TTL_EXPIRED.value(), event.reason());
        assertEquals("Deployment default/web expired on 2024-05-01T09:00:00Z and will be deleted "
                + "(TTL 1h from 2024-05-01T08:00:00Z)", event.message());
        assertEquals(NOW, event.timestamp());
    }

    @Test
    @DisplayName("Object younger than its TTL is kept")
    void liveTtlKeeps() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(30)), Map.of(Markers.TTL, "1h"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertTrue(outcome.increments().isEmpty());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Expiry exactly at the current instant deletes")
    void expiryBoundaryDeletes() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(1)), Map.of(Markers.TTL, "1h"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
    }

    @Test
    @DisplayName("forever is never expired")
    void foreverNeverExpires() {
        KubeResource resource = addDeployment("web", Instant.parse("2000-01-01T00:00:00Z"),
                Map.of(Markers.TTL, "forever"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Invalid TTL annotation is ignored")
    void invalidTtlIgnored() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofDays(10)), Map.of(Markers.TTL, "7x"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Deployment time annotation replaces the creation time")
    void deploymentTimeAnnotation() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(
                Markers.TTL, "1h",
                "deployment-time", "2024-05-01T09:50:00Z"));

        LifecycleOutcome outcome = engine(config().deploymentTimeAnnotation("deployment-time").build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
    }

    @Test
    @DisplayName("Unparseable deployment time falls back to the creation time")
    void invalidDeploymentTimeFallsBack() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(
                Markers.TTL, "1h",
                "deployment-time", "yesterday"));

        LifecycleOutcome outcome = engine(config().deploymentTimeAnnotation("deployment-time").build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
    }

    // =====================================================================
    // Rules
    // =====================================================================

    @Test
    @DisplayName("First matching rule wins")
    void firstMatchingRuleWins() {
        List<Rule> rules = List.of(
                rule("short-lived", "1h"),
                rule("long-lived", "10d"));
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(), Map.of("env", "test"));

        LifecycleOutcome outcome = engine(config().build(), rules).process(resource, new RunCache());

        Decision.Expired expired = assertInstanceOf(Decision.Expired.class, outcome.decision());
        assertTrue(expired.reason().startsWith("rule short-lived, TTL 1h"));
        assertEquals(EventReason.RULE_TTL_EXPIRED.value(), client.getEvents().get(0).reason());
    }

    @Test
    @DisplayName("Rule order decides when several rules match")
    void ruleOrderMatters() {
        List<Rule> rules = List.of(
                rule("long-lived", "10d"),
                rule("short-lived", "1h"));
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(), Map.of("env", "test"));

        LifecycleOutcome outcome = engine(config().build(), rules).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("TTL annotation takes precedence over rules")
    void annotationBeatsRules() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(Markers.TTL, "10d"),
                Map.of("env", "test"));

        LifecycleOutcome outcome = engine(config().build(), List.of(rule("short-lived", "1h")))
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
    }

    @Test
    @DisplayName("Rule context failure is treated as an empty context")
    void contextFailureIsEmptyContext() {
        Rule contextRule = Rule.compile(new RuleDefinition("by-context", List.of("*"), "_context.flag", "1h"));
        ContextProvider failing = (resource, cache) -> {
            throw new TransportException("cluster unavailable");
        };
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of());

        LifecycleEngine engine = new LifecycleEngine(client, sink, failing, List.of(contextRule), config().build(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        LifecycleOutcome outcome = engine.process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
    }

    // =====================================================================
    // Absolute expiry
    // =====================================================================

    @Test
    @DisplayName("Past expiry annotation deletes")
    void pastExpiryDeletes() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(5)),
                Map.of(Markers.EXPIRES, "2024-05-01T09:00:00Z"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
        assertEquals(EventReason.EXPIRY_TIME_REACHED.value(), client.getEvents().get(0).reason());
        assertTrue(client.getEvents().get(0).message().contains("expired on 2024-05-01T09:00:00Z"));
        assertEquals(List.of("deployments-deleted"), outcome.increments());
    }

    @Test
    @DisplayName("Future expiry annotation keeps")
    void futureExpiryKeeps() {
        KubeResource resource = addDeployment("web", NOW, Map.of(Markers.EXPIRES, "2024-05-02"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Invalid expiry annotation is ignored")
    void invalidExpiryIgnored() {
        KubeResource resource = addDeployment("web", NOW, Map.of(Markers.EXPIRES, "next tuesday"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
    }

    @Test
    @DisplayName("Both branches expiring delete once and count once")
    void bothBranchesCountOnce() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(
                Markers.TTL, "1h",
                Markers.EXPIRES, "2024-05-01T09:00:00Z"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
        assertEquals(List.of("deployments-deleted"), outcome.increments());
        assertEquals(2, client.getEvents().size());
    }

    // =====================================================================
    // Notifications
    // =====================================================================

    @Test
    @DisplayName("Inside the notification window a notice is sent once")
    void notifiesInsideWindow() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(90)), Map.of(Markers.TTL, "2h"));
        JanitorConfig config = config().deleteNotificationSeconds(3600).contextName("prod").build();

        LifecycleOutcome outcome = engine(config).process(resource, new RunCache());

        Decision.NotifyPending pending = assertInstanceOf(Decision.NotifyPending.class, outcome.decision());
        assertEquals(NOW.plus(Duration.ofMinutes(30)), pending.expiresAt());
        assertEquals(List.of("deployments-notified"), outcome.increments());
        assertEquals(List.of("[prod] Deployment default/web will be deleted at 2024-05-01T10:30:00Z "
                + "(TTL 2h from 2024-05-01T08:30:00Z)"), notifications);
        assertEquals(EventReason.DELETE_NOTIFICATION.value(), client.getEvents().get(0).reason());
        assertEquals(List.of(resource.getIdentity() + " janitor/notified=yes"), client.getAnnotations());
        assertTrue(client.getDeleted().isEmpty());
        assertEquals("yes", resource.getAnnotation(Markers.NOTIFIED));
    }

    @Test
    @DisplayName("Already notified objects are not notified again")
    void doesNotNotifyTwice() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(90)), Map.of(
                Markers.TTL, "2h",
                Markers.NOTIFIED, "yes"));

        LifecycleOutcome outcome = engine(config().deleteNotificationSeconds(3600).build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertTrue(notifications.isEmpty());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Before the notification window nothing is sent")
    void noNoticeBeforeWindow() {
        KubeResource resource = addDeployment("web", NOW, Map.of(Markers.TTL, "1d"));

        LifecycleOutcome outcome = engine(config().deleteNotificationSeconds(3600).build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Both branches in the window produce one notice")
    void oneNoticeForBothBranches() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(90)), Map.of(
                Markers.TTL, "2h",
                Markers.EXPIRES, "2024-05-01T10:45:00Z"));

        LifecycleOutcome outcome = engine(config().deleteNotificationSeconds(3600).build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.NOTIFY_PENDING, outcome.decision().getType());
        assertEquals(1, notifications.size());
        assertEquals(List.of("deployments-notified"), outcome.increments());
    }

    @Test
    @DisplayName("Webhook failure still marks the object notified")
    void webhookFailureStillAnnotates() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(90)), Map.of(Markers.TTL, "2h"));
        NotificationSink failing = message -> {
            throw new TransportException("webhook unavailable");
        };
        LifecycleEngine engine = new LifecycleEngine(client, failing, noContext, List.of(),
                config().deleteNotificationSeconds(3600).build(), Clock.fixed(NOW, ZoneOffset.UTC));

        LifecycleOutcome outcome = engine.process(resource, new RunCache());

        assertEquals(Decision.DecisionType.NOTIFY_PENDING, outcome.decision().getType());
        assertEquals(1, client.getAnnotations().size());
    }

    // =====================================================================
    // Dry run and failures
    // =====================================================================

    @Test
    @DisplayName("Dry run performs no mutations but still counts")
    void dryRunCountsWithoutMutating() {
        KubeResource expired = addDeployment("old", NOW.minus(Duration.ofHours(2)), Map.of(Markers.TTL, "1h"));
        KubeResource expiring = addDeployment("soon", NOW.minus(Duration.ofMinutes(90)), Map.of(Markers.TTL, "2h"));
        LifecycleEngine engine = engine(config().dryRun(true).deleteNotificationSeconds(3600).build());

        LifecycleOutcome deleted = engine.process(expired, new RunCache());
        LifecycleOutcome notified = engine.process(expiring, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, deleted.decision().getType());
        assertEquals(List.of("deployments-deleted"), deleted.increments());
        assertEquals(Decision.DecisionType.NOTIFY_PENDING, notified.decision().getType());
        assertEquals(List.of("deployments-notified"), notified.increments());
        assertFalse(client.hasMutations());
        assertTrue(notifications.isEmpty());
    }

    @Test
    @DisplayName("Event failure does not prevent the delete")
    void eventFailureStillDeletes() {
        client.failEvents();
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(Markers.TTL, "1h"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
        assertEquals(List.of("deployments-deleted"), outcome.increments());
    }

    @Test
    @DisplayName("Deleting an object that is already gone is not counted")
    void alreadyDeletedNotCounted() {
        KubeResource resource = ResourceFixtures.resource(ResourceTypeDescriptor.DEPLOYMENTS,
                ResourceFixtures.deployment("default", "gone", NOW.minus(Duration.ofHours(2)), Map.of(Markers.TTL, "1h")));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
        assertTrue(outcome.increments().isEmpty());
    }

    @Test
    @DisplayName("Object without creation time is kept")
    void missingCreationTimeKeeps() {
        KubeResource resource = addDeployment("web", null, Map.of(Markers.TTL, "1h"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
    }

    // =====================================================================
    // Branch isolation
    // =====================================================================

    @Test
    @DisplayName("TTL beyond the time range is unlimited and the expiry annotation still deletes")
    void hugeTtlStillHonoursExpiry() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)), Map.of(
                Markers.TTL, "99999999999999999s",
                Markers.EXPIRES, "2024-05-01T09:00:00Z"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        Decision.Expired expired = assertInstanceOf(Decision.Expired.class, outcome.decision());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), expired.expiresAt());
        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
        assertEquals(List.of("deployments-deleted"), outcome.increments());
    }

    @Test
    @DisplayName("Huge TTL alone keeps the object")
    void hugeTtlKeeps() {
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofHours(2)),
                Map.of(Markers.TTL, "99999999999999999s"));

        LifecycleOutcome outcome = engine(config().build()).process(resource, new RunCache());

        assertEquals(Decision.DecisionType.ALIVE, outcome.decision().getType());
        assertFalse(client.hasMutations());
    }

    @Test
    @DisplayName("Failing context hook does not stop the expiry annotation")
    void hookFailureStillHonoursExpiry() {
        Rule contextRule = Rule.compile(new RuleDefinition("by-context", List.of("*"), "_context.flag", "1h"));
        ContextProvider broken = (resource, cache) -> {
            throw new IllegalStateException("hook exploded");
        };
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(10)),
                Map.of(Markers.EXPIRES, "2024-05-01T09:00:00Z"));

        LifecycleEngine engine = new LifecycleEngine(client, sink, broken, List.of(contextRule), config().build(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        LifecycleOutcome outcome = engine.process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
    }

    @Test
    @DisplayName("Failed notification marker keeps earlier counts and the expiry branch runs")
    void annotateFailureKeepsIncrements() {
        client.failAnnotations();
        KubeResource resource = addDeployment("web", NOW.minus(Duration.ofMinutes(50)), Map.of(
                Markers.TTL, "1h",
                Markers.EXPIRES, "2024-05-01T09:00:00Z"));

        LifecycleOutcome outcome = engine(config().deleteNotificationSeconds(1800).build())
                .process(resource, new RunCache());

        assertEquals(Decision.DecisionType.EXPIRED, outcome.decision().getType());
        assertEquals(List.of(resource.getIdentity()), client.getDeleted());
        assertEquals(List.of("deployments-notified", "deployments-deleted"), outcome.increments());
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private static JanitorConfig.Builder config() {
        return JanitorConfig.builder().parallelism(1);
    }

    private LifecycleEngine engine(JanitorConfig config) {
        return engine(config, List.of());
    }

    private LifecycleEngine engine(JanitorConfig config, List<Rule> rules) {
        return new LifecycleEngine(client, sink, noContext, rules, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Rule rule(String id, String ttl) {
        return Rule.compile(new RuleDefinition(id, List.of("deployments"), "metadata.labels.env == 'test'", ttl));
    }

    private KubeResource addDeployment(String name, Instant created, Map<String, String> annotations) {
        return addDeployment(name, created, annotations, Map.of());
    }

    private KubeResource addDeployment(String name, Instant created, Map<String, String> annotations,
                                       Map<String, String> labels) {
        return client.add(ResourceTypeDescriptor.DEPLOYMENTS, ResourceFixtures.document(
                ResourceTypeDescriptor.DEPLOYMENTS, "default", name, created, annotations, labels));
    }
}
