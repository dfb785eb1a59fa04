package com.janitor.lifecycle;

import com.janitor.client.ClusterClient;
import com.janitor.client.LifecycleEvent;
import com.janitor.client.NotificationSink;
import com.janitor.config.JanitorConfig;
import com.janitor.context.ContextProvider;
import com.janitor.context.RunCache;
import com.janitor.exception.InvalidFormatException;
import com.janitor.exception.ResourceNotFoundException;
import com.janitor.exception.TransportException;
import com.janitor.model.KubeResource;
import com.janitor.rule.Rule;
import com.janitor.time.TimeRules;
import com.janitor.time.Ttl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides, for one resource, whether it is alive, due for a deletion notice or expired,
 * and performs the resulting event, notification and delete calls.
 * <p>
 * Two branches run for every resource:
 * <ol>
 *   <li>TTL: the {@code janitor/ttl} annotation, else the TTL of the first matching rule,
 *       counted from the deployment time</li>
 *   <li>Absolute expiry: the {@code janitor/expires} annotation</li>
 * </ol>
 * Both may delete the same object in one pass; the second delete is logged and not counted.
 * In dry-run mode every mutating call is replaced by a log line while counters are still
 * reported.
 * <p>
 * Thread-safe: holds only immutable state and may be shared by all workers.
 */
public class LifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEngine.class);

    static final String DRY_RUN_PREFIX = "**DRY-RUN**: ";

    private final ClusterClient client;
    private final NotificationSink notificationSink;
    private final ContextProvider contextProvider;
    private final List<Rule> rules;
    private final JanitorConfig config;
    private final Clock clock;

    public LifecycleEngine(ClusterClient client,
                           NotificationSink notificationSink,
                           ContextProvider contextProvider,
                           List<Rule> rules,
                           JanitorConfig config,
                           Clock clock) {
        this.client = client;
        this.notificationSink = notificationSink;
        this.contextProvider = contextProvider;
        this.rules = List.copyOf(rules);
        this.config = config;
        this.clock = clock;
    }

    /**
     * Evaluate a resource and apply the side effects of the decision.
     * <p>
     * A failure in one branch is logged and does not stop the other; counter increments
     * collected before the failure are kept.
     */
    public LifecycleOutcome process(KubeResource resource, RunCache cache) {
        Pass pass = new Pass(resource, clock.instant());

        Decision ttlDecision;
        try {
            ttlDecision = evaluateTtl(pass, cache);
        } catch (RuntimeException e) {
            log.warn("TTL evaluation failed for {}: {}", resource, e.getMessage(), e);
            ttlDecision = Decision.alive();
        }

        Decision expiryDecision;
        try {
            expiryDecision = evaluateExpiry(pass);
        } catch (RuntimeException e) {
            log.warn("Expiry evaluation failed for {}: {}", resource, e.getMessage(), e);
            expiryDecision = Decision.alive();
        }

        Decision decision = Decision.combine(ttlDecision, expiryDecision);
        log.debug("Decision for {}: {}", resource, decision);
        return new LifecycleOutcome(decision, pass.increments);
    }

    private Decision evaluateTtl(Pass pass, RunCache cache) {
        KubeResource resource = pass.resource;
        String annotated = resource.getAnnotation(Markers.TTL);

        Ttl ttl;
        Rule rule = null;
        if (annotated != null) {
            info("{} has TTL annotation: {}", resource, annotated);
            try {
                ttl = TimeRules.parseTtl(annotated);
            } catch (InvalidFormatException e) {
                log.warn("Invalid TTL on {}: {}", resource, e.getMessage());
                return Decision.alive();
            }
        } else {
            rule = firstMatchingRule(resource, cache);
            if (rule == null) {
                return Decision.alive();
            }
            info("Rule {} matched {}", rule.getId(), resource);
            ttl = rule.getTtl();
        }

        if (ttl.isForever()) {
            log.debug("{} has unlimited TTL, skipping", resource);
            return Decision.alive();
        }

        Instant deploymentTime = deploymentTime(resource);
        if (deploymentTime == null) {
            log.warn("{} has no creation timestamp, cannot apply TTL {}", resource, ttl);
            return Decision.alive();
        }

        Instant expiresAt;
        try {
            expiresAt = deploymentTime.plus(ttl.duration());
        } catch (DateTimeException | ArithmeticException e) {
            log.warn("TTL {} on {} is beyond the supported time range, treating as unlimited", ttl, resource);
            return Decision.alive();
        }
        String since = "TTL " + ttl + " from " + TimeRules.formatInstant(deploymentTime);
        String reason = rule != null ? "rule " + rule.getId() + ", " + since : since;
        info("{} expires at {}", resource, TimeRules.formatInstant(expiresAt));

        if (!pass.now.isBefore(expiresAt)) {
            String message = String.format("%s %s/%s expired on %s and will be deleted (%s)",
                    resource.getKind(), resource.getNamespace(), resource.getName(),
                    TimeRules.formatInstant(expiresAt), reason);
            EventReason eventReason = rule != null ? EventReason.RULE_TTL_EXPIRED : EventReason.TTL_EXPIRED;
            expire(pass, eventReason, message);
            return new Decision.Expired(reason, expiresAt);
        }

        return notifyIfDue(pass, reason, expiresAt);
    }

    private Decision evaluateExpiry(Pass pass) {
        KubeResource resource = pass.resource;
        String value = resource.getAnnotation(Markers.EXPIRES);
        if (value == null) {
            return Decision.alive();
        }

        Instant expiresAt;
        try {
            expiresAt = TimeRules.parseExpiry(value);
        } catch (InvalidFormatException e) {
            log.warn("Invalid expiry on {}: {}", resource, e.getMessage());
            return Decision.alive();
        }

        String reason = "annotation " + Markers.EXPIRES + " is set";
        if (!pass.now.isBefore(expiresAt)) {
            String message = String.format("%s %s/%s expired on %s and will be deleted (%s)",
                    resource.getKind(), resource.getNamespace(), resource.getName(), value, reason);
            expire(pass, EventReason.EXPIRY_TIME_REACHED, message);
            return new Decision.Expired(reason, expiresAt);
        }

        if (pass.deleted) {
            return Decision.alive();
        }
        return notifyIfDue(pass, reason, expiresAt);
    }

    private Rule firstMatchingRule(KubeResource resource, RunCache cache) {
        if (rules.isEmpty()) {
            return null;
        }

        Map<String, Object> context = contextFor(resource, cache);
        for (Rule rule : rules) {
            if (rule.matches(resource, context)) {
                return rule;
            }
        }
        return null;
    }

    private Map<String, Object> contextFor(KubeResource resource, RunCache cache) {
        try {
            return contextProvider.getContext(resource, cache);
        } catch (TransportException e) {
            log.warn("Failed to get context for {}: {}", resource, e.getMessage());
            return Map.of();
        }
    }

    private Instant deploymentTime(KubeResource resource) {
        String annotation = config.deploymentTimeAnnotation();
        if (annotation != null) {
            Instant deployed = TimeRules.parseRfc3339OrNull(resource.getAnnotation(annotation));
            if (deployed != null) {
                log.debug("Using deployment time from annotation {} for {}", annotation, resource);
                return deployed;
            }
        }
        return resource.getCreationTimestamp();
    }

    private Decision notifyIfDue(Pass pass, String reason, Instant expiresAt) {
        if (!config.notificationsEnabled()) {
            return Decision.alive();
        }

        Instant notifyAt = expiresAt.minus(config.deleteNotification());
        if (pass.now.isBefore(notifyAt)) {
            return Decision.alive();
        }
        if (pass.resource.hasAnnotation(Markers.NOTIFIED) || pass.notified) {
            return Decision.alive();
        }

        sendNotification(pass, reason, expiresAt);
        return new Decision.NotifyPending(reason, notifyAt, expiresAt);
    }

    private void sendNotification(Pass pass, String reason, Instant expiresAt) {
        KubeResource resource = pass.resource;
        pass.notified = true;
        pass.increments.add(resource.getTypeName() + "-notified");

        String prefix = config.contextName() != null ? "[" + config.contextName() + "] " : "";
        String message = String.format("%s%s %s/%s will be deleted at %s (%s)",
                prefix, resource.getKind(), resource.getNamespace(), resource.getName(),
                TimeRules.formatInstant(expiresAt), reason);

        if (config.dryRun()) {
            log.info(DRY_RUN_PREFIX + "Would send delete notification for {}: {}", resource, message);
            return;
        }

        info("Sending delete notification for {}", resource);
        createEvent(pass, EventReason.DELETE_NOTIFICATION, message);

        try {
            notificationSink.send(message);
        } catch (TransportException e) {
            log.warn("Failed to send webhook notification for {}: {}", resource, e.getMessage());
        }

        client.annotate(resource, Markers.NOTIFIED, Markers.NOTIFIED_VALUE);
        resource.markAnnotation(Markers.NOTIFIED, Markers.NOTIFIED_VALUE);
    }

    private void expire(Pass pass, EventReason reason, String message) {
        info("{}", message);
        createEvent(pass, reason, message);
        delete(pass);
    }

    private void createEvent(Pass pass, EventReason reason, String message) {
        if (config.dryRun()) {
            log.info(DRY_RUN_PREFIX + "Would create event: {}", message);
            return;
        }
        try {
            client.createEvent(new LifecycleEvent(pass.resource, reason.value(), message, pass.now));
        } catch (TransportException e) {
            log.warn("Failed to create {} event for {}: {}", reason, pass.resource, e.getMessage());
        }
    }

    private void delete(Pass pass) {
        KubeResource resource = pass.resource;
        boolean first = !pass.deleted;
        pass.deleted = true;

        if (config.dryRun()) {
            log.info(DRY_RUN_PREFIX + "Would delete {}", resource);
        } else {
            try {
                client.delete(resource);
            } catch (ResourceNotFoundException e) {
                log.warn("{} was already deleted: {}", resource, e.getMessage());
                return;
            }
            log.info("Deleted {}", resource);
            waitAfterDelete();
        }

        if (first) {
            pass.increments.add(resource.getTypeName() + "-deleted");
        }
    }

    private void waitAfterDelete() {
        if (config.waitAfterDelete().isZero()) {
            return;
        }
        info("Waiting {}s after delete", config.waitAfterDelete().getSeconds());
        try {
            Thread.sleep(config.waitAfterDelete().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting after delete");
        }
    }

    private void info(String format, Object... args) {
        if (config.quiet()) {
            log.debug(format, args);
        } else {
            log.info(format, args);
        }
    }

    /**
     * State of one evaluation.
     */
    private static final class Pass {
        private final KubeResource resource;
        private final Instant now;
        private final List<String> increments = new ArrayList<>();
        private boolean deleted;
        private boolean notified;

        private Pass(KubeResource resource, Instant now) {
            this.resource = resource;
            this.now = now;
        }
    }
}
