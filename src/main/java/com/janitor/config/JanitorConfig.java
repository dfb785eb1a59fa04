package com.janitor.config;

import com.janitor.exception.ConfigurationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Validated runtime configuration.
 *
 * @param dryRun                   Log mutations instead of performing them
 * @param quiet                    Demote per-resource info lines and skip the run summary
 * @param once                     Run a single cleanup pass and exit
 * @param interval                 Pause between passes
 * @param waitAfterDelete          Pause after each real delete
 * @param deleteNotification       Notify-ahead window; zero disables notifications
 * @param includeResources         Resource plurals to process, or "all"
 * @param excludeResources         Resource plurals to skip
 * @param includeNamespaces        Namespaces to process, or "all"
 * @param excludeNamespaces        Namespaces to skip
 * @param rulesFile                Rules document path, null for no rules
 * @param deploymentTimeAnnotation Annotation holding an alternative deployment time, null for none
 * @param includeClusterResources  Process cluster-scoped objects other than namespaces
 * @param parallelism              Worker count
 * @param queueCapacity            Bound of the dispatcher work queue
 * @param resourceContextHook      Name of the context hook, null for none
 * @param webhookUrl               Notification webhook, null for none
 * @param contextName              Prefix for notification messages, null for none
 */
public record JanitorConfig(
        boolean dryRun,
        boolean quiet,
        boolean once,
        Duration interval,
        Duration waitAfterDelete,
        Duration deleteNotification,
        List<String> includeResources,
        List<String> excludeResources,
        List<String> includeNamespaces,
        List<String> excludeNamespaces,
        String rulesFile,
        String deploymentTimeAnnotation,
        boolean includeClusterResources,
        int parallelism,
        int queueCapacity,
        String resourceContextHook,
        String webhookUrl,
        String contextName
) {

    public static final String ALL = "all";

    public static final int MAX_QUEUE_CAPACITY = 1_000_000;

    public static final int MAX_PARALLELISM = 1024;

    public static Builder builder() {
        return new Builder();
    }

    public boolean notificationsEnabled() {
        return !deleteNotification.isZero();
    }

    /**
     * Split a comma-separated list, dropping blanks.
     */
    public static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Builder with the command-line defaults of the janitor.
     */
    public static final class Builder {
        private boolean dryRun;
        private boolean quiet;
        private boolean once;
        private int intervalSeconds = 30;
        private int waitAfterDeleteSeconds;
        private int deleteNotificationSeconds;
        private List<String> includeResources = List.of(ALL);
        private List<String> excludeResources = List.of("events", "controllerrevisions", "endpoints");
        private List<String> includeNamespaces = List.of(ALL);
        private List<String> excludeNamespaces = List.of("kube-system");
        private String rulesFile;
        private String deploymentTimeAnnotation;
        private boolean includeClusterResources;
        private int parallelism;
        private int queueCapacity = 1000;
        private String resourceContextHook;
        private String webhookUrl;
        private String contextName;

        private Builder() {
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder quiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Builder once(boolean once) {
            this.once = once;
            return this;
        }

        public Builder intervalSeconds(int intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        public Builder waitAfterDeleteSeconds(int waitAfterDeleteSeconds) {
            this.waitAfterDeleteSeconds = waitAfterDeleteSeconds;
            return this;
        }

        public Builder deleteNotificationSeconds(int deleteNotificationSeconds) {
            this.deleteNotificationSeconds = deleteNotificationSeconds;
            return this;
        }

        public Builder includeResources(List<String> includeResources) {
            this.includeResources = includeResources;
            return this;
        }

        public Builder excludeResources(List<String> excludeResources) {
            this.excludeResources = excludeResources;
            return this;
        }

        public Builder includeNamespaces(List<String> includeNamespaces) {
            this.includeNamespaces = includeNamespaces;
            return this;
        }

        public Builder excludeNamespaces(List<String> excludeNamespaces) {
            this.excludeNamespaces = excludeNamespaces;
            return this;
        }

        public Builder rulesFile(String rulesFile) {
            this.rulesFile = rulesFile;
            return this;
        }

        public Builder deploymentTimeAnnotation(String deploymentTimeAnnotation) {
            this.deploymentTimeAnnotation = deploymentTimeAnnotation;
            return this;
        }

        public Builder includeClusterResources(boolean includeClusterResources) {
            this.includeClusterResources = includeClusterResources;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder resourceContextHook(String resourceContextHook) {
            this.resourceContextHook = resourceContextHook;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder contextName(String contextName) {
            this.contextName = contextName;
            return this;
        }

        /**
         * Validate and build.
         *
         * @throws ConfigurationException if a value is out of range
         */
        public JanitorConfig build() {
            if (intervalSeconds < 1) {
                throw new ConfigurationException("interval must be at least 1 second, got " + intervalSeconds);
            }
            if (waitAfterDeleteSeconds < 0) {
                throw new ConfigurationException("wait-after-delete must not be negative, got " + waitAfterDeleteSeconds);
            }
            if (deleteNotificationSeconds < 0) {
                throw new ConfigurationException("delete-notification must not be negative, got " + deleteNotificationSeconds);
            }
            if (parallelism < 0 || parallelism > MAX_PARALLELISM) {
                throw new ConfigurationException("parallelism must be between 0 and " + MAX_PARALLELISM
                        + ", got " + parallelism);
            }
            if (queueCapacity < 1 || queueCapacity > MAX_QUEUE_CAPACITY) {
                throw new ConfigurationException("queue-capacity must be between 1 and " + MAX_QUEUE_CAPACITY
                        + ", got " + queueCapacity);
            }

            int workers = parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;

            return new JanitorConfig(
                    dryRun,
                    quiet,
                    once,
                    Duration.ofSeconds(intervalSeconds),
                    Duration.ofSeconds(waitAfterDeleteSeconds),
                    Duration.ofSeconds(deleteNotificationSeconds),
                    List.copyOf(includeResources),
                    List.copyOf(excludeResources),
                    List.copyOf(includeNamespaces),
                    List.copyOf(excludeNamespaces),
                    blankToNull(rulesFile),
                    blankToNull(deploymentTimeAnnotation),
                    includeClusterResources,
                    workers,
                    queueCapacity,
                    blankToNull(resourceContextHook),
                    blankToNull(webhookUrl),
                    blankToNull(contextName)
            );
        }
    }
}
