package com.janitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the janitor.
 */
@ConfigurationProperties(prefix = "janitor")
public class JanitorProperties {

    /**
     * Whether the janitor is enabled.
     */
    private boolean enabled = true;

    /**
     * Log mutations instead of performing them.
     */
    private boolean dryRun;

    /**
     * Demote per-resource log lines to DEBUG and skip the run summary.
     */
    private boolean quiet;

    /**
     * Run a single cleanup pass and exit.
     */
    private boolean once;

    /**
     * Seconds between cleanup passes.
     */
    private int interval = 30;

    /**
     * Seconds to wait after each delete.
     */
    private int waitAfterDelete;

    /**
     * Seconds before expiry to send a deletion notice; 0 disables notices.
     */
    private int deleteNotification;

    /**
     * Comma-separated resource plurals to process, or "all".
     */
    private String includeResources = "all";

    /**
     * Comma-separated resource plurals to skip.
     */
    private String excludeResources = "events,controllerrevisions,endpoints";

    /**
     * Comma-separated namespaces to process, or "all".
     */
    private String includeNamespaces = "all";

    /**
     * Comma-separated namespaces to skip.
     */
    private String excludeNamespaces = "kube-system";

    /**
     * Path to the rules file.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesFile;

    /**
     * Annotation holding the deployment time (RFC 3339), used instead of the creation time.
     */
    private String deploymentTimeAnnotation;

    /**
     * Also process cluster-scoped objects.
     */
    private boolean includeClusterResources;

    /**
     * Worker threads; 0 uses the number of available processors.
     */
    private int parallelism;

    /**
     * Capacity of the dispatcher work queue.
     */
    private int queueCapacity = 1000;

    /**
     * Name of the resource context hook.
     */
    private String resourceContextHook;

    /**
     * Webhook receiving deletion notices.
     */
    private String webhookUrl;

    /**
     * Cluster name prefixed to deletion notices.
     */
    private String contextName;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public void setQuiet(boolean quiet) {
        this.quiet = quiet;
    }

    public boolean isOnce() {
        return once;
    }

    public void setOnce(boolean once) {
        this.once = once;
    }

    public int getInterval() {
        return interval;
    }

    public void setInterval(int interval) {
        this.interval = interval;
    }

    public int getWaitAfterDelete() {
        return waitAfterDelete;
    }

    public void setWaitAfterDelete(int waitAfterDelete) {
        this.waitAfterDelete = waitAfterDelete;
    }

    public int getDeleteNotification() {
        return deleteNotification;
    }

    public void setDeleteNotification(int deleteNotification) {
        this.deleteNotification = deleteNotification;
    }

    public String getIncludeResources() {
        return includeResources;
    }

    public void setIncludeResources(String includeResources) {
        this.includeResources = includeResources;
    }

    public String getExcludeResources() {
        return excludeResources;
    }

    public void setExcludeResources(String excludeResources) {
        this.excludeResources = excludeResources;
    }

    public String getIncludeNamespaces() {
        return includeNamespaces;
    }

    public void setIncludeNamespaces(String includeNamespaces) {
        this.includeNamespaces = includeNamespaces;
    }

    public String getExcludeNamespaces() {
        return excludeNamespaces;
    }

    public void setExcludeNamespaces(String excludeNamespaces) {
        this.excludeNamespaces = excludeNamespaces;
    }

    public String getRulesFile() {
        return rulesFile;
    }

    public void setRulesFile(String rulesFile) {
        this.rulesFile = rulesFile;
    }

    public String getDeploymentTimeAnnotation() {
        return deploymentTimeAnnotation;
    }

    public void setDeploymentTimeAnnotation(String deploymentTimeAnnotation) {
        this.deploymentTimeAnnotation = deploymentTimeAnnotation;
    }

    public boolean isIncludeClusterResources() {
        return includeClusterResources;
    }

    public void setIncludeClusterResources(boolean includeClusterResources) {
        this.includeClusterResources = includeClusterResources;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public String getResourceContextHook() {
        return resourceContextHook;
    }

    public void setResourceContextHook(String resourceContextHook) {
        this.resourceContextHook = resourceContextHook;
    }

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public String getContextName() {
        return contextName;
    }

    public void setContextName(String contextName) {
        this.contextName = contextName;
    }

    /**
     * Convert to a validated {@link JanitorConfig}.
     *
     * @throws com.janitor.exception.ConfigurationException if a value is out of range
     */
    public JanitorConfig toConfig() {
        return JanitorConfig.builder()
                .dryRun(dryRun)
                .quiet(quiet)
                .once(once)
                .intervalSeconds(interval)
                .waitAfterDeleteSeconds(waitAfterDelete)
                .deleteNotificationSeconds(deleteNotification)
                .includeResources(JanitorConfig.splitList(includeResources))
                .excludeResources(JanitorConfig.splitList(excludeResources))
                .includeNamespaces(JanitorConfig.splitList(includeNamespaces))
                .excludeNamespaces(JanitorConfig.splitList(excludeNamespaces))
                .rulesFile(rulesFile)
                .deploymentTimeAnnotation(deploymentTimeAnnotation)
                .includeClusterResources(includeClusterResources)
                .parallelism(parallelism)
                .queueCapacity(queueCapacity)
                .resourceContextHook(resourceContextHook)
                .webhookUrl(webhookUrl)
                .contextName(contextName)
                .build();
    }
}
