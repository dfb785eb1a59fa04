package com.janitor.model;

/**
 * A deletable resource type advertised by the cluster API.
 *
 * @param group      API group, empty for the core group
 * @param version    API version, e.g. "v1"
 * @param kind       Kind, e.g. "Deployment"
 * @param plural     Plural resource name, e.g. "deployments"
 * @param namespaced Whether objects of this type live in a namespace
 */
public record ResourceTypeDescriptor(String group, String version, String kind, String plural, boolean namespaced) {

    public static final ResourceTypeDescriptor NAMESPACES =
            new ResourceTypeDescriptor("", "v1", "Namespace", "namespaces", false);
    public static final ResourceTypeDescriptor PODS =
            new ResourceTypeDescriptor("", "v1", "Pod", "pods", true);
    public static final ResourceTypeDescriptor STATEFUL_SETS =
            new ResourceTypeDescriptor("apps", "v1", "StatefulSet", "statefulsets", true);
    public static final ResourceTypeDescriptor DEPLOYMENTS =
            new ResourceTypeDescriptor("apps", "v1", "Deployment", "deployments", true);
    public static final ResourceTypeDescriptor JOBS =
            new ResourceTypeDescriptor("batch", "v1", "Job", "jobs", true);
    public static final ResourceTypeDescriptor CRON_JOBS =
            new ResourceTypeDescriptor("batch", "v1", "CronJob", "cronjobs", true);

    /**
     * "v1" for the core group, "group/version" otherwise.
     */
    public String groupVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    /**
     * Catalog key: {@code <group>/<version>/<plural>}.
     */
    public String key() {
        return group + "/" + version + "/" + plural;
    }
}
