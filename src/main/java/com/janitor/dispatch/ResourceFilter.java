package com.janitor.dispatch;

import com.janitor.config.JanitorConfig;
import com.janitor.model.KubeResource;

import java.util.List;

/**
 * Include/exclude filtering of resource types and namespaces.
 * <p>
 * Exclusion wins over inclusion; "all" includes everything. Namespace objects are filtered
 * by their own name. Other cluster-scoped objects pass only when cluster resources are
 * enabled.
 */
public class ResourceFilter {

    private final JanitorConfig config;

    public ResourceFilter(JanitorConfig config) {
        this.config = config;
    }

    public boolean includesType(String plural) {
        return included(plural, config.includeResources(), config.excludeResources());
    }

    public boolean includesNamespace(String namespace) {
        return included(namespace, config.includeNamespaces(), config.excludeNamespaces());
    }

    public boolean matches(KubeResource resource) {
        if (!includesType(resource.getType().plural())) {
            return false;
        }
        if (resource.isNamespaceObject()) {
            return includesNamespace(resource.getName());
        }
        if (resource.getNamespace().isEmpty()) {
            return config.includeClusterResources();
        }
        return includesNamespace(resource.getNamespace());
    }

    private static boolean included(String value, List<String> include, List<String> exclude) {
        if (exclude.contains(value)) {
            return false;
        }
        return include.contains(JanitorConfig.ALL) || include.contains(value);
    }
}
