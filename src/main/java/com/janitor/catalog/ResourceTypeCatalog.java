package com.janitor.catalog;

import com.janitor.client.ApiGroupInfo;
import com.janitor.client.ApiResourceInfo;
import com.janitor.client.ClusterClient;
import com.janitor.exception.TransportException;
import com.janitor.model.ResourceTypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Discovers the deletable resource types the cluster serves.
 * <p>
 * The core group is read at "v1", every other group at its preferred version. Subresources
 * and types without the "delete" verb are skipped; entries are keyed by
 * {@code <group>/<version>/<plural>}. Failing to read the core group fails discovery; a
 * failing non-core group is logged and skipped.
 */
public class ResourceTypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(ResourceTypeCatalog.class);

    private static final String CORE_VERSION = "v1";
    private static final String DELETE_VERB = "delete";

    private final ClusterClient client;
    private final DeprecationTable deprecations;

    public ResourceTypeCatalog(ClusterClient client, DeprecationTable deprecations) {
        this.client = client;
        this.deprecations = deprecations;
    }

    /**
     * @return Descriptors ordered by key
     * @throws TransportException if the core group or the group list cannot be read
     */
    public List<ResourceTypeDescriptor> discover() {
        Map<String, ResourceTypeDescriptor> types = new TreeMap<>();

        collect(types, "", CORE_VERSION, client.listApiResources(CORE_VERSION));

        for (ApiGroupInfo group : client.listApiGroups()) {
            List<ApiResourceInfo> resources;
            try {
                resources = client.listApiResources(group.preferredGroupVersion());
            } catch (TransportException e) {
                log.warn("Skipping API group {}: {}", group.preferredGroupVersion(), e.getMessage());
                continue;
            }
            collect(types, group.name(), group.preferredVersion(), resources);
        }

        List<ResourceTypeDescriptor> result = deprecations.apply(new ArrayList<>(types.values()));
        log.debug("Discovered {} deletable resource types", result.size());
        return result;
    }

    private static void collect(Map<String, ResourceTypeDescriptor> types, String group, String version,
                                List<ApiResourceInfo> resources) {
        for (ApiResourceInfo resource : resources) {
            if (resource.isSubresource() || !resource.supports(DELETE_VERB)) {
                continue;
            }
            ResourceTypeDescriptor descriptor = new ResourceTypeDescriptor(
                    group, version, resource.kind(), resource.name(), resource.namespaced());
            types.putIfAbsent(descriptor.key(), descriptor);
        }
    }
}
