package com.janitor.client;

import com.janitor.exception.ResourceNotFoundException;
import com.janitor.exception.TransportException;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceTypeDescriptor;

import java.util.List;

/**
 * The cluster API capabilities the janitor needs.
 * <p>
 * Every call may fail individually with a {@link TransportException}; a missing object is
 * reported as {@link ResourceNotFoundException} so callers can tell the two apart.
 */
public interface ClusterClient {

    /**
     * API groups other than the core group.
     */
    List<ApiGroupInfo> listApiGroups();

    /**
     * Resources served under a group version ("v1" for the core group).
     */
    List<ApiResourceInfo> listApiResources(String groupVersion);

    /**
     * List objects of a type.
     *
     * @param namespace Namespace to list in, or null for cluster-scoped types
     */
    List<KubeResource> list(ResourceTypeDescriptor type, String namespace);

    /**
     * Delete an object with background propagation.
     *
     * @throws ResourceNotFoundException if the object no longer exists
     */
    void delete(KubeResource resource);

    void createEvent(LifecycleEvent event);

    /**
     * Persist an annotation on the live object.
     */
    void annotate(KubeResource resource, String key, String value);

    default List<KubeResource> listNamespaces() {
        return list(ResourceTypeDescriptor.NAMESPACES, null);
    }
}
