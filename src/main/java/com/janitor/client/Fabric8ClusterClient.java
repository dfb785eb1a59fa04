package com.janitor.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.janitor.exception.ResourceNotFoundException;
import com.janitor.exception.TransportException;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceTypeDescriptor;
import com.janitor.time.TimeRules;
import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.APIGroupList;
import io.fabric8.kubernetes.api.model.APIResource;
import io.fabric8.kubernetes.api.model.APIResourceList;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.StatusDetails;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ClusterClient} backed by the fabric8 {@link KubernetesClient}.
 * <p>
 * Objects are handled as generic resources so any discovered type can be listed,
 * annotated and deleted. {@link KubernetesClientException}s are wrapped into
 * {@link TransportException}, with HTTP 404 mapped to {@link ResourceNotFoundException}.
 */
public class Fabric8ClusterClient implements ClusterClient {

    private static final Logger log = LoggerFactory.getLogger(Fabric8ClusterClient.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final String DEFAULT_EVENT_NAMESPACE = "default";

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;

    public Fabric8ClusterClient(KubernetesClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ApiGroupInfo> listApiGroups() {
        APIGroupList groups;
        try {
            groups = client.getApiGroups();
        } catch (KubernetesClientException e) {
            throw wrap("Failed to list API groups", e);
        }

        List<ApiGroupInfo> result = new ArrayList<>();
        if (groups == null || groups.getGroups() == null) {
            return result;
        }
        for (APIGroup group : groups.getGroups()) {
            if (group.getPreferredVersion() == null) {
                log.debug("API group {} advertises no preferred version, skipping", group.getName());
                continue;
            }
            result.add(new ApiGroupInfo(
                    group.getName(),
                    group.getPreferredVersion().getGroupVersion(),
                    group.getPreferredVersion().getVersion()));
        }
        return result;
    }

    @Override
    public List<ApiResourceInfo> listApiResources(String groupVersion) {
        APIResourceList resources;
        try {
            resources = client.getApiResources(groupVersion);
        } catch (KubernetesClientException e) {
            throw wrap("Failed to list API resources for " + groupVersion, e);
        }
        if (resources == null) {
            throw new ResourceNotFoundException("Group version not served: " + groupVersion);
        }

        List<ApiResourceInfo> result = new ArrayList<>();
        for (APIResource resource : resources.getResources()) {
            result.add(new ApiResourceInfo(
                    resource.getName(),
                    resource.getKind(),
                    Boolean.TRUE.equals(resource.getNamespaced()),
                    resource.getVerbs()));
        }
        return result;
    }

    @Override
    public List<KubeResource> list(ResourceTypeDescriptor type, String namespace) {
        GenericKubernetesResourceList list;
        try {
            MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> op =
                    client.genericKubernetesResources(toContext(type));
            list = namespace != null ? op.inNamespace(namespace).list() : op.list();
        } catch (KubernetesClientException e) {
            throw wrap("Failed to list " + type.plural() + (namespace != null ? " in namespace " + namespace : ""), e);
        }

        List<KubeResource> result = new ArrayList<>();
        for (GenericKubernetesResource item : list.getItems()) {
            result.add(KubeResource.of(type, objectMapper.convertValue(item, MAP_TYPE)));
        }
        return result;
    }

    @Override
    public void delete(KubeResource resource) {
        List<StatusDetails> details;
        try {
            details = select(resource)
                    .withPropagationPolicy(DeletionPropagation.BACKGROUND)
                    .delete();
        } catch (KubernetesClientException e) {
            throw wrap("Failed to delete " + resource, e);
        }
        if (details == null || details.isEmpty()) {
            throw new ResourceNotFoundException(resource + " not found");
        }
    }

    @Override
    public void createEvent(LifecycleEvent event) {
        KubeResource involved = event.involved();
        String namespace = involved.getNamespace().isEmpty() ? DEFAULT_EVENT_NAMESPACE : involved.getNamespace();
        String timestamp = TimeRules.formatInstant(event.timestamp());

        Event body = new EventBuilder()
                .withNewMetadata()
                    .withGenerateName(LifecycleEvent.GENERATE_NAME)
                    .withNamespace(namespace)
                .endMetadata()
                .withNewInvolvedObject()
                    .withApiVersion(involved.getApiVersion())
                    .withKind(involved.getKind())
                    .withName(involved.getName())
                    .withNamespace(involved.getNamespace())
                    .withUid(involved.getUid())
                .endInvolvedObject()
                .withReason(event.reason())
                .withMessage(event.message())
                .withFirstTimestamp(timestamp)
                .withLastTimestamp(timestamp)
                .withCount(1)
                .withType(LifecycleEvent.TYPE_NORMAL)
                .withNewSource()
                    .withComponent(LifecycleEvent.SOURCE_COMPONENT)
                .endSource()
                .build();

        try {
            client.v1().events().inNamespace(namespace).resource(body).create();
        } catch (KubernetesClientException e) {
            throw wrap("Failed to create event for " + involved, e);
        }
    }

    @Override
    public void annotate(KubeResource resource, String key, String value) {
        try {
            select(resource).edit(live -> {
                Map<String, String> annotations = live.getMetadata().getAnnotations() != null
                        ? new LinkedHashMap<>(live.getMetadata().getAnnotations())
                        : new LinkedHashMap<>();
                annotations.put(key, value);
                live.getMetadata().setAnnotations(annotations);
                return live;
            });
        } catch (KubernetesClientException e) {
            throw wrap("Failed to annotate " + resource, e);
        }
    }

    private Resource<GenericKubernetesResource> select(KubeResource resource) {
        NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> op =
                resource.getNamespace().isEmpty()
                        ? client.genericKubernetesResources(toContext(resource.getType()))
                        : client.genericKubernetesResources(toContext(resource.getType())).inNamespace(resource.getNamespace());
        return op.withName(resource.getName());
    }

    private static ResourceDefinitionContext toContext(ResourceTypeDescriptor type) {
        return new ResourceDefinitionContext.Builder()
                .withGroup(type.group())
                .withVersion(type.version())
                .withKind(type.kind())
                .withPlural(type.plural())
                .withNamespaced(type.namespaced())
                .build();
    }

    private static TransportException wrap(String message, KubernetesClientException e) {
        if (e.getCode() == 404) {
            return new ResourceNotFoundException(message + ": " + e.getMessage(), e);
        }
        return new TransportException(message + ": " + e.getMessage(), e);
    }
}
