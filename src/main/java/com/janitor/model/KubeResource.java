package com.janitor.model;

import com.janitor.time.TimeRules;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Handle to one cluster object.
 * <p>
 * Wraps the object's generic representation (nested maps, lists and scalars), which is
 * what predicates are evaluated against. The only mutation allowed is adding an
 * annotation via {@link #markAnnotation(String, String)}; a resource is confined to the
 * worker deciding on it.
 */
public final class KubeResource {

    private static final String METADATA = "metadata";
    private static final String ANNOTATIONS = "annotations";
    private static final String LABELS = "labels";

    private final ResourceTypeDescriptor type;
    private final Map<String, Object> document;

    private KubeResource(ResourceTypeDescriptor type, Map<String, Object> document) {
        this.type = Objects.requireNonNull(type, "type");
        this.document = document;
    }

    /**
     * Wrap a listed object. The document is copied; kind and apiVersion are filled in from
     * the type when the list response omits them.
     */
    public static KubeResource of(ResourceTypeDescriptor type, Map<String, Object> document) {
        Map<String, Object> copy = new LinkedHashMap<>(document);
        copy.putIfAbsent("kind", type.kind());
        copy.putIfAbsent("apiVersion", type.groupVersion());

        Map<String, Object> metadata = new LinkedHashMap<>(asMap(copy.get(METADATA)));
        metadata.put(ANNOTATIONS, new LinkedHashMap<>(asMap(metadata.get(ANNOTATIONS))));
        copy.put(METADATA, metadata);
        return new KubeResource(type, copy);
    }

    public ResourceTypeDescriptor getType() {
        return type;
    }

    public String getKind() {
        Object kind = document.get("kind");
        return kind != null ? kind.toString() : type.kind();
    }

    public String getApiVersion() {
        Object apiVersion = document.get("apiVersion");
        return apiVersion != null ? apiVersion.toString() : type.groupVersion();
    }

    public String getName() {
        return metadataString("name");
    }

    /**
     * Namespace, or the empty string for cluster-scoped objects.
     */
    public String getNamespace() {
        return metadataString("namespace");
    }

    public String getUid() {
        return metadataString("uid");
    }

    /**
     * @return Creation instant, or null if the object carries none
     */
    public Instant getCreationTimestamp() {
        return TimeRules.parseRfc3339OrNull(metadataString("creationTimestamp"));
    }

    public Map<String, String> getAnnotations() {
        return stringMap(metadata().get(ANNOTATIONS));
    }

    public Map<String, String> getLabels() {
        return stringMap(metadata().get(LABELS));
    }

    public String getAnnotation(String key) {
        return getAnnotations().get(key);
    }

    public boolean hasAnnotation(String key) {
        return getAnnotations().containsKey(key);
    }

    /**
     * Record an annotation on the local copy.
     */
    @SuppressWarnings("unchecked")
    public void markAnnotation(String key, String value) {
        ((Map<String, Object>) metadata().get(ANNOTATIONS)).put(key, value);
    }

    /**
     * Type name used by rules and counters: lower-cased kind plus "s".
     */
    public String getTypeName() {
        return getKind().toLowerCase(Locale.ROOT) + "s";
    }

    public boolean isNamespaceObject() {
        return "Namespace".equals(getKind());
    }

    public ResourceIdentity getIdentity() {
        return new ResourceIdentity(getKind(), getNamespace(), getName());
    }

    /**
     * Read-only view of the generic representation.
     */
    public Map<String, Object> getDocument() {
        return Collections.unmodifiableMap(document);
    }

    private Map<String, Object> metadata() {
        return asMap(document.get(METADATA));
    }

    private String metadataString(String key) {
        Object value = metadata().get(key);
        return value != null ? value.toString() : "";
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    private static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        asMap(value).forEach((k, v) -> result.put(k, v != null ? v.toString() : null));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String toString() {
        return getKind() + " " + getNamespace() + "/" + getName();
    }
}
