package com.janitor.catalog;

import com.janitor.model.ResourceTypeDescriptor;

import java.util.List;

/**
 * Known deprecated types. A deprecated type is dropped from discovery results only when its
 * successor is also present.
 */
public final class DeprecationTable {

    private static final List<Deprecation> KNOWN = List.of(
            new Deprecation("", "endpoints", "discovery.k8s.io", "endpointslices")
    );

    private final List<Deprecation> entries;

    public DeprecationTable(List<Deprecation> entries) {
        this.entries = List.copyOf(entries);
    }

    public static DeprecationTable defaults() {
        return new DeprecationTable(KNOWN);
    }

    /**
     * Remove deprecated types whose successor is in the list.
     */
    public List<ResourceTypeDescriptor> apply(List<ResourceTypeDescriptor> types) {
        return types.stream()
                .filter(type -> !isSuperseded(type, types))
                .toList();
    }

    private boolean isSuperseded(ResourceTypeDescriptor type, List<ResourceTypeDescriptor> types) {
        for (Deprecation deprecation : entries) {
            if (deprecation.isDeprecated(type) && types.stream().anyMatch(deprecation::isSuccessor)) {
                return true;
            }
        }
        return false;
    }
}
