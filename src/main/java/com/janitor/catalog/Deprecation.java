package com.janitor.catalog;

import com.janitor.model.ResourceTypeDescriptor;

/**
 * A deprecated resource type and the type that supersedes it, identified by group and plural.
 */
public record Deprecation(String deprecatedGroup, String deprecatedPlural,
                          String successorGroup, String successorPlural) {

    public boolean isDeprecated(ResourceTypeDescriptor type) {
        return deprecatedGroup.equals(type.group()) && deprecatedPlural.equals(type.plural());
    }

    public boolean isSuccessor(ResourceTypeDescriptor type) {
        return successorGroup.equals(type.group()) && successorPlural.equals(type.plural());
    }
}
