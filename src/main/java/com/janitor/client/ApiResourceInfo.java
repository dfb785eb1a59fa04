package com.janitor.client;

import java.util.List;

/**
 * One entry of an API resource list.
 *
 * @param name       Plural name; subresources contain a "/" (e.g. "pods/log")
 * @param kind       Kind
 * @param namespaced Whether the resource is namespaced
 * @param verbs      Supported verbs
 */
public record ApiResourceInfo(String name, String kind, boolean namespaced, List<String> verbs) {

    public ApiResourceInfo {
        verbs = verbs == null ? List.of() : List.copyOf(verbs);
    }

    public boolean isSubresource() {
        return name.contains("/");
    }

    public boolean supports(String verb) {
        return verbs.contains(verb);
    }
}
