package com.janitor.context;

import com.janitor.model.KubeResource;

import java.util.Map;

/**
 * Computes the facts exposed to predicates under {@code _context}.
 */
public interface ContextProvider {

    /**
     * @throws com.janitor.exception.TransportException if built-in analysis cannot query the cluster
     */
    Map<String, Object> getContext(KubeResource resource, RunCache cache);
}
