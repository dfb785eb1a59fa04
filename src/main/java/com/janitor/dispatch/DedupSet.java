package com.janitor.dispatch;

import com.janitor.model.ResourceIdentity;

import java.util.HashSet;
import java.util.Set;

/**
 * Objects already seen in the current run.
 */
public final class DedupSet {

    private final Set<ResourceIdentity> seen = new HashSet<>();

    /**
     * Atomically record an identity.
     *
     * @return true if this is the first time the identity is seen
     */
    public synchronized boolean markSeen(ResourceIdentity identity) {
        return seen.add(identity);
    }

    public synchronized int size() {
        return seen.size();
    }
}
