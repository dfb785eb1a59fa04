package com.janitor.model;

/**
 * Identity of an object within one cleanup run.
 */
public record ResourceIdentity(String kind, String namespace, String name) {

    @Override
    public String toString() {
        return kind + "/" + namespace + "/" + name;
    }
}
