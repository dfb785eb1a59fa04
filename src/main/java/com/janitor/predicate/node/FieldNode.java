package com.janitor.predicate.node;

import java.util.Map;

/**
 * Field lookup on a map. Yields null for non-maps and missing keys.
 */
public class FieldNode implements Node {

    private final String name;

    public FieldNode(String name) {
        this.name = name;
    }

    @Override
    public Object evaluate(Object current) {
        if (current instanceof Map<?, ?> map) {
            return map.get(name);
        }
        return null;
    }

    @Override
    public NodeType getType() {
        return NodeType.FIELD;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "FIELD(" + name + ")";
    }
}
