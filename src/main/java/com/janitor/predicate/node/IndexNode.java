package com.janitor.predicate.node;

import java.util.List;

/**
 * List index access; negative indexes count from the end.
 */
public class IndexNode implements Node {

    private final int index;

    public IndexNode(int index) {
        this.index = index;
    }

    @Override
    public Object evaluate(Object current) {
        if (!(current instanceof List<?> list)) {
            return null;
        }
        int effective = index < 0 ? list.size() + index : index;
        if (effective < 0 || effective >= list.size()) {
            return null;
        }
        return list.get(effective);
    }

    @Override
    public NodeType getType() {
        return NodeType.INDEX;
    }

    @Override
    public String toString() {
        return "INDEX(" + index + ")";
    }
}
