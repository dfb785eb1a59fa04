package com.janitor.predicate.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * List projection ({@code left[*].right}) or object value projection ({@code left.*.right}).
 * The right node is applied to every element; null results are dropped.
 */
public class ProjectionNode implements Node {

    private final Node left;
    private final Node right;
    private final boolean objectValues;

    public ProjectionNode(Node left, Node right, boolean objectValues) {
        this.left = left;
        this.right = right;
        this.objectValues = objectValues;
    }

    @Override
    public Object evaluate(Object current) {
        Object base = left.evaluate(current);

        Collection<?> elements;
        if (objectValues) {
            if (!(base instanceof Map<?, ?> map)) {
                return null;
            }
            elements = map.values();
        } else {
            if (!(base instanceof List<?> list)) {
                return null;
            }
            elements = list;
        }

        List<Object> result = new ArrayList<>();
        for (Object element : elements) {
            Object projected = right.evaluate(element);
            if (projected != null) {
                result.add(projected);
            }
        }
        return result;
    }

    @Override
    public NodeType getType() {
        return NodeType.PROJECTION;
    }

    @Override
    public String toString() {
        return "PROJECT(" + left + (objectValues ? ".*" : "[*]") + " -> " + right + ")";
    }
}
