package com.janitor.predicate.node;

import com.janitor.predicate.Values;

/**
 * {@code left || right}: yields left when it is truthy, otherwise right.
 */
public class OrNode implements Node {

    private final Node left;
    private final Node right;

    public OrNode(Node left, Node right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(Object current) {
        Object value = left.evaluate(current);
        if (Values.isTruthy(value)) {
            return value;
        }
        return right.evaluate(current);
    }

    @Override
    public NodeType getType() {
        return NodeType.OR;
    }

    @Override
    public String toString() {
        return "OR(" + left + ", " + right + ")";
    }
}
