package com.janitor.predicate.node;

import com.janitor.predicate.Values;

/**
 * {@code left && right}: yields left when it is falsy, otherwise right.
 */
public class AndNode implements Node {

    private final Node left;
    private final Node right;

    public AndNode(Node left, Node right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(Object current) {
        Object value = left.evaluate(current);
        if (!Values.isTruthy(value)) {
            return value;
        }
        return right.evaluate(current);
    }

    @Override
    public NodeType getType() {
        return NodeType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + left + ", " + right + ")";
    }
}
