package com.janitor.predicate.node;

/**
 * Applies the right node to the result of the left node ({@code left.right}).
 */
public class SubexpressionNode implements Node {

    private final Node left;
    private final Node right;

    public SubexpressionNode(Node left, Node right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public Object evaluate(Object current) {
        Object value = left.evaluate(current);
        if (value == null) {
            return null;
        }
        return right.evaluate(value);
    }

    @Override
    public NodeType getType() {
        return NodeType.SUBEXPRESSION;
    }

    @Override
    public String toString() {
        return left + "." + right;
    }
}
