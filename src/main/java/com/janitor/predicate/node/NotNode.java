package com.janitor.predicate.node;

import com.janitor.predicate.Values;

/**
 * Logical negation of the operand's truthiness.
 */
public class NotNode implements Node {

    private final Node operand;

    public NotNode(Node operand) {
        this.operand = operand;
    }

    @Override
    public Object evaluate(Object current) {
        return !Values.isTruthy(operand.evaluate(current));
    }

    @Override
    public NodeType getType() {
        return NodeType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
