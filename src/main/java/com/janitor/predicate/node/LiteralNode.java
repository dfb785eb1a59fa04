package com.janitor.predicate.node;

/**
 * A constant: raw string, JSON literal or number.
 */
public class LiteralNode implements Node {

    private final Object value;

    public LiteralNode(Object value) {
        this.value = value;
    }

    @Override
    public Object evaluate(Object current) {
        return value;
    }

    @Override
    public NodeType getType() {
        return NodeType.LITERAL;
    }

    @Override
    public String toString() {
        return "LITERAL(" + value + ")";
    }
}
