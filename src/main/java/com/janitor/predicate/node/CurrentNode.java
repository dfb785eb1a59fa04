package com.janitor.predicate.node;

/**
 * The current node ({@code @}).
 */
public class CurrentNode implements Node {

    public static final CurrentNode INSTANCE = new CurrentNode();

    @Override
    public Object evaluate(Object current) {
        return current;
    }

    @Override
    public NodeType getType() {
        return NodeType.CURRENT;
    }

    @Override
    public String toString() {
        return "@";
    }
}
