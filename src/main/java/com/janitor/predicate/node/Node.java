package com.janitor.predicate.node;

/**
 * A compiled predicate expression node, evaluated against a JSON-like document tree
 * of maps, lists, strings, numbers, booleans and nulls.
 */
public interface Node {

    /**
     * Evaluate this node against the current value.
     *
     * @param current The value the expression is applied to
     * @return The result value; null when a path does not resolve
     * @throws com.janitor.exception.PredicateException if evaluation fails (e.g. wrong function argument type)
     */
    Object evaluate(Object current);

    /**
     * Get the node type.
     */
    NodeType getType();
}
