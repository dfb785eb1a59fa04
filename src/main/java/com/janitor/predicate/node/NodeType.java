package com.janitor.predicate.node;

/**
 * Node types of the predicate AST.
 */
public enum NodeType {
    // Navigation
    CURRENT,
    FIELD,
    SUBEXPRESSION,
    INDEX,
    PROJECTION,

    // Values
    LITERAL,
    FUNCTION,

    // Comparison
    COMPARATOR,

    // Logical
    AND,
    OR,
    NOT
}
