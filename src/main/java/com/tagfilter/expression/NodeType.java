package com.tagfilter.expression;

/**
 * Kinds of nodes in a {@link BooleanExpression} tree.
 * A node without a type is a pending placeholder.
 */
public enum NodeType {
    AND,
    OR,
    ROOT,
    LEAF
}
