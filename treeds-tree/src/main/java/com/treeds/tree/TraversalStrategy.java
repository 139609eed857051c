package com.treeds.tree;

/** Visiting order for {@link Tree#traverse(Object, TraversalStrategy)}. */
public enum TraversalStrategy {
    /** Node first, then each child subtree in child order. */
    PRE_ORDER,
    /** Each child subtree in child order, then the node. */
    POST_ORDER,
    /**
     * First child's subtree, then the node, then every further child followed by its own subtree.
     * Ids are emitted once, at their first occurrence.
     */
    IN_ORDER
}
