package com.treeds.tree;

/** What happens to the descendants of a node removed with {@link Tree#removeNode(Object, NodeRemovalStrategy)}. */
public enum NodeRemovalStrategy {
    /** Children move up to the removed node's parent; not allowed for the root. */
    RETAIN_CHILDREN,
    /** The node and all of its descendants leave the tree. */
    REMOVE_NODE_AND_CHILDREN
}
