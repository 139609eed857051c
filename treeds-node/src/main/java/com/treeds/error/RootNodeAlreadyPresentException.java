package com.treeds.error;

/**
 * Thrown when a parentless node is added to a tree that already has a root.
 */
public final class RootNodeAlreadyPresentException extends TreeException {

    public RootNodeAlreadyPresentException() {
        super("Root node already present in the tree. You cannot add another root node.");
    }
}
