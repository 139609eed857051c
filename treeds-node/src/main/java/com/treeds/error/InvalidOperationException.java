package com.treeds.error;

/**
 * Thrown for structurally illegal requests, e.g. removing the root while retaining its children,
 * asking for the height of a tree without a root, or attaching a subtree that has no root.
 */
public final class InvalidOperationException extends TreeException {

    public InvalidOperationException(String reason) {
        super(reason);
    }
}
