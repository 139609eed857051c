package com.treeds.error;

/**
 * Thrown when a node's state is accessed while it is exclusively held by an in-progress mutation
 * (or mutated while a read is in progress) on the same thread. This signals a programming error,
 * typically a re-entrant call from inside {@code Node#updateValue}; it is never retried.
 */
public final class AccessConflictException extends TreeException {

    private final String nodeId;

    public AccessConflictException(Object nodeId, String detail) {
        super("Access conflict on node " + nodeId + ": " + detail);
        this.nodeId = String.valueOf(nodeId);
    }

    public String getNodeId() {
        return nodeId;
    }
}
