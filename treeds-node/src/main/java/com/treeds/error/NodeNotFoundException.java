package com.treeds.error;

import java.util.Objects;

/**
 * Thrown by any lookup-by-id operation when the id is not present in the tree.
 */
public final class NodeNotFoundException extends TreeException {

    private final String nodeId;

    public NodeNotFoundException(Object nodeId) {
        super("Node " + nodeId + " not found in the tree.");
        this.nodeId = String.valueOf(nodeId);
    }

    /** String form of the id that could not be resolved. */
    public String getNodeId() {
        return nodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeNotFoundException that = (NodeNotFoundException) o;
        return Objects.equals(nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId);
    }
}
