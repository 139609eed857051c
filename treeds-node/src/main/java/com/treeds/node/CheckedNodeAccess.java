package com.treeds.node;

import com.treeds.error.AccessConflictException;

import java.util.function.Supplier;

/**
 * Single-threaded guard with dynamically checked borrows: any number of nested reads, or exactly one
 * write with nothing else in flight.
 */
final class CheckedNodeAccess implements NodeAccess {

    private static final int WRITING = -1;

    /** 0 = free, &gt;0 = active readers, {@link #WRITING} = mutation in progress. */
    private int state;

    @Override
    public <R> R read(Object nodeId, Supplier<R> reader) {
        if (state == WRITING) {
            throw new AccessConflictException(nodeId, "read attempted while the node is being mutated");
        }
        state++;
        try {
            return reader.get();
        } finally {
            state--;
        }
    }

    @Override
    public <R> R write(Object nodeId, Supplier<R> writer) {
        if (state == WRITING) {
            throw new AccessConflictException(nodeId, "mutation attempted while the node is already being mutated");
        }
        if (state > 0) {
            throw new AccessConflictException(nodeId, "mutation attempted while the node is being read");
        }
        state = WRITING;
        try {
            return writer.get();
        } finally {
            state = 0;
        }
    }
}
