package com.treeds.node;

/**
 * How a node's mutable state is shared. Chosen per node when it is created; every copy made by the
 * tree (subtree extraction, decoding) keeps the ownership of its source.
 */
public enum NodeOwnership {
    /**
     * Shared within one thread. Mutations are tracked dynamically: touching a node while it is being
     * mutated, or mutating it while it is being read, fails with
     * {@link com.treeds.error.AccessConflictException}. No cross-thread guarantees.
     */
    SINGLE_THREADED {
        @Override
        NodeAccess newAccess() {
            return new CheckedNodeAccess();
        }
    },
    /**
     * Shared between threads. Each node is guarded by its own read/write lock, so readers never see a
     * half-applied mutation. Operations spanning several nodes (e.g. removing a node from a tree) are
     * not atomic; callers needing that must lock externally.
     */
    THREAD_SHARED {
        @Override
        NodeAccess newAccess() {
            return new LockingNodeAccess();
        }
    };

    abstract NodeAccess newAccess();
}
