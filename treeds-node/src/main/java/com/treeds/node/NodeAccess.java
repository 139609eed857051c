package com.treeds.node;

import java.util.function.Supplier;

/**
 * Guards the mutable fields of one {@link Node}. Readers and writers run inside the guard;
 * implementations reject conflicting access with {@link com.treeds.error.AccessConflictException}.
 */
interface NodeAccess {

    <R> R read(Object nodeId, Supplier<R> reader);

    <R> R write(Object nodeId, Supplier<R> writer);

    default void mutate(Object nodeId, Runnable writer) {
        write(nodeId, () -> {
            writer.run();
            return null;
        });
    }
}
