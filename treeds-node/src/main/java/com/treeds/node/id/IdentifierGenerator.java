package com.treeds.node.id;

/**
 * Source of process-unique node ids. Every call returns a value strictly greater than any value
 * previously returned by the same generator, from any thread.
 */
@FunctionalInterface
public interface IdentifierGenerator {

    long next();
}
