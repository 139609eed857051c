package com.treeds.node;

import com.treeds.error.AccessConflictException;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread-shared guard backed by a {@link ReentrantReadWriteLock}. Other threads block until an
 * in-progress mutation finishes; the mutating thread itself may not re-enter, and a thread holding a
 * read may not upgrade to a write (that would deadlock).
 */
final class LockingNodeAccess implements NodeAccess {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public <R> R read(Object nodeId, Supplier<R> reader) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new AccessConflictException(nodeId, "read attempted while this thread is mutating the node");
        }
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <R> R write(Object nodeId, Supplier<R> writer) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new AccessConflictException(nodeId, "mutation attempted while this thread is already mutating the node");
        }
        if (lock.getReadHoldCount() > 0) {
            throw new AccessConflictException(nodeId, "mutation attempted while this thread is reading the node");
        }
        lock.writeLock().lock();
        try {
            return writer.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
