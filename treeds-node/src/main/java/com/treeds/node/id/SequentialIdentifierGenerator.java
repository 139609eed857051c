package com.treeds.node.id;

import java.util.concurrent.atomic.AtomicLong;

/** Plain counter: start, start + 1, start + 2, ... */
public final class SequentialIdentifierGenerator implements IdentifierGenerator {

    public static final long DEFAULT_START = 1L;

    private final AtomicLong counter;

    public SequentialIdentifierGenerator() {
        this(DEFAULT_START);
    }

    public SequentialIdentifierGenerator(long start) {
        this.counter = new AtomicLong(start);
    }

    /**
     * @throws IllegalStateException once the counter reaches {@link Long#MAX_VALUE}
     */
    @Override
    public long next() {
        try {
            return counter.getAndUpdate(Math::incrementExact);
        } catch (ArithmeticException e) {
            throw new IllegalStateException("Identifier sequence exhausted at " + Long.MAX_VALUE, e);
        }
    }

    /** The value the next call to {@link #next()} will return. */
    public long peek() {
        return counter.get();
    }
}
