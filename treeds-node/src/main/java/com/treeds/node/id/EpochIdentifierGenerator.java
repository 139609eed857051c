package com.treeds.node.id;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time-based ids: microseconds since the Unix epoch. When the clock has not advanced (or went back)
 * since the last id, the previous id plus one is returned instead, so ids stay strictly increasing.
 * Ids from a fresh process are therefore larger than any small hand-assigned id already in a loaded tree.
 */
public final class EpochIdentifierGenerator implements IdentifierGenerator {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    public EpochIdentifierGenerator() {
        this(Clock.systemUTC());
    }

    public EpochIdentifierGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long next() {
        long now = epochMicros(clock.instant());
        return last.accumulateAndGet(now, (prev, candidate) -> candidate > prev ? candidate : prev + 1);
    }

    private static long epochMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }
}
