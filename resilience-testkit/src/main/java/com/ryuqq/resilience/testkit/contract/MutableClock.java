package com.ryuqq.resilience.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manually advanced clock for deterministic time-based tests.
 *
 * <p>Rate limit windows, cache TTLs and circuit breaker reset timeouts all read time
 * through {@link Clock}, so tests move time forward with {@link #advance(Duration)}
 * instead of sleeping.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
        this.zone = zone;
    }

    /**
     * Creates a clock fixed at 2024-01-01T00:00:00Z.
     *
     * @return a new mutable clock
     */
    public static MutableClock startingAtEpoch() {
        return new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    /**
     * Moves the clock forward.
     *
     * @param amount non-negative amount of time
     */
    public void advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount must be non-negative (current: " + amount + ")");
        }
        now.updateAndGet(current -> current.plus(amount));
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now.get(), zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
