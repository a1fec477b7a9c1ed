package com.schematrack.tracker.testing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Clock} whose instant tests set explicitly. Thread-safe; every thread sees the latest
 * value. Placed in {@code src/main/java} for cross-module test use.
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> instant;
    private final ZoneId zone;

    public MutableClock(Instant initial) {
        this(new AtomicReference<>(initial), ZoneOffset.UTC);
    }

    private MutableClock(AtomicReference<Instant> instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Moves the clock to the given instant.
     */
    public MutableClock set(Instant newInstant) {
        instant.set(newInstant);
        return this;
    }

    /**
     * Moves the clock forward.
     */
    public MutableClock advance(Duration amount) {
        instant.updateAndGet(current -> current.plus(amount));
        return this;
    }

    @Override
    public Instant instant() {
        return instant.get();
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new MutableClock(instant, newZone);
    }
}
