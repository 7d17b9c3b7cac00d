package com.camsentinel.core.support;

import com.camsentinel.core.time.TimeSource;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Virtual clock for tests: time only moves when {@link #advance(Duration)}
 * is called.
 */
public class ManualTimeSource implements TimeSource {

    private final Instant origin;
    private final AtomicLong nanos = new AtomicLong();

    public ManualTimeSource() {
        this(Instant.parse("2024-05-01T10:00:00Z"));
    }

    public ManualTimeSource(Instant origin) {
        this.origin = origin;
    }

    @Override
    public long nanoTime() {
        return nanos.get();
    }

    @Override
    public Instant now() {
        return origin.plusNanos(nanos.get());
    }

    public void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    public void advanceTo(long targetNanos) {
        nanos.accumulateAndGet(targetNanos, Math::max);
    }

    /** @return seconds elapsed since the origin */
    public double elapsedSeconds() {
        return nanos.get() / 1_000_000_000.0;
    }
}
