package com.camsentinel.core.time;

import java.time.Instant;

/**
 * Source of both clocks the watcher needs.
 *
 * <p>
 * {@link #nanoTime()} is monotonic and only meaningful as a difference
 * between two readings; {@link #now()} is wall-clock time. Deadline logic
 * uses the former exclusively, so tests can drive it with a manual
 * implementation instead of waiting.
 * </p>
 */
public interface TimeSource {

    /** @return monotonic reading in nanoseconds */
    long nanoTime();

    /** @return current wall-clock instant */
    Instant now();

    /** The system clocks. */
    TimeSource SYSTEM = new TimeSource() {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public Instant now() {
            return Instant.now();
        }
    };
}
