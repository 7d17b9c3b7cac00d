package com.camsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One normalized presence notification for a device.
 *
 * <p>
 * Carries two clocks: {@code monotonicNanos} is the local receipt time from a
 * monotonic source and drives all deadline arithmetic, {@code observedAt} is
 * the wall-clock instant (the device's own timestamp when it supplied one)
 * used for artifact naming and logging.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionEvent {

    private final String deviceName;
    private final long monotonicNanos;
    private final Instant observedAt;
    private final boolean present;

    public DetectionEvent(String deviceName, long monotonicNanos, Instant observedAt, boolean present) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        this.monotonicNanos = monotonicNanos;
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
        this.present = present;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public long getMonotonicNanos() {
        return monotonicNanos;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    /** @return {@code true} when a person is detected, {@code false} when no longer detected */
    public boolean isPresent() {
        return present;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionEvent that))
            return false;
        return monotonicNanos == that.monotonicNanos
                && present == that.present
                && deviceName.equals(that.deviceName)
                && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceName, monotonicNanos, observedAt, present);
    }

    @Override
    public String toString() {
        return "DetectionEvent{" +
                "deviceName='" + deviceName + '\'' +
                ", observedAt=" + observedAt +
                ", present=" + present +
                '}';
    }
}
