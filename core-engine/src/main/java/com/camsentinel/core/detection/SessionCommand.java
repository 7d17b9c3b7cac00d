package com.camsentinel.core.detection;

import java.time.Instant;
import java.util.Objects;

/**
 * Instruction from the detection state machine to the recording layer.
 *
 * <p>
 * {@code deadlineNanos} is the monotonic instant the recording should run
 * until; it is meaningful for {@link Type#START} and {@link Type#EXTEND}
 * only. {@code at} is the wall-clock time of the event that caused the
 * command, used to name the session's artifacts.
 * </p>
 *
 * @since 1.0.0
 */
public final class SessionCommand {

    /** Command kinds. */
    public enum Type {
        START,
        EXTEND,
        STOP
    }

    private final Type type;
    private final String deviceName;
    private final Instant at;
    private final long deadlineNanos;

    private SessionCommand(Type type, String deviceName, Instant at, long deadlineNanos) {
        this.type = type;
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        this.at = Objects.requireNonNull(at, "at must not be null");
        this.deadlineNanos = deadlineNanos;
    }

    public static SessionCommand start(String deviceName, Instant at, long deadlineNanos) {
        return new SessionCommand(Type.START, deviceName, at, deadlineNanos);
    }

    public static SessionCommand extend(String deviceName, Instant at, long deadlineNanos) {
        return new SessionCommand(Type.EXTEND, deviceName, at, deadlineNanos);
    }

    public static SessionCommand stop(String deviceName, Instant at) {
        return new SessionCommand(Type.STOP, deviceName, at, 0L);
    }

    public Type getType() {
        return type;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public Instant getAt() {
        return at;
    }

    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SessionCommand that))
            return false;
        return type == that.type
                && deadlineNanos == that.deadlineNanos
                && deviceName.equals(that.deviceName)
                && at.equals(that.at);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, deviceName, at, deadlineNanos);
    }

    @Override
    public String toString() {
        return "SessionCommand{" + type + ", device='" + deviceName + "', at=" + at + '}';
    }
}
