package com.camsentinel.core.detection;

import com.camsentinel.core.model.DetectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns one device's presence notifications into recording decisions.
 *
 * <h3>Transitions</h3>
 *
 * <pre>
 *   IDLE   + present      → ACTIVE  emit START,  deadline = t + tail
 *   ACTIVE + present      → ACTIVE  emit EXTEND, deadline = t + tail
 *   ACTIVE + absent       → ACTIVE  (no-op)
 *   IDLE   + absent       → IDLE    (no-op)
 *   ACTIVE + deadline hit → IDLE    emit STOP
 * </pre>
 *
 * <p>
 * Absence never shortens the window: only the deadline ends a recording,
 * which makes the machine indifferent to whether the device reports
 * presence on every frame, periodically, or only on change. The deadline is
 * never moved backwards, so a late or duplicated notification cannot cut a
 * recording short.
 * </p>
 *
 * <h3>Time</h3>
 * <p>
 * All arithmetic is on monotonic nanoseconds supplied by the caller (event
 * receipt time, or the {@code nowNanos} of {@link #checkDeadline(long, Instant)}),
 * so the machine can be driven by a virtual clock.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is <strong>stateful</strong> and not thread-safe. One instance
 * belongs to one device pipeline.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionStateMachine.class);

    private final String deviceName;
    private final long postDetectionNanos;

    private DetectionState state = DetectionState.IDLE;
    private long deadlineNanos;

    /**
     * @param deviceName            device this machine belongs to
     * @param postDetectionDuration recording tail after the last positive detection
     * @throws IllegalArgumentException if the duration is not positive
     */
    public DetectionStateMachine(String deviceName, Duration postDetectionDuration) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        Objects.requireNonNull(postDetectionDuration, "postDetectionDuration must not be null");
        if (postDetectionDuration.isZero() || postDetectionDuration.isNegative()) {
            throw new IllegalArgumentException(
                    "postDetectionDuration must be > 0, got: " + postDetectionDuration);
        }
        this.postDetectionNanos = postDetectionDuration.toNanos();
    }

    /**
     * Apply one detection event.
     *
     * @param event the event; must belong to this machine's device
     * @return the command to execute, empty for no-op transitions
     */
    public Optional<SessionCommand> onEvent(DetectionEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (!deviceName.equals(event.getDeviceName())) {
            throw new IllegalArgumentException("Event for device '" + event.getDeviceName()
                    + "' delivered to state machine of '" + deviceName + "'");
        }
        if (!event.isPresent()) {
            LOG.debug("Person no longer detected ({})", state);
            return Optional.empty();
        }

        long candidate = event.getMonotonicNanos() + postDetectionNanos;
        if (state == DetectionState.IDLE) {
            state = DetectionState.ACTIVE;
            deadlineNanos = candidate;
            LOG.info("Person detected, starting recording");
            return Optional.of(SessionCommand.start(deviceName, event.getObservedAt(), deadlineNanos));
        }

        if (candidate - deadlineNanos > 0) {
            deadlineNanos = candidate;
        }
        LOG.debug("Person still detected, recording extended");
        return Optional.of(SessionCommand.extend(deviceName, event.getObservedAt(), deadlineNanos));
    }

    /**
     * End the recording if its deadline has been reached.
     *
     * @param nowNanos current monotonic time
     * @param now      current wall-clock time, carried on the STOP command
     * @return a STOP command if the deadline passed, empty otherwise
     */
    public Optional<SessionCommand> checkDeadline(long nowNanos, Instant now) {
        if (state != DetectionState.ACTIVE || nowNanos - deadlineNanos < 0) {
            return Optional.empty();
        }
        state = DetectionState.IDLE;
        LOG.info("Post-detection window elapsed, stopping recording");
        return Optional.of(SessionCommand.stop(deviceName, now));
    }

    /**
     * Time left until the current deadline.
     *
     * @param nowNanos current monotonic time
     * @return remaining time, zero if already due, empty when {@code IDLE}
     */
    public Optional<Duration> timeUntilDeadline(long nowNanos) {
        if (state != DetectionState.ACTIVE) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - nowNanos)));
    }

    /**
     * Return to {@code IDLE} without emitting a command.
     *
     * <p>
     * Used when the recording layer could not start a session or lost it to a
     * process fault: the next positive detection then starts a fresh session
     * instead of extending one that does not exist.
     * </p>
     */
    public void reset() {
        if (state != DetectionState.IDLE) {
            LOG.debug("Detection state reset to IDLE");
        }
        state = DetectionState.IDLE;
    }

    public DetectionState getState() {
        return state;
    }

    /**
     * @return the monotonic deadline; only meaningful while {@code ACTIVE}
     */
    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
