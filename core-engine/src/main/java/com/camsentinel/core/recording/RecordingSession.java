package com.camsentinel.core.recording;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One bounded recording (snapshot plus clip) of one detection episode.
 *
 * <p>
 * Owned by a {@link RecordingSessionManager} from creation until
 * {@link SessionStatus#STOPPED}. Status and deadline are written by the
 * owning pipeline thread only; they are volatile so status reporting from
 * other threads sees current values.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordingSession {

    private final String sessionId;
    private final String deviceName;
    private final Instant startedAt;
    private final long startedNanos;
    private final Path snapshotPath;
    private final Path clipPath;

    private volatile CaptureProcess process;
    private volatile SessionStatus status = SessionStatus.STARTING;
    private volatile long deadlineNanos;
    private volatile boolean snapshotCaptured;

    RecordingSession(String deviceName, ArtifactPaths paths, Instant startedAt, long startedNanos,
            long deadlineNanos) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        this.sessionId = deviceName + "/" + paths.getArtifactName();
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.startedNanos = startedNanos;
        this.snapshotPath = paths.getSnapshotPath();
        this.clipPath = paths.getClipPath();
        this.deadlineNanos = deadlineNanos;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getStartedNanos() {
        return startedNanos;
    }

    public Path getSnapshotPath() {
        return snapshotPath;
    }

    public Path getClipPath() {
        return clipPath;
    }

    public SessionStatus getStatus() {
        return status;
    }

    /** @return monotonic instant the recording is meant to run until */
    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    /** @return {@code true} if the snapshot for this session was written */
    public boolean isSnapshotCaptured() {
        return snapshotCaptured;
    }

    CaptureProcess getProcess() {
        return process;
    }

    void setProcess(CaptureProcess process) {
        this.process = process;
    }

    void setStatus(SessionStatus status) {
        this.status = status;
    }

    void setDeadlineNanos(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    void setSnapshotCaptured(boolean snapshotCaptured) {
        this.snapshotCaptured = snapshotCaptured;
    }

    @Override
    public String toString() {
        return "RecordingSession{" +
                "sessionId='" + sessionId + '\'' +
                ", startedAt=" + startedAt +
                ", status=" + status +
                ", clipPath=" + clipPath +
                '}';
    }
}
