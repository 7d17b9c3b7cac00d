package com.camsentinel.core.recording;

import com.camsentinel.core.detection.SessionCommand;
import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Runs at most one {@link RecordingSession} for a device.
 *
 * <h3>Commands</h3>
 * <ul>
 * <li>{@link #start(Instant, long)} allocates the session's paths, launches
 * the capture process and takes one snapshot. A failed snapshot is logged and
 * the recording continues.</li>
 * <li>{@link #extend(long)} only moves the session's deadline; the capture
 * process keeps running untouched.</li>
 * <li>{@link #stop(String)} asks the recorder to finalize its file, escalating
 * to terminate and kill after bounded waits. Idempotent.</li>
 * </ul>
 *
 * <h3>Ownership</h3>
 * <p>
 * Between start and stop this manager is the only owner of the capture
 * process and of both output paths. {@link #close()} stops any running
 * session, so every exit path of the owning pipeline ends the recorder.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Commands must come from a single thread (the device pipeline).
 * {@link #activeSession()} and the counters may be read from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordingSessionManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RecordingSessionManager.class);

    private final DeviceConfig device;
    private final OutputLayout layout;
    private final SnapshotFetcher snapshotFetcher;
    private final CaptureProcessLauncher launcher;
    private final TimeSource time;
    private final Duration gracefulStopTimeout;
    private final Duration terminateTimeout;

    private volatile RecordingSession active;
    private volatile long sessionsStarted;
    private volatile long processFaults;

    /**
     * @param device              the device recorded
     * @param layout              path allocator for the device
     * @param snapshotFetcher     snapshot collaborator
     * @param launcher            capture process collaborator
     * @param time                clock source
     * @param gracefulStopTimeout wait after the graceful stop request
     * @param terminateTimeout    wait after each escalation step
     */
    public RecordingSessionManager(DeviceConfig device,
            OutputLayout layout,
            SnapshotFetcher snapshotFetcher,
            CaptureProcessLauncher launcher,
            TimeSource time,
            Duration gracefulStopTimeout,
            Duration terminateTimeout) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.layout = Objects.requireNonNull(layout, "layout must not be null");
        this.snapshotFetcher = Objects.requireNonNull(snapshotFetcher, "snapshotFetcher must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.time = Objects.requireNonNull(time, "time must not be null");
        this.gracefulStopTimeout = Objects.requireNonNull(gracefulStopTimeout,
                "gracefulStopTimeout must not be null");
        this.terminateTimeout = Objects.requireNonNull(terminateTimeout, "terminateTimeout must not be null");
    }

    // ---------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------

    /**
     * Execute a command from the detection state machine.
     *
     * @param command the command; must target this manager's device
     * @throws SessionStartException if a START could not be carried out
     */
    public void handle(SessionCommand command) throws SessionStartException {
        Objects.requireNonNull(command, "command must not be null");
        if (!device.getName().equals(command.getDeviceName())) {
            throw new IllegalArgumentException("Command for device '" + command.getDeviceName()
                    + "' delivered to session manager of '" + device.getName() + "'");
        }
        switch (command.getType()) {
            case START -> start(command.getAt(), command.getDeadlineNanos());
            case EXTEND -> extend(command.getDeadlineNanos());
            case STOP -> stop("post-detection window elapsed");
        }
    }

    /**
     * Start a new session.
     *
     * @param at            wall-clock time of the triggering detection
     * @param deadlineNanos monotonic instant the session should run until
     * @return the running session
     * @throws SessionStartException if paths could not be allocated or the
     *                               recorder could not be launched
     */
    public RecordingSession start(Instant at, long deadlineNanos) throws SessionStartException {
        Objects.requireNonNull(at, "at must not be null");
        if (active != null) {
            // Never two live sessions per device
            LOG.warn("Session {} still active on start, stopping it first", active.getSessionId());
            stop("superseded by new session");
        }

        ArtifactPaths paths;
        try {
            paths = layout.allocate(at);
        } catch (IOException e) {
            throw new SessionStartException(
                    "Cannot allocate output paths for '" + device.getName() + "': " + e.getMessage(), e);
        }

        RecordingSession session = new RecordingSession(device.getName(), paths, at, time.nanoTime(), deadlineNanos);
        LOG.info("Starting recording session {} -> {}", session.getSessionId(), session.getClipPath());

        try {
            session.setProcess(launcher.launch(device, session.getClipPath()));
        } catch (IOException | RuntimeException e) {
            session.setStatus(SessionStatus.STOPPED);
            throw new SessionStartException(
                    "Cannot launch capture process for '" + device.getName() + "': " + e.getMessage(), e);
        }
        session.setStatus(SessionStatus.RUNNING);
        active = session;
        sessionsStarted++;

        captureSnapshot(session);
        return session;
    }

    /**
     * Move the active session's deadline forward. Performs no file or process
     * action.
     *
     * @param deadlineNanos the new monotonic deadline
     */
    public void extend(long deadlineNanos) {
        RecordingSession session = active;
        if (session == null) {
            LOG.debug("Extend without an active session ignored");
            return;
        }
        if (deadlineNanos - session.getDeadlineNanos() > 0) {
            session.setDeadlineNanos(deadlineNanos);
        }
    }

    /**
     * Stop the active session, if any.
     *
     * @param reason logged with the stop
     * @return the stopped session, or empty if none was active
     */
    public Optional<RecordingSession> stop(String reason) {
        RecordingSession session = active;
        if (session == null) {
            return Optional.empty();
        }
        LOG.info("Stopping recording session {} ({})", session.getSessionId(), reason);
        session.setStatus(SessionStatus.STOPPING);
        try {
            terminate(session.getProcess());
        } finally {
            session.setStatus(SessionStatus.STOPPED);
            active = null;
        }
        finalizeClip(session);
        return Optional.of(session);
    }

    /**
     * Detect a recorder that exited on its own while its session was running.
     *
     * <p>
     * Such a clip is incomplete. The session is forced to
     * {@link SessionStatus#STOPPED}; the caller should reset its detection
     * state so the next positive detection starts a fresh session.
     * </p>
     *
     * @return {@code true} if a fault was found and the session was closed
     */
    public boolean checkProcessHealth() {
        RecordingSession session = active;
        if (session == null || session.getStatus() != SessionStatus.RUNNING) {
            return false;
        }
        CaptureProcess process = session.getProcess();
        if (process.isAlive()) {
            return false;
        }
        OptionalInt exitCode = process.exitCode();
        LOG.error("Capture process exited unexpectedly (exit code {}), clip {} is incomplete",
                exitCode.isPresent() ? String.valueOf(exitCode.getAsInt()) : "unknown", session.getClipPath());
        String tail = process.diagnosticTail();
        if (tail != null && !tail.isBlank()) {
            LOG.error("Capture process output:\n{}", tail);
        }
        session.setStatus(SessionStatus.STOPPED);
        active = null;
        processFaults++;
        finalizeClip(session);
        return true;
    }

    /** Stop any active session. Never throws. */
    @Override
    public void close() {
        try {
            stop("pipeline shutting down");
        } catch (RuntimeException e) {
            LOG.error("Failed to stop recording session cleanly", e);
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public Optional<RecordingSession> activeSession() {
        return Optional.ofNullable(active);
    }

    public long getSessionsStarted() {
        return sessionsStarted;
    }

    public long getProcessFaults() {
        return processFaults;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void captureSnapshot(RecordingSession session) {
        Path target = session.getSnapshotPath();
        try {
            byte[] image = snapshotFetcher.fetch(device);
            if (image == null || image.length == 0) {
                LOG.warn("Snapshot for session {} was empty, recording continues", session.getSessionId());
                return;
            }
            Files.write(target, image);
            session.setSnapshotCaptured(true);
            LOG.info("Snapshot saved: {} ({} KB)", target, String.format("%.2f", image.length / 1024.0));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Snapshot for session {} failed, recording continues: {}",
                    session.getSessionId(), e.getMessage());
        }
    }

    private void terminate(CaptureProcess process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        boolean interrupted = false;
        try {
            try {
                process.requestGracefulStop();
            } catch (IOException e) {
                LOG.debug("Graceful stop request not delivered: {}", e.getMessage());
            }
            if (process.awaitExit(gracefulStopTimeout)) {
                return;
            }
            LOG.warn("Capture process did not exit within {}, terminating", gracefulStopTimeout);
            process.terminate();
            if (process.awaitExit(terminateTimeout)) {
                return;
            }
            LOG.warn("Capture process ignored terminate, killing");
            process.kill();
            process.awaitExit(terminateTimeout);
        } catch (InterruptedException e) {
            interrupted = true;
            LOG.warn("Interrupted while stopping capture process, killing it");
            process.kill();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void finalizeClip(RecordingSession session) {
        Path clip = session.getClipPath();
        double seconds = (time.nanoTime() - session.getStartedNanos()) / 1_000_000_000.0;
        try {
            if (!Files.exists(clip)) {
                LOG.warn("Recording file was not created: {}", clip);
                return;
            }
            long size = Files.size(clip);
            if (size == 0) {
                LOG.warn("Recording file is empty, deleting: {}", clip);
                Files.deleteIfExists(clip);
                return;
            }
            LOG.info("Video saved: {} ({} MB, {} s)", clip,
                    String.format("%.2f", size / 1024.0 / 1024.0), String.format("%.1f", seconds));
        } catch (IOException e) {
            LOG.warn("Could not inspect recording file {}: {}", clip, e.getMessage());
        }
    }
}
