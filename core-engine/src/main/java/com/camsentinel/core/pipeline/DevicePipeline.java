package com.camsentinel.core.pipeline;

import com.camsentinel.core.detection.DetectionStateMachine;
import com.camsentinel.core.detection.SessionCommand;
import com.camsentinel.core.model.DetectionEvent;
import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.recording.CaptureProcessLauncher;
import com.camsentinel.core.recording.OutputLayout;
import com.camsentinel.core.recording.RecordingSession;
import com.camsentinel.core.recording.RecordingSessionManager;
import com.camsentinel.core.recording.SessionStartException;
import com.camsentinel.core.recording.SnapshotFetcher;
import com.camsentinel.core.subscription.DeviceConnectException;
import com.camsentinel.core.subscription.EventSubscriptionTransport;
import com.camsentinel.core.subscription.ExponentialBackoff;
import com.camsentinel.core.subscription.NotificationParser;
import com.camsentinel.core.subscription.SubscriptionClient;
import com.camsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One device's complete event-to-recording loop.
 *
 * <h3>Loop</h3>
 *
 * <pre>
 *   connect (with exponential backoff)
 *     → wait for the next event, at most min(tick, time until deadline)
 *     → state machine → session command → session manager
 *     → deadline check → recorder health check
 * </pre>
 *
 * <p>
 * Commands are executed synchronously on the pipeline thread, so the state
 * machine never sees a new event before the previous command has finished.
 * The deadline check keeps running while the device is disconnected, so a
 * lost connection cannot keep a recording alive.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #requestStop()} is cooperative: the loop notices within one tick
 * (backoff waits wake immediately), then closes the subscription, stops any
 * recording so its file is finalized, and only then reports
 * {@link PipelineState#STOPPED}.
 * </p>
 *
 * <p>
 * Every log line written on the pipeline thread carries the device name in
 * the {@value #MDC_DEVICE} MDC key.
 * </p>
 *
 * @since 1.0.0
 */
public class DevicePipeline implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(DevicePipeline.class);

    /** MDC key holding the device name. */
    public static final String MDC_DEVICE = "device";

    private final DeviceConfig device;
    private final SubscriptionClient client;
    private final DetectionStateMachine stateMachine;
    private final RecordingSessionManager sessions;
    private final PipelineSettings settings;
    private final TimeSource time;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile PipelineState state = PipelineState.CREATED;
    private volatile String lastError;
    private volatile long connectFailures;

    public DevicePipeline(DeviceConfig device,
            SubscriptionClient client,
            DetectionStateMachine stateMachine,
            RecordingSessionManager sessions,
            PipelineSettings settings,
            TimeSource time) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.time = Objects.requireNonNull(time, "time must not be null");
    }

    /**
     * Wire a pipeline from its external collaborators.
     *
     * @param device          the device
     * @param settings        shared pipeline settings
     * @param transport       event protocol implementation
     * @param snapshotFetcher snapshot collaborator
     * @param launcher        capture process collaborator
     * @param time            clock source
     * @param zone            zone used for artifact names
     * @return a pipeline ready to {@link #run()}
     */
    public static DevicePipeline assemble(DeviceConfig device,
            PipelineSettings settings,
            EventSubscriptionTransport transport,
            SnapshotFetcher snapshotFetcher,
            CaptureProcessLauncher launcher,
            TimeSource time,
            ZoneId zone) {
        SubscriptionClient client = new SubscriptionClient(device, transport,
                new NotificationParser(settings.getPersonTopic()), time,
                settings.getSubscriptionDuration(), settings.getRenewMargin(), settings.getPullMessageLimit());
        DetectionStateMachine stateMachine = new DetectionStateMachine(device.getName(),
                settings.getPostDetectionDuration());
        RecordingSessionManager sessions = new RecordingSessionManager(device,
                new OutputLayout(settings.getOutputRoot(), device, zone), snapshotFetcher, launcher, time,
                settings.getGracefulStopTimeout(), settings.getTerminateTimeout());
        return new DevicePipeline(device, client, stateMachine, sessions, settings, time);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Run until {@link #requestStop()} is called.
     *
     * @throws PipelineFailureException if the configured reconnect attempts
     *                                  are exhausted
     */
    @Override
    public void run() {
        MDC.put(MDC_DEVICE, device.getName());
        boolean failed = false;
        try {
            LOG.info("Pipeline started for {}:{} channel {}", device.getHost(), device.getOnvifPort(),
                    device.getChannel());
            loop();
        } catch (RuntimeException e) {
            failed = true;
            lastError = e.getMessage();
            throw e;
        } finally {
            shutdown(failed);
            MDC.remove(MDC_DEVICE);
        }
    }

    /**
     * Ask the pipeline to stop. Returns immediately; use
     * {@link #awaitStopped(Duration)} to wait for completion.
     */
    public void requestStop() {
        stopSignal.countDown();
    }

    /**
     * @param timeout maximum wait
     * @return {@code true} if the pipeline finished its shutdown in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    public DeviceConfig getDevice() {
        return device;
    }

    public PipelineState getState() {
        return state;
    }

    public PipelineStatus status() {
        String sessionId = sessions.activeSession().map(RecordingSession::getSessionId).orElse(null);
        return new PipelineStatus(device.getName(), state, sessionId, sessions.getSessionsStarted(),
                sessions.getProcessFaults(), connectFailures, 0, lastError);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void loop() {
        ExponentialBackoff backoff = new ExponentialBackoff(settings.getBackoffBase(), settings.getBackoffMax());

        while (!isStopRequested()) {
            if (!client.isConnected()) {
                state = PipelineState.CONNECTING;
                try {
                    client.connect();
                    state = PipelineState.WATCHING;
                } catch (DeviceConnectException e) {
                    retryLater(backoff, "Connect attempt", e);
                    continue;
                }
            }

            try {
                Optional<DetectionEvent> event = client.nextEvent(nextWait());
                backoff.reset();
                if (event.isPresent()) {
                    apply(stateMachine.onEvent(event.get()));
                }
            } catch (DeviceConnectException e) {
                retryLater(backoff, "Event subscription lost, attempt", e);
                continue;
            }
            checkDeadlineAndHealth();
        }
    }

    /**
     * Count a failed connect or receive, give up once the attempt limit is
     * reached, otherwise wait out the next backoff delay.
     */
    private void retryLater(ExponentialBackoff backoff, String what, DeviceConnectException e) {
        connectFailures++;
        lastError = e.getMessage();
        Duration delay = backoff.nextDelay();
        LOG.warn("{} {} failed: {} (retrying in {} ms)",
                what, backoff.failures(), e.getMessage(), delay.toMillis());
        int max = settings.getMaxReconnectAttempts();
        if (max > 0 && backoff.failures() >= max) {
            throw new PipelineFailureException(
                    "Gave up on '" + device.getName() + "' after " + max + " connect attempts", e);
        }
        state = PipelineState.RECONNECTING;
        idle(delay);
    }

    /** Waits out a backoff delay while keeping the deadline check alive. */
    private void idle(Duration delay) {
        long remaining = delay.toNanos();
        while (remaining > 0 && !isStopRequested()) {
            long wait = Math.max(1, Math.min(remaining, nextWait().toNanos()));
            try {
                if (stopSignal.await(wait, TimeUnit.NANOSECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestStop();
                return;
            }
            remaining -= wait;
            checkDeadlineAndHealth();
        }
    }

    private Duration nextWait() {
        Duration tick = settings.getTickInterval();
        return stateMachine.timeUntilDeadline(time.nanoTime())
                .filter(untilDeadline -> untilDeadline.compareTo(tick) < 0)
                .orElse(tick);
    }

    private void checkDeadlineAndHealth() {
        apply(stateMachine.checkDeadline(time.nanoTime(), time.now()));
        if (sessions.checkProcessHealth()) {
            lastError = "capture process exited unexpectedly";
            stateMachine.reset();
        }
    }

    private void apply(Optional<SessionCommand> command) {
        if (command.isEmpty()) {
            return;
        }
        try {
            sessions.handle(command.get());
        } catch (SessionStartException e) {
            lastError = e.getMessage();
            LOG.error("Recording session could not start, next detection retries: {}", e.getMessage(), e);
            stateMachine.reset();
        }
    }

    private void shutdown(boolean failed) {
        state = PipelineState.STOPPING;
        try {
            client.close();
        } finally {
            sessions.close();
            state = failed ? PipelineState.FAILED : PipelineState.STOPPED;
            LOG.info("Pipeline {}", failed ? "failed" : "stopped");
            finished.countDown();
        }
    }
}
