package com.camsentinel.core.pipeline;

import com.camsentinel.core.config.ConfigException;
import com.camsentinel.core.model.DeviceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs one {@link DevicePipeline} per enabled device, each on its own
 * thread.
 *
 * <h3>Fault Isolation</h3>
 * <p>
 * Pipelines share no mutable state. When one fails, the failure is logged
 * and, if {@link PipelineSettings#isRestartOnFailure()} is set, a fresh
 * pipeline for that device is created after the restart delay; otherwise the
 * device stays {@link PipelineState#FAILED}. Other devices are not affected
 * either way.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #stop(Duration)} asks every pipeline to stop and waits until each
 * has closed its subscription and finalized its recording.
 * </p>
 *
 * @since 1.0.0
 */
public class CameraSupervisor {

    private static final Logger LOG = LoggerFactory.getLogger(CameraSupervisor.class);

    private final List<DeviceConfig> devices;
    private final PipelineSettings settings;
    private final DevicePipelineFactory factory;

    private final Map<String, DevicePipeline> current = new ConcurrentHashMap<>();
    private final Map<String, PipelineStatus> finalStatus = new ConcurrentHashMap<>();
    private final Map<String, Integer> restarts = new ConcurrentHashMap<>();
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile CountDownLatch terminated;
    private volatile boolean stopping;
    private volatile List<DeviceConfig> enabled = List.of();

    /**
     * @param devices  every configured device, enabled or not
     * @param settings shared pipeline settings
     * @param factory  creates a pipeline per device
     */
    public CameraSupervisor(List<DeviceConfig> devices, PipelineSettings settings, DevicePipelineFactory factory) {
        Objects.requireNonNull(devices, "devices must not be null");
        this.devices = Collections.unmodifiableList(new ArrayList<>(devices));
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Validate the device list and start one pipeline thread per enabled
     * device.
     *
     * @throws ConfigException       if names are not unique or no device is
     *                               enabled; nothing is started in that case
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (terminated != null) {
            throw new IllegalStateException("Supervisor already started");
        }
        validate(devices);
        enabled = devices.stream().filter(DeviceConfig::isEnabled).toList();
        devices.stream()
                .filter(d -> !d.isEnabled())
                .forEach(d -> LOG.info("Device '{}' is disabled, not watching it", d.getName()));

        terminated = new CountDownLatch(enabled.size());
        LOG.info("Starting {} device pipeline(s) with {}", enabled.size(), settings);
        for (DeviceConfig device : enabled) {
            Thread thread = new Thread(() -> supervise(device), "pipeline-" + device.getName());
            thread.start();
        }
    }

    /**
     * Stop every pipeline and wait for all of them to finish.
     *
     * @param timeout maximum total wait
     * @return {@code true} if every pipeline acknowledged in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        LOG.info("Stopping all device pipelines");
        stopping = true;
        stopSignal.countDown();
        current.values().forEach(DevicePipeline::requestStop);

        CountDownLatch latch = terminated;
        if (latch == null) {
            return true;
        }
        boolean done = latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (done) {
            LOG.info("All device pipelines stopped");
        } else {
            LOG.warn("{} device pipeline(s) did not stop within {}", latch.getCount(), timeout);
        }
        return done;
    }

    /**
     * Block until every pipeline has ended, either by {@link #stop(Duration)}
     * or by failing without restart.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitTermination() throws InterruptedException {
        CountDownLatch latch = terminated;
        if (latch == null) {
            throw new IllegalStateException("Supervisor not started");
        }
        latch.await();
    }

    // ---------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------

    /**
     * @return one status per enabled device, in configuration order
     */
    public List<PipelineStatus> statuses() {
        List<PipelineStatus> result = new ArrayList<>();
        for (DeviceConfig device : enabled) {
            String name = device.getName();
            DevicePipeline pipeline = current.get(name);
            PipelineStatus status = pipeline != null
                    ? pipeline.status()
                    : finalStatus.getOrDefault(name,
                            new PipelineStatus(name, PipelineState.CREATED, null, 0, 0, 0, 0, null));
            result.add(status.withRestarts(restarts.getOrDefault(name, 0)));
        }
        return result;
    }

    /**
     * @return {@code true} if every enabled device ended up
     *         {@link PipelineState#FAILED}
     */
    public boolean allFailed() {
        List<PipelineStatus> statuses = statuses();
        return !statuses.isEmpty()
                && statuses.stream().allMatch(s -> s.getState() == PipelineState.FAILED);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static void validate(List<DeviceConfig> devices) {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (DeviceConfig device : devices) {
            if (!names.add(device.getName())) {
                errors.add("Duplicate device name: '" + device.getName() + "'");
            }
        }
        if (devices.stream().noneMatch(DeviceConfig::isEnabled)) {
            errors.add("At least one enabled device is required");
        }
        if (!errors.isEmpty()) {
            throw new ConfigException("Cannot start supervisor: " + String.join("; ", errors));
        }
    }

    private void supervise(DeviceConfig device) {
        String name = device.getName();
        MDC.put(DevicePipeline.MDC_DEVICE, name);
        try {
            while (!stopping) {
                DevicePipeline pipeline;
                try {
                    pipeline = factory.create(device);
                } catch (RuntimeException e) {
                    LOG.error("Could not create pipeline: {}", e.getMessage(), e);
                    finalStatus.put(name, new PipelineStatus(name, PipelineState.FAILED, null, 0, 0, 0, 0,
                            e.getMessage()));
                    if (!awaitRestart(name)) {
                        return;
                    }
                    continue;
                }

                current.put(name, pipeline);
                if (stopping) {
                    pipeline.requestStop();
                }
                try {
                    pipeline.run();
                } catch (RuntimeException e) {
                    LOG.error("Pipeline failed: {}", e.getMessage(), e);
                } finally {
                    finalStatus.put(name, pipeline.status());
                    current.remove(name, pipeline);
                }

                if (stopping || pipeline.getState() != PipelineState.FAILED) {
                    return;
                }
                if (!awaitRestart(name)) {
                    return;
                }
            }
        } finally {
            MDC.remove(DevicePipeline.MDC_DEVICE);
            terminated.countDown();
        }
    }

    /** @return {@code true} if the pipeline should be started again */
    private boolean awaitRestart(String name) {
        if (!settings.isRestartOnFailure()) {
            LOG.error("Pipeline left stopped, restart on failure is disabled");
            return false;
        }
        int attempt = restarts.merge(name, 1, Integer::sum);
        Duration delay = settings.getRestartDelay();
        LOG.warn("Restarting pipeline in {} ms (restart #{})", delay.toMillis(), attempt);
        try {
            return !stopSignal.await(delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
