package com.camsentinel.service;

import com.camsentinel.core.config.ConfigLoader;
import com.camsentinel.core.config.WatcherConfig;
import com.camsentinel.core.pipeline.CameraSupervisor;
import com.camsentinel.core.pipeline.DevicePipeline;
import com.camsentinel.core.pipeline.PipelineSettings;
import com.camsentinel.core.time.TimeSource;
import com.camsentinel.service.capture.FfmpegCaptureLauncher;
import com.camsentinel.service.capture.HttpSnapshotFetcher;
import com.camsentinel.service.onvif.OnvifPullPointTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.ZoneId;

/**
 * Main entry point of the Cam Sentinel watcher.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   ONVIF PullPoint events (per camera)
 *     → person presence → detection state machine
 *     → recording session (ffmpeg stream copy + one snapshot)
 *     → &lt;outputRoot&gt;/&lt;camera&gt;/{clips,snapshots}
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Cameras and pipeline settings come from {@link ConfigLoader}; process
 * settings (health port, shutdown budget, HTTP timeouts) from
 * {@link ServiceConfig}.
 * </p>
 *
 * <h3>Exit Codes</h3>
 * <ul>
 * <li>{@code 0}: stopped by a signal, recordings finalized</li>
 * <li>{@code 1}: every camera pipeline failed</li>
 * <li>{@code 2}: invalid configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class CamSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(CamSentinelService.class);

    private CamSentinelService() {
        // entry-point class
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig serviceConfig;
        WatcherConfig config;
        try {
            serviceConfig = ServiceConfig.fromEnvironment();
            config = ConfigLoader.load();
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        LOG.info("Starting Cam Sentinel with {} and {}", serviceConfig, config);

        // 2. Wire the supervisor
        CameraSupervisor supervisor = createSupervisor(config, serviceConfig);

        // 3. Health server for container liveness checks
        HealthServer healthServer = new HealthServer(supervisor::statuses);
        if (serviceConfig.isHealthEnabled()) {
            healthServer.start(serviceConfig.getHealthPort());
        }

        // 4. Finalize recordings on SIGTERM / Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            try {
                supervisor.stop(serviceConfig.getShutdownTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for pipelines to stop");
            } finally {
                healthServer.stop();
            }
        }, "cam-sentinel-shutdown"));

        // 5. Run until every pipeline has ended
        supervisor.start();
        supervisor.awaitTermination();

        if (supervisor.allFailed()) {
            LOG.error("Every camera pipeline failed, exiting");
            healthServer.stop();
            System.exit(1);
        }
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for readability and testability)
    // ---------------------------------------------------------------

    static CameraSupervisor createSupervisor(WatcherConfig config, ServiceConfig serviceConfig) {
        PipelineSettings settings = config.toPipelineSettings();
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(serviceConfig.getHttpTimeout())
                .build();

        OnvifPullPointTransport transport = new OnvifPullPointTransport(http, serviceConfig.getHttpTimeout());
        HttpSnapshotFetcher snapshots = new HttpSnapshotFetcher(http, serviceConfig.getHttpTimeout());
        FfmpegCaptureLauncher launcher = new FfmpegCaptureLauncher(config.getFfmpegPath(), config.getAudioCodec());
        ZoneId zone = ZoneId.systemDefault();

        return new CameraSupervisor(config.toDeviceConfigs(), settings,
                device -> DevicePipeline.assemble(device, settings, transport, snapshots, launcher,
                        TimeSource.SYSTEM, zone));
    }
}
