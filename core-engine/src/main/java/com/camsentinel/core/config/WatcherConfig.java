package com.camsentinel.core.config;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.pipeline.PipelineSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the watcher YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * postDetectionSeconds: 15
 * outputRoot: /recordings
 * cameras:
 *   - name: front
 *     host: 192.168.1.20
 *     username: admin
 *     password: secret
 *     channel: 0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; the watcher must not start with an
 * invalid configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class WatcherConfig {

    private int postDetectionSeconds = 15;
    private String outputRoot = "./recordings";
    private long tickMillis = 1_000;
    private int subscriptionSeconds = 60;
    private int renewMarginSeconds = 10;
    private long backoffBaseMillis = 1_000;
    private long backoffMaxMillis = 60_000;
    private int maxReconnectAttempts;
    private boolean restartOnFailure = true;
    private int restartDelaySeconds = 30;
    private int gracefulStopSeconds = 10;
    private String ffmpegPath = "ffmpeg";
    private String audioCodec = "copy";
    private String personTopic = "PeopleDetect";
    private List<CameraEntry> cameras = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the global settings and every camera entry.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws ConfigException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (postDetectionSeconds <= 0) {
            errors.add("'postDetectionSeconds' must be > 0, got: " + postDetectionSeconds);
        }
        if (tickMillis <= 0) {
            errors.add("'tickMillis' must be > 0, got: " + tickMillis);
        }
        if (subscriptionSeconds <= 0) {
            errors.add("'subscriptionSeconds' must be > 0, got: " + subscriptionSeconds);
        }
        if (renewMarginSeconds < 0 || renewMarginSeconds >= subscriptionSeconds) {
            errors.add("'renewMarginSeconds' must be in [0, subscriptionSeconds), got: "
                    + renewMarginSeconds);
        }
        if (backoffBaseMillis <= 0 || backoffMaxMillis < backoffBaseMillis) {
            errors.add("'backoffBaseMillis' must be > 0 and <= 'backoffMaxMillis'");
        }
        if (maxReconnectAttempts < 0) {
            errors.add("'maxReconnectAttempts' must be >= 0, got: " + maxReconnectAttempts);
        }
        if (restartDelaySeconds < 0) {
            errors.add("'restartDelaySeconds' must be >= 0, got: " + restartDelaySeconds);
        }
        if (gracefulStopSeconds <= 0) {
            errors.add("'gracefulStopSeconds' must be > 0, got: " + gracefulStopSeconds);
        }
        if (outputRoot == null || outputRoot.isBlank()) {
            errors.add("'outputRoot' is required");
        }
        if (ffmpegPath == null || ffmpegPath.isBlank()) {
            errors.add("'ffmpegPath' is required");
        }
        if (audioCodec == null || audioCodec.isBlank()) {
            errors.add("'audioCodec' is required");
        }
        if (personTopic == null || personTopic.isBlank()) {
            errors.add("'personTopic' is required");
        }

        Set<String> names = new HashSet<>();
        boolean anyEnabled = false;
        for (int i = 0; i < cameras.size(); i++) {
            CameraEntry camera = cameras.get(i);
            if (camera == null) {
                errors.add("Camera at index " + i + " is null");
                continue;
            }
            errors.addAll(camera.validationErrors());
            if (camera.getName() != null && !names.add(camera.getName())) {
                errors.add("Duplicate camera name: '" + camera.getName() + "'");
            }
            anyEnabled |= camera.isEnabled();
        }
        if (!anyEnabled) {
            errors.add("At least one enabled camera is required");
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Watcher configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * @return immutable device descriptions for every camera, enabled or not
     */
    public List<DeviceConfig> toDeviceConfigs() {
        return cameras.stream()
                .map(CameraEntry::toDeviceConfig)
                .toList();
    }

    /**
     * @return typed pipeline settings derived from the global section
     */
    public PipelineSettings toPipelineSettings() {
        return PipelineSettings.builder()
                .postDetectionDuration(Duration.ofSeconds(postDetectionSeconds))
                .tickInterval(Duration.ofMillis(tickMillis))
                .subscriptionDuration(Duration.ofSeconds(subscriptionSeconds))
                .renewMargin(Duration.ofSeconds(renewMarginSeconds))
                .backoffBase(Duration.ofMillis(backoffBaseMillis))
                .backoffMax(Duration.ofMillis(backoffMaxMillis))
                .maxReconnectAttempts(maxReconnectAttempts)
                .restartOnFailure(restartOnFailure)
                .restartDelay(Duration.ofSeconds(restartDelaySeconds))
                .gracefulStopTimeout(Duration.ofSeconds(gracefulStopSeconds))
                .outputRoot(Path.of(outputRoot))
                .personTopic(personTopic)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getPostDetectionSeconds() {
        return postDetectionSeconds;
    }

    public void setPostDetectionSeconds(int postDetectionSeconds) {
        this.postDetectionSeconds = postDetectionSeconds;
    }

    public String getOutputRoot() {
        return outputRoot;
    }

    public void setOutputRoot(String outputRoot) {
        this.outputRoot = outputRoot;
    }

    public long getTickMillis() {
        return tickMillis;
    }

    public void setTickMillis(long tickMillis) {
        this.tickMillis = tickMillis;
    }

    public int getSubscriptionSeconds() {
        return subscriptionSeconds;
    }

    public void setSubscriptionSeconds(int subscriptionSeconds) {
        this.subscriptionSeconds = subscriptionSeconds;
    }

    public int getRenewMarginSeconds() {
        return renewMarginSeconds;
    }

    public void setRenewMarginSeconds(int renewMarginSeconds) {
        this.renewMarginSeconds = renewMarginSeconds;
    }

    public long getBackoffBaseMillis() {
        return backoffBaseMillis;
    }

    public void setBackoffBaseMillis(long backoffBaseMillis) {
        this.backoffBaseMillis = backoffBaseMillis;
    }

    public long getBackoffMaxMillis() {
        return backoffMaxMillis;
    }

    public void setBackoffMaxMillis(long backoffMaxMillis) {
        this.backoffMaxMillis = backoffMaxMillis;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public boolean isRestartOnFailure() {
        return restartOnFailure;
    }

    public void setRestartOnFailure(boolean restartOnFailure) {
        this.restartOnFailure = restartOnFailure;
    }

    public int getRestartDelaySeconds() {
        return restartDelaySeconds;
    }

    public void setRestartDelaySeconds(int restartDelaySeconds) {
        this.restartDelaySeconds = restartDelaySeconds;
    }

    public int getGracefulStopSeconds() {
        return gracefulStopSeconds;
    }

    public void setGracefulStopSeconds(int gracefulStopSeconds) {
        this.gracefulStopSeconds = gracefulStopSeconds;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getAudioCodec() {
        return audioCodec;
    }

    public void setAudioCodec(String audioCodec) {
        this.audioCodec = audioCodec;
    }

    public String getPersonTopic() {
        return personTopic;
    }

    public void setPersonTopic(String personTopic) {
        this.personTopic = personTopic;
    }

    /**
     * Return the camera list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of camera entries
     */
    public List<CameraEntry> getCameras() {
        return Collections.unmodifiableList(cameras);
    }

    /**
     * Set the camera list (used by SnakeYAML during deserialization).
     *
     * @param cameras the camera entries
     */
    public void setCameras(List<CameraEntry> cameras) {
        this.cameras = cameras != null ? new ArrayList<>(cameras) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "WatcherConfig{" +
                "postDetectionSeconds=" + postDetectionSeconds +
                ", outputRoot='" + outputRoot + '\'' +
                ", tickMillis=" + tickMillis +
                ", personTopic='" + personTopic + '\'' +
                ", cameras=" + cameras +
                '}';
    }
}
