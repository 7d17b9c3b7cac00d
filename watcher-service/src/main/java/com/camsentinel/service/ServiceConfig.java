package com.camsentinel.service;

import java.time.Duration;
import java.util.Map;

/**
 * Typed, immutable process-level configuration of the watcher service.
 *
 * <p>
 * Camera and pipeline settings live in the YAML configuration
 * (see {@link com.camsentinel.core.config.ConfigLoader}); this class only holds
 * what concerns the process itself: the health endpoint, the shutdown budget
 * and timeouts for requests to the cameras. Values are resolved from
 * environment variables with sensible defaults.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for tests. The builder validates inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final boolean healthEnabled;
    private final int healthPort;

    // ---------------------------------------------------------------
    // Timeouts
    // ---------------------------------------------------------------
    private final Duration shutdownTimeout;
    private final Duration httpTimeout;

    private ServiceConfig(Builder b) {
        this.healthEnabled = b.healthEnabled;
        this.healthPort = b.healthPort;
        this.shutdownTimeout = Duration.ofSeconds(b.shutdownTimeoutSeconds);
        this.httpTimeout = Duration.ofSeconds(b.httpTimeoutSeconds);
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from the given environment.
     *
     * @param env environment variables
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment(Map<String, String> env) {
        try {
            return new Builder()
                    .healthEnabled(Boolean.parseBoolean(env(env, "HEALTH_ENABLED", "true")))
                    .healthPort(Integer.parseInt(env(env, "HEALTH_PORT", "8080")))
                    .shutdownTimeoutSeconds(Long.parseLong(env(env, "SHUTDOWN_TIMEOUT_SECONDS", "30")))
                    .httpTimeoutSeconds(Long.parseLong(env(env, "CAMERA_HTTP_TIMEOUT_SECONDS", "10")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public boolean isHealthEnabled() {
        return healthEnabled;
    }

    public int getHealthPort() {
        return healthPort;
    }

    /** @return how long shutdown waits for pipelines to finalize their recordings */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /** @return connect and request timeout for camera HTTP calls */
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the port is in
     * [0, 65535] (0 binds an ephemeral port) and that timeouts are positive.
     * </p>
     */
    public static class Builder {
        private boolean healthEnabled = true;
        private int healthPort = 8080;
        private long shutdownTimeoutSeconds = 30;
        private long httpTimeoutSeconds = 10;

        public Builder healthEnabled(boolean v) {
            this.healthEnabled = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        public Builder shutdownTimeoutSeconds(long v) {
            this.shutdownTimeoutSeconds = v;
            return this;
        }

        public Builder httpTimeoutSeconds(long v) {
            this.httpTimeoutSeconds = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in range [0, 65535], got: " + healthPort);
            }
            if (shutdownTimeoutSeconds <= 0) {
                throw new IllegalArgumentException(
                        "shutdownTimeoutSeconds must be > 0, got: " + shutdownTimeoutSeconds);
            }
            if (httpTimeoutSeconds <= 0) {
                throw new IllegalArgumentException(
                        "httpTimeoutSeconds must be > 0, got: " + httpTimeoutSeconds);
            }
            return new ServiceConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal helpers
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "healthEnabled=" + healthEnabled +
                ", healthPort=" + healthPort +
                ", shutdownTimeout=" + shutdownTimeout +
                ", httpTimeout=" + httpTimeout +
                '}';
    }
}
