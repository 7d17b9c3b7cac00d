package com.camsentinel.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable description of one camera the watcher supervises.
 *
 * <p>
 * The {@link #getName() name} doubles as the storage namespace: every
 * snapshot and clip of the device is written below a directory of that
 * name, so it must be unique across the configuration and safe to use as
 * a single path segment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@link Builder#build()} rejects a missing name or
 * host and out-of-range ports or channel.
 * </p>
 *
 * @since 1.0.0
 */
public final class DeviceConfig {

    /** Stream format used when none is configured. */
    public static final String DEFAULT_STREAM_FORMAT = "h264";

    private final String name;
    private final String host;
    private final int port;
    private final int onvifPort;
    private final int rtspPort;
    private final int channel;
    private final String username;
    private final String password;
    private final boolean enabled;
    private final String streamFormat;

    private DeviceConfig(Builder b) {
        this.name = b.name;
        this.host = b.host;
        this.port = b.port;
        this.onvifPort = b.onvifPort;
        this.rtspPort = b.rtspPort;
        this.channel = b.channel;
        this.username = b.username;
        this.password = b.password;
        this.enabled = b.enabled;
        this.streamFormat = b.streamFormat;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getHost() {
        return host;
    }

    /** @return HTTP port of the camera's CGI API (snapshots) */
    public int getPort() {
        return port;
    }

    public int getOnvifPort() {
        return onvifPort;
    }

    public int getRtspPort() {
        return rtspPort;
    }

    /** @return zero-based channel index */
    public int getChannel() {
        return channel;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** @return {@code h264} or {@code h265} */
    public String getStreamFormat() {
        return streamFormat;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DeviceConfig}.
     */
    public static class Builder {
        private String name;
        private String host;
        private int port = 80;
        private int onvifPort = 8000;
        private int rtspPort = 554;
        private int channel;
        private String username = "";
        private String password = "";
        private boolean enabled = true;
        private String streamFormat = DEFAULT_STREAM_FORMAT;

        public Builder name(String v) {
            this.name = v;
            return this;
        }

        public Builder host(String v) {
            this.host = v;
            return this;
        }

        public Builder port(int v) {
            this.port = v;
            return this;
        }

        public Builder onvifPort(int v) {
            this.onvifPort = v;
            return this;
        }

        public Builder rtspPort(int v) {
            this.rtspPort = v;
            return this;
        }

        public Builder channel(int v) {
            this.channel = v;
            return this;
        }

        public Builder username(String v) {
            this.username = v != null ? v : "";
            return this;
        }

        public Builder password(String v) {
            this.password = v != null ? v : "";
            return this;
        }

        public Builder enabled(boolean v) {
            this.enabled = v;
            return this;
        }

        public Builder streamFormat(String v) {
            this.streamFormat = v != null ? v.toLowerCase(Locale.ROOT) : DEFAULT_STREAM_FORMAT;
            return this;
        }

        /**
         * Build and validate the device description.
         *
         * @return a new {@link DeviceConfig}
         * @throws IllegalArgumentException if a value is missing or out of range
         */
        public DeviceConfig build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Device name must not be null or blank");
            }
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("Device '" + name + "' requires a host");
            }
            requirePort(port, "port");
            requirePort(onvifPort, "onvifPort");
            requirePort(rtspPort, "rtspPort");
            if (channel < 0) {
                throw new IllegalArgumentException(
                        "Device '" + name + "' channel must be >= 0, got: " + channel);
            }
            if (!"h264".equals(streamFormat) && !"h265".equals(streamFormat)) {
                throw new IllegalArgumentException(
                        "Device '" + name + "' streamFormat must be h264 or h265, got: " + streamFormat);
            }
            return new DeviceConfig(this);
        }

        private void requirePort(int value, String field) {
            if (value < 1 || value > 65_535) {
                throw new IllegalArgumentException(
                        "Device '" + name + "' " + field + " must be in [1, 65535], got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeviceConfig that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "DeviceConfig{" +
                "name='" + name + '\'' +
                ", host='" + host + '\'' +
                ", port=" + port +
                ", onvifPort=" + onvifPort +
                ", rtspPort=" + rtspPort +
                ", channel=" + channel +
                ", username='" + username + '\'' +
                ", enabled=" + enabled +
                ", streamFormat='" + streamFormat + '\'' +
                '}';
    }
}
