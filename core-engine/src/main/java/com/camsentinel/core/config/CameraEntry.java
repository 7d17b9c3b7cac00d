package com.camsentinel.core.config;

import com.camsentinel.core.model.DeviceConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One camera descriptor as written in the YAML configuration.
 *
 * <p>
 * Mutable so SnakeYAML can populate it; converted into an immutable
 * {@link DeviceConfig} by {@link #toDeviceConfig()} once validated.
 * </p>
 *
 * @since 1.0.0
 */
public class CameraEntry {

    /** Names end up as directory names, so keep them to one safe path segment. */
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private String name;
    private String host;
    private int port = 80;
    private int onvifPort = 8000;
    private int rtspPort = 554;
    private int channel;
    private String username;
    private String password;
    private boolean enabled = true;
    private String streamFormat = DeviceConfig.DEFAULT_STREAM_FORMAT;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Collect every problem with this entry.
     *
     * @return list of human-readable errors, empty when the entry is valid
     */
    public List<String> validationErrors() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Camera 'name' is required");
        } else if (!SAFE_NAME.matcher(name).matches() || name.contains("..")) {
            errors.add("Camera name '" + name + "' must be a single path segment of [A-Za-z0-9._-]");
        }
        if (host == null || host.isBlank()) {
            errors.add("Camera '" + name + "' requires 'host'");
        }
        if (username == null || username.isBlank()) {
            errors.add("Camera '" + name + "' requires 'username'");
        }
        if (password == null) {
            errors.add("Camera '" + name + "' requires 'password'");
        }
        checkPort(errors, "port", port);
        checkPort(errors, "onvifPort", onvifPort);
        checkPort(errors, "rtspPort", rtspPort);
        if (channel < 0) {
            errors.add("Camera '" + name + "' requires 'channel' >= 0");
        }
        if (!"h264".equals(streamFormat) && !"h265".equals(streamFormat)) {
            errors.add("Camera '" + name + "' has unknown streamFormat '" + streamFormat
                    + "'. Supported: h264, h265");
        }
        return errors;
    }

    private void checkPort(List<String> errors, String field, int value) {
        if (value < 1 || value > 65_535) {
            errors.add("Camera '" + name + "' requires '" + field + "' in [1, 65535], got: " + value);
        }
    }

    /**
     * @return immutable device description
     * @throws IllegalArgumentException if the entry is invalid
     */
    public DeviceConfig toDeviceConfig() {
        return DeviceConfig.builder()
                .name(name)
                .host(host)
                .port(port)
                .onvifPort(onvifPort)
                .rtspPort(rtspPort)
                .channel(channel)
                .username(username)
                .password(password)
                .enabled(enabled)
                .streamFormat(streamFormat)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public int getOnvifPort() {
        return onvifPort;
    }

    public void setOnvifPort(int onvifPort) {
        this.onvifPort = onvifPort;
    }

    public int getRtspPort() {
        return rtspPort;
    }

    public void setRtspPort(int rtspPort) {
        this.rtspPort = rtspPort;
    }

    public int getChannel() {
        return channel;
    }

    public void setChannel(int channel) {
        this.channel = channel;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStreamFormat() {
        return streamFormat;
    }

    public void setStreamFormat(String streamFormat) {
        this.streamFormat = streamFormat != null
                ? streamFormat.toLowerCase(Locale.ROOT)
                : DeviceConfig.DEFAULT_STREAM_FORMAT;
    }

    @Override
    public String toString() {
        return "CameraEntry{name='" + name + "', host='" + host + "', channel=" + channel
                + ", enabled=" + enabled + '}';
    }
}
