package com.camsentinel.core.recording;

import com.camsentinel.core.model.DeviceConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Allocates output paths for a device's recording sessions.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 *   &lt;root&gt;/&lt;device&gt;/snapshots/person_detection_20240131_174502_123.jpg
 *   &lt;root&gt;/&lt;device&gt;/clips/person_detection_20240131_174502_123_ch0.mp4
 * </pre>
 *
 * <p>
 * Names sort chronologically to the millisecond. When two sessions start within the same
 * millisecond, or a file of that name already exists, a {@code -2},
 * {@code -3}, ... suffix is appended to the timestamp, so a new session never
 * reuses an earlier session's files.
 * </p>
 *
 * <p>
 * One instance per device; not thread-safe.
 * </p>
 */
public class OutputLayout {

    static final String PREFIX = "person_detection_";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path deviceRoot;
    private final ZoneId zone;
    private final int channel;

    private String lastStamp;
    private int lastSuffix;

    /**
     * @param outputRoot root directory shared by all devices
     * @param device     the device whose namespace this layout manages
     * @param zone       time zone used to render timestamps
     */
    public OutputLayout(Path outputRoot, DeviceConfig device, ZoneId zone) {
        Objects.requireNonNull(outputRoot, "outputRoot must not be null");
        Objects.requireNonNull(device, "device must not be null");
        this.deviceRoot = outputRoot.resolve(device.getName());
        this.channel = device.getChannel();
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public Path snapshotDir() {
        return deviceRoot.resolve("snapshots");
    }

    public Path clipDir() {
        return deviceRoot.resolve("clips");
    }

    /**
     * Reserve paths for a session that starts at {@code at}.
     *
     * @param at session start time
     * @return paths no earlier session of this device has used
     * @throws IOException if the directories cannot be created
     */
    public ArtifactPaths allocate(Instant at) throws IOException {
        Objects.requireNonNull(at, "at must not be null");
        Files.createDirectories(snapshotDir());
        Files.createDirectories(clipDir());

        String stamp = STAMP.withZone(zone).format(at);
        int suffix = stamp.equals(lastStamp) ? lastSuffix + 1 : 1;
        while (true) {
            String name = PREFIX + stamp + (suffix > 1 ? "-" + suffix : "");
            Path snapshot = snapshotDir().resolve(name + ".jpg");
            Path clip = clipDir().resolve(name + "_ch" + channel + ".mp4");
            if (!Files.exists(snapshot) && !Files.exists(clip)) {
                lastStamp = stamp;
                lastSuffix = suffix;
                return new ArtifactPaths(name, snapshot, clip);
            }
            suffix++;
        }
    }
}
