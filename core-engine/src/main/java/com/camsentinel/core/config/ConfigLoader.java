package com.camsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads and validates {@link WatcherConfig}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Single-camera environment mode when {@value #ENV_CAMERA_HOST} is set</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*} method calls {@link WatcherConfig#validate()} so the
 * watcher <strong>fails fast</strong> before any device pipeline starts.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable pointing at a YAML configuration file. */
    public static final String ENV_CONFIG_PATH = "WATCHER_CONFIG_PATH";

    /** Presence of this variable selects the single-camera environment mode. */
    public static final String ENV_CAMERA_HOST = "CAMERA_HOST";

    static final String DEFAULT_RESOURCE = "watcher.yml";

    private ConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution against the process
     * environment.
     *
     * @return parsed and validated configuration
     * @throws ConfigException if the configuration is missing or invalid
     */
    public static WatcherConfig load() {
        return load(System.getenv());
    }

    /**
     * Load the configuration using automatic resolution against the given
     * environment.
     *
     * @param env environment variables; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigException if the configuration is missing or invalid
     */
    public static WatcherConfig load(Map<String, String> env) {
        Objects.requireNonNull(env, "Environment must not be null");
        String envPath = env.get(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank()) {
            if (!Files.exists(Path.of(envPath))) {
                throw new ConfigException(ENV_CONFIG_PATH + " points at a missing file: " + envPath);
            }
            LOG.info("Loading watcher configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        String host = env.get(ENV_CAMERA_HOST);
        if (host != null && !host.isBlank()) {
            LOG.info("Loading single-camera configuration from environment");
            return fromEnvironment(env);
        }
        LOG.info("Loading watcher configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigException if the file is missing, unreadable or invalid
     */
    public static WatcherConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new ConfigException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigException if the resource is missing, unreadable or invalid
     */
    public static WatcherConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new ConfigException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Build a single-camera configuration from {@code CAMERA_*} variables.
     *
     * <p>
     * Recognised variables: {@code CAMERA_HOST}, {@code CAMERA_USERNAME},
     * {@code CAMERA_PASSWORD}, {@code CAMERA_PORT} (80), {@code CAMERA_ONVIF_PORT}
     * (8000), {@code CAMERA_RTSP_PORT} (554), {@code CAMERA_CHANNEL} (0),
     * {@code CAMERA_NAME} ("camera"), {@code CAMERA_STREAM_FORMAT} (h264),
     * {@code POST_DETECTION_DURATION} (15), {@code OUTPUT_ROOT}
     * ({@code ./recordings}) and {@code FFMPEG_PATH} (ffmpeg).
     * </p>
     *
     * @param env environment variables
     * @return validated configuration with exactly one camera
     * @throws ConfigException if a value is missing, not numeric or invalid
     */
    public static WatcherConfig fromEnvironment(Map<String, String> env) {
        try {
            CameraEntry camera = new CameraEntry();
            camera.setName(env(env, "CAMERA_NAME", "camera"));
            camera.setHost(env(env, ENV_CAMERA_HOST, null));
            camera.setUsername(env(env, "CAMERA_USERNAME", null));
            camera.setPassword(env(env, "CAMERA_PASSWORD", null));
            camera.setPort(Integer.parseInt(env(env, "CAMERA_PORT", "80")));
            camera.setOnvifPort(Integer.parseInt(env(env, "CAMERA_ONVIF_PORT", "8000")));
            camera.setRtspPort(Integer.parseInt(env(env, "CAMERA_RTSP_PORT", "554")));
            camera.setChannel(Integer.parseInt(env(env, "CAMERA_CHANNEL", "0")));
            camera.setStreamFormat(env(env, "CAMERA_STREAM_FORMAT", "h264"));

            WatcherConfig config = new WatcherConfig();
            config.setPostDetectionSeconds(Integer.parseInt(env(env, "POST_DETECTION_DURATION", "15")));
            config.setOutputRoot(env(env, "OUTPUT_ROOT", "./recordings"));
            config.setFfmpegPath(env(env, "FFMPEG_PATH", "ffmpeg"));
            config.setCameras(List.of(camera));
            config.validate();
            return config;
        } catch (NumberFormatException e) {
            throw new ConfigException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static WatcherConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(WatcherConfig.class, options));
        WatcherConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigException("Malformed watcher configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigException("Watcher configuration is empty");
        }

        // Fail fast if anything is misconfigured
        config.validate();

        LOG.info("Loaded {} camera(s), {} enabled", config.getCameras().size(),
                config.getCameras().stream().filter(CameraEntry::isEnabled).count());
        return config;
    }

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }
}
