package com.camsentinel.core.config;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.pipeline.PipelineSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader} and {@link WatcherConfig} validation.
 */
class ConfigLoaderTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Should load cameras and global settings from classpath")
    void shouldLoadFromClasspath() {
        WatcherConfig config = ConfigLoader.fromClasspath("test-watcher.yml");

        assertThat(config.getCameras()).hasSize(3);
        assertThat(config.getPostDetectionSeconds()).isEqualTo(20);

        List<DeviceConfig> devices = config.toDeviceConfigs();
        assertThat(devices).extracting(DeviceConfig::getName)
                .containsExactly("front-door", "garage", "attic");
        DeviceConfig garage = devices.get(1);
        assertThat(garage.getOnvifPort()).isEqualTo(8080);
        assertThat(garage.getRtspPort()).isEqualTo(554);
        assertThat(garage.getChannel()).isEqualTo(1);
        assertThat(garage.getStreamFormat()).isEqualTo("h265");
        assertThat(devices.get(2).isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should convert global section into pipeline settings")
    void shouldConvertToPipelineSettings() {
        PipelineSettings settings = ConfigLoader.fromClasspath("test-watcher.yml").toPipelineSettings();

        assertThat(settings.getPostDetectionDuration()).isEqualTo(Duration.ofSeconds(20));
        assertThat(settings.getTickInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(settings.getSubscriptionDuration()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.getOutputRoot()).isEqualTo(Path.of("/tmp/cam-sentinel-test"));
        assertThat(settings.getPersonTopic()).isEqualTo("PeopleDetect,People");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate camera names")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("duplicate-names.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Duplicate camera name: 'front-door'");
    }

    @Test
    @DisplayName("Should reject a configuration with no enabled camera")
    void shouldRejectNoEnabledCamera() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("none-enabled.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("At least one enabled camera");
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("bad-values.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("postDetectionSeconds")
                .hasMessageContaining("single path segment")
                .hasMessageContaining("channel")
                .hasMessageContaining("streamFormat 'mjpeg'");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() throws IOException {
        Path file = tmp.resolve("dup-keys.yml");
        Files.writeString(file, "postDetectionSeconds: 10\npostDetectionSeconds: 20\ncameras: []\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should reject an empty file")
    void shouldRejectEmptyFile() throws IOException {
        Path file = tmp.resolve("empty.yml");
        Files.writeString(file, "");

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("Should prefer the file named by WATCHER_CONFIG_PATH")
    void shouldPreferConfigPathVariable() throws IOException {
        Path file = tmp.resolve("watcher.yml");
        Files.writeString(file, String.join("\n",
                "postDetectionSeconds: 7",
                "cameras:",
                "  - name: porch",
                "    host: 10.0.0.5",
                "    username: admin",
                "    password: pw",
                ""));
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_CONFIG_PATH, file.toString(),
                ConfigLoader.ENV_CAMERA_HOST, "10.0.0.99");

        WatcherConfig config = ConfigLoader.load(env);

        assertThat(config.getPostDetectionSeconds()).isEqualTo(7);
        assertThat(config.toDeviceConfigs()).extracting(DeviceConfig::getName).containsExactly("porch");
    }

    @Test
    @DisplayName("Should fail when WATCHER_CONFIG_PATH points at a missing file")
    void shouldFailForMissingConfigPath() {
        Map<String, String> env = Map.of(ConfigLoader.ENV_CONFIG_PATH, tmp.resolve("nope.yml").toString());

        assertThatThrownBy(() -> ConfigLoader.load(env))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("missing file");
    }

    @Test
    @DisplayName("Should build a single camera from CAMERA_* variables")
    void shouldBuildFromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("CAMERA_HOST", "192.168.1.50");
        env.put("CAMERA_USERNAME", "admin");
        env.put("CAMERA_PASSWORD", "secret");
        env.put("CAMERA_CHANNEL", "2");
        env.put("POST_DETECTION_DURATION", "30");

        WatcherConfig config = ConfigLoader.load(env);

        assertThat(config.getPostDetectionSeconds()).isEqualTo(30);
        DeviceConfig device = config.toDeviceConfigs().get(0);
        assertThat(device.getName()).isEqualTo("camera");
        assertThat(device.getHost()).isEqualTo("192.168.1.50");
        assertThat(device.getPort()).isEqualTo(80);
        assertThat(device.getOnvifPort()).isEqualTo(8000);
        assertThat(device.getChannel()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject a non-numeric environment value")
    void shouldRejectNonNumericEnvironment() {
        Map<String, String> env = Map.of(
                "CAMERA_HOST", "192.168.1.50",
                "CAMERA_USERNAME", "admin",
                "CAMERA_PASSWORD", "secret",
                "CAMERA_PORT", "eighty");

        assertThatThrownBy(() -> ConfigLoader.load(env))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("numeric");
    }

    @Test
    @DisplayName("Should require credentials in environment mode")
    void shouldRequireCredentials() {
        Map<String, String> env = Map.of("CAMERA_HOST", "192.168.1.50");

        assertThatThrownBy(() -> ConfigLoader.load(env))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("username")
                .hasMessageContaining("password");
    }

    @Test
    @DisplayName("Should never print the password")
    void shouldMaskPassword() {
        WatcherConfig config = ConfigLoader.fromClasspath("test-watcher.yml");

        assertThat(config.toString()).doesNotContain("hunter2");
        assertThat(config.toDeviceConfigs().get(1).toString()).doesNotContain("hunter2");
    }
}
