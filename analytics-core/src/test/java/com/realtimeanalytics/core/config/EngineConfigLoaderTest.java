package com.realtimeanalytics.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load test config from classpath and keep defaults for missing keys")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-analytics.yml");

        assertThat(config.getWindowSizesSeconds()).containsExactly(10, 30);
        assertThat(config.getAggregationInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getAnomalyThreshold()).isEqualTo(2.5);
        assertThat(config.getMinimumSamples()).isEqualTo(5);
        assertThat(config.getRetryMaxAttempts()).isEqualTo(5);
        assertThat(config.getRetryInitialBackoff()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.getBufferOverflowThreshold()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should resolve the bundled analytics.yml to the defaults")
    void shouldLoadBundledDefaults() {
        assertThat(EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE))
                .isEqualTo(EngineConfig.defaults());
    }

    @Test
    @DisplayName("Should load a config file from the file system")
    void shouldLoadFromFile() throws IOException {
        Path file = dir.resolve("engine.yml");
        Files.writeString(file, "bufferOverflowThreshold: 50\nshutdownTimeoutMs: 2000\n");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getBufferOverflowThreshold()).isEqualTo(50);
        assertThat(config.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        assertThat(EngineConfigLoader.fromFile(file.toString())).isEqualTo(EngineConfig.defaults());
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> EngineConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should report invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-analytics.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate window size")
                .hasMessageContaining("window size must be > 0")
                .hasMessageContaining("bufferOverflowThreshold")
                .hasMessageContaining("anomalyThreshold");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("duplicate-key-analytics.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed engine configuration");
    }
}
