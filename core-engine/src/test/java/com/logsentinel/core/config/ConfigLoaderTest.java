package com.logsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load the bundled sentinel.yml with documented defaults")
    void shouldLoadDefaultResource() {
        SentinelConfig config = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getFilter().getSpikeFactor()).isEqualTo(3.0);
        assertThat(config.getFilter().getAbsoluteMinThreshold()).isEqualTo(10);
        assertThat(config.getFilter().getRecurringWindowHours()).isEqualTo(24);
        assertThat(config.getStore().getType()).isEqualTo("memory");
        assertThat(config.getStore().getRetentionHours()).isEqualTo(48);
        assertThat(config.getStore().getDedupWindowHours()).isEqualTo(1);
        assertThat(config.getStore().getClaimLeaseMillis()).isEqualTo(30_000);
        assertThat(config.getFilter().getMaxClockSkewSeconds()).isEqualTo(300);
        assertThat(config.getPublisher().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should override only the keys present and keep defaults for the rest")
    void shouldMergePartialConfig() {
        SentinelConfig config = ConfigLoader.fromClasspath("sentinel-test.yml");

        assertThat(config.getFilter().getSpikeFactor()).isEqualTo(2.5);
        assertThat(config.getFilter().getAbsoluteMinThreshold()).isEqualTo(20);
        assertThat(config.getFilter().getRecurringMinThreshold()).isEqualTo(8);
        assertThat(config.getFilter().getDecisionLookbackHours()).isEqualTo(24);
        assertThat(config.getStore().getType()).isEqualTo("file");
        assertThat(config.getStore().getRetentionHours()).isEqualTo(24);
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(config.getRetry().getBackoffMultiplier()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldCollectAllValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("sentinel-invalid.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("filter.spikeFactor")
                .hasMessageContaining("filter.absoluteMinThreshold")
                .hasMessageContaining("store.directory")
                .hasMessageContaining("store.retentionHours");
    }

    @Test
    @DisplayName("Should reject unknown keys instead of ignoring a typo")
    void shouldRejectUnknownKeys() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("sentinel-unknown-key.yml"))
                .hasMessageContaining("spikeFactr");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("empty.yml"), "");

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getFilter().getSpikeFactor()).isEqualTo(3.0);
        assertThat(config.getStore().getType()).isEqualTo("memory");
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("sentinel.yml"),
                "store:\n  type: FILE\n  directory: " + tempDir.resolve("data") + "\n");

        SentinelConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getStore().getType()).isEqualTo("file");
        assertThat(config.getStore().getDirectory()).endsWith("data");
    }

    @Test
    @DisplayName("Should throw when the file or resource does not exist")
    void shouldThrowForMissingSources() {
        assertThatThrownBy(() -> ConfigLoader.fromFile(tempDir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should require the recurring floor to sit below the volume floor")
    void shouldRejectRecurringFloorAboveVolumeFloor() {
        FilterPolicy policy = new FilterPolicy();
        policy.setAbsoluteMinThreshold(5);
        policy.setRecurringMinThreshold(5);

        assertThatThrownBy(policy::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("recurringMinThreshold");
    }

    @Test
    @DisplayName("Should require the claim lease to be shorter than the dedup window")
    void shouldRejectClaimLeaseOutlivingDedupWindow() {
        SentinelConfig config = new SentinelConfig();
        config.getStore().setClaimLeaseMillis(3_600_000);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("claimLeaseMillis");
    }
}
