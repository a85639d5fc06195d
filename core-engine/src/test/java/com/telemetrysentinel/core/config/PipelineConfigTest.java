package com.telemetrysentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PipelineConfig}.
 */
class PipelineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should de-duplicate sensors while keeping their order")
    void shouldDeduplicateSensors() {
        PipelineConfig config = builder()
                .sensorsToPlot(List.of("b", "a", "b", "c", "a"))
                .build();

        assertThat(config.getSensorsToPlot()).containsExactly("b", "a", "c");
    }

    @Test
    @DisplayName("Should normalise directories to absolute paths")
    void shouldNormalisePaths() {
        PipelineConfig config = builder()
                .inputDir(tempDir.resolve("x/../in"))
                .build();

        assertThat(config.getInputDir()).isEqualTo(tempDir.resolve("in").toAbsolutePath());
    }

    @Test
    @DisplayName("Should reject a missing input directory path")
    void shouldRejectMissingInputDir() {
        assertThatThrownBy(() -> PipelineConfig.builder()
                .outputDir(tempDir).imageDir(tempDir).scorerPath(tempDir.resolve("s"))
                .build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("inputDir");
    }

    @Test
    @DisplayName("Should reject non-positive thread counts and intervals")
    void shouldRejectInvalidNumbers() {
        assertThatThrownBy(() -> builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> builder().plotThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("plotThreads");
        assertThatThrownBy(() -> builder().checkInterval(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checkInterval");
        assertThatThrownBy(() -> builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
    }

    @Test
    @DisplayName("Should reject blank sensor names")
    void shouldRejectBlankSensor() {
        assertThatThrownBy(() -> builder().sensorsToPlot(List.of("ok", " ")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sensorsToPlot");
    }

    @Test
    @DisplayName("Should fail when the input directory does not exist")
    void shouldFailOnMissingInputDirectory() {
        PipelineConfig config = builder().inputDir(tempDir.resolve("missing")).build();

        assertThatThrownBy(config::prepareDirectories)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Input directory not found");
    }

    @Test
    @DisplayName("Should create output, image and scorer directories")
    void shouldCreateOutputDirectories() throws Exception {
        Files.createDirectories(tempDir.resolve("in"));
        PipelineConfig config = builder()
                .outputDir(tempDir.resolve("out/predictions"))
                .imageDir(tempDir.resolve("out/images"))
                .scorerPath(tempDir.resolve("models/v1/scorer.bin"))
                .build();

        config.prepareDirectories();

        assertThat(tempDir.resolve("out/predictions")).isDirectory();
        assertThat(tempDir.resolve("out/images")).isDirectory();
        assertThat(tempDir.resolve("models/v1")).isDirectory();
    }

    // Helpers

    private PipelineConfig.Builder builder() {
        return PipelineConfig.builder()
                .inputDir(tempDir.resolve("in"))
                .outputDir(tempDir.resolve("out"))
                .imageDir(tempDir.resolve("img"))
                .scorerPath(tempDir.resolve("scorer.bin"));
    }
}
