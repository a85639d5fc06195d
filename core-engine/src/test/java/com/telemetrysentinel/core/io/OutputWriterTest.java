package com.telemetrysentinel.core.io;

import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.PredictionResult;
import com.telemetrysentinel.core.model.SensorSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link OutputWriter} and {@link JFreeChartPlotRenderer}.
 */
class OutputWriterTest {

    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path tempDir;

    private Path outputDir;
    private Path imageDir;

    @BeforeEach
    void setUp() throws IOException {
        outputDir = Files.createDirectories(tempDir.resolve("out"));
        imageDir = Files.createDirectories(tempDir.resolve("img"));
    }

    @Test
    @DisplayName("Should derive output names from the input name only")
    void shouldNameOutputsDeterministically() {
        assertThat(OutputWriter.predictionFileName("reading_001.csv")).isEqualTo("predictions_reading_001.csv");
        assertThat(OutputWriter.predictionFileName("/some/dir/reading_001.csv"))
                .isEqualTo("predictions_reading_001.csv");
        assertThat(OutputWriter.plotFileName("reading_001.csv", "sensor_01"))
                .isEqualTo("anomaly_plot_sensor_01_reading_001.png");
        assertThat(OutputWriter.plotFileName("reading", "flow/rate (l)"))
                .isEqualTo("anomaly_plot_flow_rate__l__reading.png");
    }

    @Test
    @DisplayName("Should write one prediction code per row under a predictions header")
    void shouldWritePredictionTable() throws IOException {
        OutputWriter writer = new OutputWriter(outputDir, imageDir, failingRenderer());

        Path written = writer.writePredictions("reading_001.csv",
                new PredictionResult(List.of(Label.NORMAL, Label.ANOMALY, Label.NORMAL)));

        assertThat(written).isEqualTo(outputDir.resolve("predictions_reading_001.csv"));
        assertThat(Files.readAllLines(written)).containsExactly("predictions", "1", "-1", "1");
    }

    @Test
    @DisplayName("Should overwrite with byte-identical content when the same input is written twice")
    void shouldBeIdempotent() throws IOException {
        OutputWriter writer = new OutputWriter(outputDir, imageDir, failingRenderer());
        PredictionResult result = new PredictionResult(List.of(Label.ANOMALY, Label.NORMAL));

        Path first = writer.writePredictions("a.csv", result);
        byte[] firstBytes = Files.readAllBytes(first);
        Path second = writer.writePredictions("a.csv", result);

        assertThat(second).isEqualTo(first);
        assertThat(Files.readAllBytes(second)).isEqualTo(firstBytes);
        assertThat(listNames(outputDir)).containsExactly("predictions_a.csv");
    }

    @Test
    @DisplayName("Should render a PNG plot with JFreeChart")
    void shouldRenderPng() throws IOException {
        OutputWriter writer = new OutputWriter(outputDir, imageDir, new JFreeChartPlotRenderer(320, 200));

        Path plot = writer.writePlot("reading_001.csv", series("sensor_01"));

        assertThat(plot).isEqualTo(imageDir.resolve("anomaly_plot_sensor_01_reading_001.png"));
        byte[] bytes = Files.readAllBytes(plot);
        assertThat(bytes.length).isGreaterThan(PNG_MAGIC.length);
        assertThat(Arrays.copyOf(bytes, PNG_MAGIC.length)).isEqualTo(PNG_MAGIC);
    }

    @Test
    @DisplayName("Should leave no file behind when rendering fails")
    void shouldNotLeavePartialPlot() throws IOException {
        OutputWriter writer = new OutputWriter(outputDir, imageDir, failingRenderer());

        assertThatThrownBy(() -> writer.writePlot("reading_001.csv", series("sensor_01")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("disk full");
        assertThat(listNames(imageDir)).isEmpty();
    }

    // Helpers

    private static SensorSeries series(String sensor) {
        LocalDateTime start = LocalDateTime.of(2018, 4, 1, 0, 0);
        return new SensorSeries(sensor,
                List.of(start, start.plusMinutes(1), start.plusMinutes(2)),
                new double[]{1.0, Double.NaN, 9.0},
                new boolean[]{false, false, true});
    }

    private static PlotRenderer failingRenderer() {
        return (series, title, target) -> {
            Files.writeString(target, "partial");
            throw new IOException("disk full");
        };
    }

    private static List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).toList();
        }
    }
}
