package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.config.PipelineConfig;
import com.telemetrysentinel.core.io.JFreeChartPlotRenderer;
import com.telemetrysentinel.core.scoring.BootstrapException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests for {@link MonitoringService}.
 */
class MonitoringServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final LocalDateTime T0 = LocalDateTime.of(2018, 4, 1, 0, 0);

    @TempDir
    Path tempDir;

    private Path inputDir;
    private MonitoringService service;

    @BeforeEach
    void setUp() throws IOException {
        inputDir = Files.createDirectories(tempDir.resolve("incoming"));
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    @Test
    @DisplayName("Should score a new file, write predictions and plot, then remove it")
    void shouldProcessArrivalEndToEnd() throws IOException {
        writeTrainingFile(100);
        service = new MonitoringService(config(List.of("sensor_00")).build(),
                new JFreeChartPlotRenderer(400, 200), new PipelineMetrics());
        service.start();
        assertThat(service.getState()).isEqualTo(PipelineState.WATCHING);
        assertThat(tempDir.resolve("model/scorer.bin")).isRegularFile();

        Path reading = writeReadingFile("reading_001.csv");

        Path predictions = tempDir.resolve("out/predictions_reading_001.csv");
        await().atMost(TIMEOUT).until(() -> Files.notExists(reading));
        assertThat(Files.readAllLines(predictions))
                .hasSize(10)
                .first().isEqualTo("predictions");
        assertThat(Files.readAllLines(predictions).subList(1, 10)).containsOnly("1", "-1").contains("-1");
        assertThat(tempDir.resolve("img/anomaly_plot_sensor_00_reading_001.png")).isRegularFile();
        assertThat(service.getMetrics().snapshot())
                .containsEntry("units_succeeded_total", 1L)
                .containsEntry("units_failed_total", 0L);
    }

    @Test
    @DisplayName("Should process files already present at startup")
    void shouldProcessExistingFiles() throws IOException {
        writeTrainingFile(50);
        Path reading = writeReadingFile("reading_early.csv");
        service = new MonitoringService(config(List.of()).processExisting(true).build(),
                new JFreeChartPlotRenderer(), new PipelineMetrics());

        service.start();

        await().atMost(TIMEOUT).until(() -> Files.notExists(reading));
        assertThat(tempDir.resolve("out/predictions_reading_early.csv")).isRegularFile();
        assertThat(tempDir.resolve("incoming/train_baseline.csv")).exists();
    }

    @Test
    @DisplayName("Should keep a malformed file and keep processing the next one")
    void shouldKeepMalformedFile() throws IOException {
        writeTrainingFile(50);
        service = new MonitoringService(config(List.of()).build(), new JFreeChartPlotRenderer(),
                new PipelineMetrics());
        service.start();

        Path bad = Files.writeString(inputDir.resolve("reading_bad.csv"),
                "timestamp,sensor_00,sensor_01\n2018-04-02 00:00:00,abc,1\n");
        Path good = writeReadingFile("reading_good.csv");

        await().atMost(TIMEOUT).until(() -> Files.notExists(good));
        await().atMost(TIMEOUT).until(() -> (long) service.getMetrics().snapshot().get("units_failed_total") == 1L);
        assertThat(bad).exists();
        assertThat(tempDir.resolve("out/predictions_reading_bad.csv")).doesNotExist();
    }

    @Test
    @DisplayName("Should process the files around an unparseable one and leave it in place")
    void shouldIsolateUnparseableFileBetweenGoodOnes() throws IOException {
        writeTrainingFile(50);
        service = new MonitoringService(config(List.of("sensor_00")).build(),
                new JFreeChartPlotRenderer(400, 200), new PipelineMetrics());
        service.start();

        Path first = writeReadingFile("reading_001.csv");
        Path second = inputDir.resolve("reading_002.csv");
        Path hidden = Files.writeString(inputDir.resolve(".reading_002.csv"),
                ",timestamp,sensor_00,sensor_01,machine_status\n"
                        + "0,yesterday,50.0,10.0,NORMAL\n"
                        + "1,,50.0,10.0,NORMAL\n"
                        + "2,2018-13-45 99:00:00,50.0,10.0,NORMAL\n");
        Files.move(hidden, second);
        Path third = writeReadingFile("reading_003.csv");

        await().atMost(TIMEOUT).until(() -> Files.notExists(first) && Files.notExists(third));
        await().atMost(TIMEOUT).until(() -> (long) service.getMetrics().snapshot().get("units_skipped_total") == 1L);
        assertThat(tempDir.resolve("out/predictions_reading_001.csv")).isRegularFile();
        assertThat(tempDir.resolve("out/predictions_reading_003.csv")).isRegularFile();
        assertThat(tempDir.resolve("img/anomaly_plot_sensor_00_reading_001.png")).isRegularFile();
        assertThat(tempDir.resolve("img/anomaly_plot_sensor_00_reading_003.png")).isRegularFile();
        assertThat(second).exists();
        assertThat(tempDir.resolve("out/predictions_reading_002.csv")).doesNotExist();
        assertThat(tempDir.resolve("img/anomaly_plot_sensor_00_reading_002.png")).doesNotExist();
        assertThat(service.getMetrics().snapshot())
                .containsEntry("units_succeeded_total", 2L)
                .containsEntry("units_failed_total", 0L);
    }

    @Test
    @DisplayName("Should fail startup when there is no training data")
    void shouldFailWithoutTrainingData() {
        service = new MonitoringService(config(List.of()).build());

        assertThatThrownBy(service::start).isInstanceOf(BootstrapException.class);
        assertThat(service.getState()).isEqualTo(PipelineState.STOPPED);
    }

    @Test
    @DisplayName("Should fail startup when a sensor to plot is not a trained feature")
    void shouldFailOnUnknownPlotSensor() throws IOException {
        writeTrainingFile(10);
        service = new MonitoringService(config(List.of("sensor_99")).build());

        assertThatThrownBy(service::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sensor_99");
    }

    @Test
    @DisplayName("Should release awaitShutdown and stop idempotently")
    void shouldStopIdempotently() throws Exception {
        writeTrainingFile(10);
        service = new MonitoringService(config(List.of()).build());
        service.start();
        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                service.awaitShutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        service.stop();
        service.stop();

        waiter.get(5, TimeUnit.SECONDS);
        assertThat(service.getState()).isEqualTo(PipelineState.STOPPED);
        assertThat(service.getCoordinator().isAccepting()).isFalse();
    }

    @Test
    @DisplayName("Should exit cleanly after a stop that drained every file")
    void shouldReportCleanExitAfterDrain() throws IOException {
        writeTrainingFile(10);
        service = new MonitoringService(config(List.of()).build());
        service.start();
        assertThat(service.isDrainedCleanly()).isFalse();
        assertThat(TelemetrySentinelApp.shutdownExitCode(service))
                .isEqualTo(TelemetrySentinelApp.EXIT_DRAIN_TIMEOUT);

        service.close();

        assertThat(service.isDrainedCleanly()).isTrue();
        assertThat(TelemetrySentinelApp.shutdownExitCode(service)).isEqualTo(TelemetrySentinelApp.EXIT_CLEAN);
    }

    // Helpers

    private PipelineConfig.Builder config(List<String> sensors) {
        return PipelineConfig.builder()
                .inputDir(inputDir)
                .outputDir(tempDir.resolve("out"))
                .imageDir(tempDir.resolve("img"))
                .scorerPath(tempDir.resolve("model/scorer.bin"))
                .sensorsToPlot(sensors)
                .checkInterval(Duration.ofMillis(100))
                .settleTime(Duration.ZERO)
                .processExisting(false)
                .shutdownTimeout(Duration.ofSeconds(5));
    }

    /** Smooth baseline: sensor_00 around 50, sensor_01 around 10. */
    private void writeTrainingFile(int rows) throws IOException {
        StringBuilder csv = new StringBuilder(",timestamp,sensor_00,sensor_01,machine_status\n");
        for (int i = 0; i < rows; i++) {
            csv.append(i).append(',')
                    .append(T0.plusMinutes(i).format(TS)).append(',')
                    .append(50 + Math.sin(i / 5.0)).append(',')
                    .append(10 + Math.cos(i / 5.0)).append(",NORMAL\n");
        }
        Files.writeString(inputDir.resolve("train_baseline.csv"), csv.toString());
    }

    /** Ten rows, one with a bad timestamp and one with a spike. */
    private Path writeReadingFile(String name) throws IOException {
        StringBuilder csv = new StringBuilder(",timestamp,sensor_00,sensor_01,machine_status\n");
        for (int i = 0; i < 10; i++) {
            String timestamp = i == 4 ? "not-a-timestamp" : T0.plusDays(1).plusMinutes(i).format(TS);
            double value = i == 7 ? 500.0 : 50.0;
            csv.append(i).append(',').append(timestamp).append(',')
                    .append(value).append(",10.0,NORMAL\n");
        }
        // write under a hidden name and rename so the detector sees a complete file
        Path hidden = inputDir.resolve("." + name);
        Files.writeString(hidden, csv.toString());
        return Files.move(hidden, inputDir.resolve(name));
    }
}
