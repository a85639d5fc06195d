package com.telemetrysentinel.core.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.PredictionResult;
import com.telemetrysentinel.core.model.SensorSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Persists prediction tables and plot images.
 *
 * <h3>Naming</h3>
 * <p>
 * Output paths are pure functions of their inputs: predictions for
 * {@code reading_001.csv} go to {@code predictions_reading_001.csv} in the
 * output directory, the plot of {@code sensor_01} for the same file to
 * {@code anomaly_plot_sensor_01_reading_001.png} in the image directory.
 * Writing the same input twice overwrites the first result.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * Content is written to a hidden temporary file next to the target and then
 * moved over it, atomically where the file system allows. Readers see either
 * the previous file or the complete new one.
 * </p>
 *
 * @since 1.0.0
 */
public class OutputWriter {

    private static final Logger LOG = LoggerFactory.getLogger(OutputWriter.class);

    public static final String PREDICTIONS_COLUMN = "predictions";

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema PREDICTION_SCHEMA = CSV.schemaFor(PredictionRow.class).withHeader();

    private final Path outputDir;
    private final Path imageDir;
    private final PlotRenderer plotRenderer;

    /**
     * @param outputDir    directory for prediction tables; must exist
     * @param imageDir     directory for plot images; must exist
     * @param plotRenderer renderer used by {@link #writePlot}
     */
    public OutputWriter(Path outputDir, Path imageDir, PlotRenderer plotRenderer) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.imageDir = Objects.requireNonNull(imageDir, "imageDir must not be null");
        this.plotRenderer = Objects.requireNonNull(plotRenderer, "plotRenderer must not be null");
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * Write a single-column {@value #PREDICTIONS_COLUMN} table of label codes.
     *
     * @param sourceFileName base name of the scored input file
     * @param result         labels to persist
     * @return path of the written table
     * @throws IOException if writing fails; no partial file is left at the target
     */
    public Path writePredictions(String sourceFileName, PredictionResult result) throws IOException {
        Objects.requireNonNull(result, "result must not be null");
        Path target = outputDir.resolve(predictionFileName(sourceFileName));
        List<PredictionRow> rows = result.getLabels().stream().map(PredictionRow::new).toList();
        writeAtomically(target, temp -> {
            try (OutputStream out = Files.newOutputStream(temp)) {
                CSV.writer(PREDICTION_SCHEMA).writeValue(out, rows);
            }
        });
        LOG.info("Predictions saved to {} ({} rows, {} anomalies)", target, result.size(), result.anomalyCount());
        return target;
    }

    /**
     * Render and write the plot of one sensor.
     *
     * @param sourceFileName base name of the scored input file
     * @param series         the sensor's series
     * @return path of the written image
     * @throws IOException if rendering or writing fails; no partial file is left
     *                     at the target
     */
    public Path writePlot(String sourceFileName, SensorSeries series) throws IOException {
        Objects.requireNonNull(series, "series must not be null");
        Path target = imageDir.resolve(plotFileName(sourceFileName, series.getSensor()));
        String title = "Anomaly Detection for " + series.getSensor() + " (" + sourceFileName + ")";
        writeAtomically(target, temp -> plotRenderer.render(series, title, temp));
        LOG.info("Saving image {}", target);
        return target;
    }

    // ---------------------------------------------------------------
    // Naming
    // ---------------------------------------------------------------

    public static String predictionFileName(String sourceFileName) {
        return "predictions_" + requireBaseName(sourceFileName);
    }

    public static String plotFileName(String sourceFileName, String sensor) {
        String base = requireBaseName(sourceFileName);
        int dot = base.lastIndexOf('.');
        String stem = dot > 0 ? base.substring(0, dot) : base;
        return "anomaly_plot_" + sanitize(sensor) + "_" + stem + ".png";
    }

    private static String requireBaseName(String sourceFileName) {
        Objects.requireNonNull(sourceFileName, "sourceFileName must not be null");
        Path name = Path.of(sourceFileName).getFileName();
        if (name == null || name.toString().isBlank()) {
            throw new IllegalArgumentException("Not a file name: '" + sourceFileName + "'");
        }
        return name.toString();
    }

    private static String sanitize(String sensor) {
        Objects.requireNonNull(sensor, "sensor must not be null");
        return sensor.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface FileWrite {
        void writeTo(Path temp) throws IOException;
    }

    private static void writeAtomically(Path target, FileWrite write) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            write.writeTo(temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /** One row of a prediction table. */
    public static final class PredictionRow {

        @JsonProperty(PREDICTIONS_COLUMN)
        private final int predictions;

        PredictionRow(Label label) {
            this.predictions = label.getCode();
        }

        public int getPredictions() {
            return predictions;
        }
    }
}
