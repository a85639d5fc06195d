package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.config.FileConvention;
import com.telemetrysentinel.core.io.TelemetryReader;
import com.telemetrysentinel.core.model.TelemetryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * One-time fitting of the baseline scorer from the training files already
 * present in the input directory.
 *
 * <p>
 * Training files are read in file-name order with the same cleaning rules as
 * arrivals. A file is skipped, with an error log, when it cannot be read, has
 * no row with a valid timestamp, or its feature columns differ from the first
 * accepted file. The scorer is fitted once on the concatenation of every
 * accepted file, so it has seen every valid training row when
 * {@link #bootstrap(Path)} returns.
 * </p>
 *
 * @since 1.0.0
 */
public class BootstrapStage {

    private static final Logger LOG = LoggerFactory.getLogger(BootstrapStage.class);

    private final FileConvention convention;
    private final TelemetryReader reader;
    private final Supplier<Scorer> scorerSupplier;

    /**
     * @param convention     decides which files are training files
     * @param reader         telemetry reader
     * @param scorerSupplier creates the unfitted scorer to fit
     */
    public BootstrapStage(FileConvention convention, TelemetryReader reader, Supplier<Scorer> scorerSupplier) {
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.scorerSupplier = Objects.requireNonNull(scorerSupplier, "scorerSupplier must not be null");
    }

    /**
     * Fit a scorer from the training files in {@code inputDir}.
     *
     * @param inputDir directory holding the training files
     * @return the fitted scorer
     * @throws BootstrapException if the directory cannot be listed or no
     *                            training file contributes a valid row
     */
    public Scorer bootstrap(Path inputDir) {
        Objects.requireNonNull(inputDir, "inputDir must not be null");
        LOG.info("Attempting to fit model with data from {}", inputDir);

        List<Path> trainingFiles = listTrainingFiles(inputDir);
        if (trainingFiles.isEmpty()) {
            throw new BootstrapException("No training files matching '" + convention.getTrainingPrefix()
                    + "*" + convention.getExtension() + "' in " + inputDir);
        }

        List<TelemetryTable> accepted = new ArrayList<>();
        for (Path file : trainingFiles) {
            LOG.info("Processing training file: {}", file);
            try {
                TelemetryTable table = reader.read(file);
                if (table.isEmpty()) {
                    LOG.error("Skipping training file {}: no row with a valid timestamp ({} dropped)",
                            file, table.getDroppedRows());
                    continue;
                }
                if (!accepted.isEmpty() && !sameFeatures(accepted.get(0), table)) {
                    LOG.error("Skipping training file {}: features {} differ from {}",
                            file, table.getFeatureNames(), accepted.get(0).getFeatureNames());
                    continue;
                }
                accepted.add(table);
            } catch (IOException | IllegalArgumentException e) {
                LOG.error("Skipping training file {}: {}", file, e.getMessage(), e);
            }
        }

        if (accepted.isEmpty()) {
            throw new BootstrapException("None of the " + trainingFiles.size()
                    + " training file(s) in " + inputDir + " contributed a valid row");
        }

        TelemetryTable baseline = TelemetryTable.concat(accepted);
        Scorer scorer = scorerSupplier.get();
        try {
            scorer.fit(baseline);
        } catch (RuntimeException e) {
            throw new BootstrapException("Fitting the " + scorer.getType() + " scorer failed: " + e.getMessage(), e);
        }
        LOG.info("Model fitted with training data: {} row(s) from {} of {} file(s)",
                baseline.rowCount(), accepted.size(), trainingFiles.size());
        return scorer;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Path> listTrainingFiles(Path inputDir) {
        try (Stream<Path> files = Files.list(inputDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(convention::isTrainingFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new BootstrapException("Cannot list input directory " + inputDir, e);
        }
    }

    private static boolean sameFeatures(TelemetryTable a, TelemetryTable b) {
        return a.getFeatureNames().size() == b.getFeatureNames().size()
                && new HashSet<>(a.getFeatureNames()).containsAll(b.getFeatureNames());
    }
}
