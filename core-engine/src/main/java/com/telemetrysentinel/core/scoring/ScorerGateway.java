package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.model.FeatureMismatchException;
import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.PredictionResult;
import com.telemetrysentinel.core.model.TelemetryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Owns the fitted scorer used by the workers.
 *
 * <p>
 * The gateway is created once at startup, either from a persisted artifact
 * ({@link #load(Path)}) or around a scorer fitted in-process. It never
 * refits: the scorer is read-only from here on, so {@link #predict} needs no
 * locking as long as the scorer honours the {@link Scorer} contract.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerGateway {

    private static final Logger LOG = LoggerFactory.getLogger(ScorerGateway.class);

    private final Scorer scorer;

    /**
     * @param scorer a fitted scorer
     * @throws IllegalArgumentException if the scorer is not fitted
     */
    public ScorerGateway(Scorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        if (!scorer.isFitted()) {
            throw new IllegalArgumentException("ScorerGateway requires a fitted scorer");
        }
    }

    /**
     * Load the gateway from a persisted scorer artifact.
     *
     * @param path artifact location
     * @return gateway around the loaded scorer
     * @throws ScorerLoadException if the artifact cannot be loaded
     */
    public static ScorerGateway load(Path path) {
        return new ScorerGateway(ScorerRepository.load(path));
    }

    /**
     * Score a cleaned telemetry table.
     *
     * @param table table to score; must have at least one row
     * @return labels aligned with the table's rows
     * @throws IllegalArgumentException if the table is empty
     * @throws FeatureMismatchException if the columns differ from the fitted ones
     * @throws IllegalStateException    if the scorer returns a wrong number of labels
     */
    public PredictionResult predict(TelemetryTable table) {
        Objects.requireNonNull(table, "table must not be null");
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Prediction data is empty: " + table.getSource());
        }
        List<Label> labels = scorer.predict(table);
        if (labels.size() != table.rowCount()) {
            throw new IllegalStateException("Scorer returned " + labels.size() + " labels for "
                    + table.rowCount() + " rows of " + table.getSource());
        }
        PredictionResult result = new PredictionResult(labels);
        LOG.debug("Scored {}: {}", table.getSource(), result);
        return result;
    }

    public List<String> getFeatureNames() {
        return scorer.getFeatureNames();
    }

    public String getScorerType() {
        return scorer.getType();
    }
}
