package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.model.FeatureMismatchException;
import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.TelemetryTable;

import java.io.Serializable;
import java.util.List;

/**
 * Contract for anomaly scorers.
 *
 * <p>
 * A scorer is constructed empty, fitted exactly once on baseline telemetry
 * and from then on only asked for predictions. After {@link #fit} returns,
 * {@link #predict} must not touch mutable state so that any number of
 * workers can call it concurrently.
 * </p>
 * <p>
 * Scorers must be {@link Serializable} because the fitted baseline is
 * persisted by {@link ScorerRepository}.
 * </p>
 */
public interface Scorer extends Serializable {

    /**
     * Learn the baseline from the given table.
     *
     * @param table baseline telemetry; must contain at least one row
     * @throws IllegalStateException    if the scorer was already fitted
     * @throws IllegalArgumentException if the table is empty
     */
    void fit(TelemetryTable table);

    /**
     * Score every row of the table.
     *
     * @param table telemetry with the fitted feature columns, in any order
     * @return one label per row, in row order
     * @throws IllegalStateException    if the scorer has not been fitted
     * @throws FeatureMismatchException if the columns differ from the fitted ones
     */
    List<Label> predict(TelemetryTable table);

    boolean isFitted();

    /**
     * @return the fitted feature names in fitted order; empty before fitting
     */
    List<String> getFeatureNames();

    /**
     * @return the scorer type name accepted by {@link ScorerFactory}
     */
    String getType();
}
