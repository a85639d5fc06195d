package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.TelemetryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Range baseline scorer.
 *
 * <p>
 * Fitting records the observed minimum and maximum of every feature. The
 * envelope is widened on both sides by {@code tolerance × (max − min)}; a row
 * with any reading outside its feature's envelope is an anomaly. Missing
 * readings are ignored. Stateless after fit.
 * </p>
 *
 * @since 1.0.0
 */
public class RangeBaselineScorer implements Scorer {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RangeBaselineScorer.class);

    public static final String TYPE = "range";

    private final double tolerance;

    private List<String> featureNames = List.of();
    private double[] lower;
    private double[] upper;
    private boolean fitted;

    /**
     * @param tolerance envelope widening as a fraction of the observed span
     * @throws IllegalArgumentException if {@code tolerance} is negative
     */
    public RangeBaselineScorer(double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    @Override
    public void fit(TelemetryTable table) {
        Objects.requireNonNull(table, "table must not be null");
        if (fitted) {
            throw new IllegalStateException("Scorer is already fitted");
        }
        if (table.isEmpty()) {
            throw new IllegalArgumentException("Training data is empty.");
        }

        List<String> names = table.getFeatureNames();
        double[][] rows = table.alignTo(names);
        double[] lo = new double[names.size()];
        double[] hi = new double[names.size()];
        for (int c = 0; c < names.size(); c++) {
            double min = ColumnStatistics.min(rows, c);
            double max = ColumnStatistics.max(rows, c);
            double margin = tolerance * (max - min);
            lo[c] = min - margin;
            hi[c] = max + margin;
        }

        this.featureNames = List.copyOf(names);
        this.lower = lo;
        this.upper = hi;
        this.fitted = true;
        LOG.info("Fitted range baseline on {} rows x {} features (tolerance={})",
                rows.length, names.size(), tolerance);
    }

    @Override
    public List<Label> predict(TelemetryTable table) {
        Objects.requireNonNull(table, "table must not be null");
        if (!fitted) {
            throw new IllegalStateException("Scorer has not been fitted");
        }
        double[][] rows = table.alignTo(featureNames);
        List<Label> labels = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            labels.add(outsideEnvelope(row) ? Label.ANOMALY : Label.NORMAL);
        }
        return labels;
    }

    private boolean outsideEnvelope(double[] row) {
        for (int c = 0; c < row.length; c++) {
            // NaN bounds compare false, so unseen features never vote
            if (row[c] < lower[c] || row[c] > upper[c]) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    @Override
    public List<String> getFeatureNames() {
        return featureNames;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return "RangeBaselineScorer{fitted=" + fitted + ", features=" + featureNames.size()
                + ", tolerance=" + tolerance + '}';
    }
}
