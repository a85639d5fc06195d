package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.model.Label;
import com.telemetrysentinel.core.model.TelemetryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Statistical baseline scorer.
 *
 * <p>
 * Fitting records the mean and standard deviation of every feature over the
 * baseline rows. A row is an {@link Label#ANOMALY anomaly} when at least one
 * of its readings deviates from the feature mean by more than
 * {@code deviationFactor × σ}.
 * </p>
 *
 * <h3>Edge cases</h3>
 * <ul>
 * <li>Missing readings ({@code NaN}) are ignored during fit and predict.</li>
 * <li>A feature with no reading in the baseline never votes.</li>
 * <li>A feature that was constant in the baseline ({@code σ = 0}) flags any
 * different value.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StatisticalBaselineScorer implements Scorer {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StatisticalBaselineScorer.class);

    public static final String TYPE = "statistical";

    private final double deviationFactor;

    private List<String> featureNames = List.of();
    private double[] means;
    private double[] stdDevs;
    private boolean fitted;

    /**
     * @param deviationFactor number of standard deviations tolerated
     * @throws IllegalArgumentException if {@code deviationFactor} is not positive
     */
    public StatisticalBaselineScorer(double deviationFactor) {
        if (!(deviationFactor > 0)) {
            throw new IllegalArgumentException("deviationFactor must be > 0, got: " + deviationFactor);
        }
        this.deviationFactor = deviationFactor;
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
        double[] m = new double[names.size()];
        double[] s = new double[names.size()];
        for (int c = 0; c < names.size(); c++) {
            m[c] = ColumnStatistics.mean(rows, c);
            s[c] = ColumnStatistics.stdDev(rows, c, m[c]);
        }

        this.featureNames = List.copyOf(names);
        this.means = m;
        this.stdDevs = s;
        this.fitted = true;
        LOG.info("Fitted statistical baseline on {} rows x {} features (factor={})",
                rows.length, names.size(), deviationFactor);
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
            labels.add(isOutlier(row) ? Label.ANOMALY : Label.NORMAL);
        }
        return labels;
    }

    private boolean isOutlier(double[] row) {
        for (int c = 0; c < row.length; c++) {
            if (Double.isNaN(row[c]) || Double.isNaN(means[c])) {
                continue;
            }
            double allowedDeviation = stdDevs[c] == 0 ? 0 : deviationFactor * stdDevs[c];
            if (Math.abs(row[c] - means[c]) > allowedDeviation) {
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

    public double getDeviationFactor() {
        return deviationFactor;
    }

    @Override
    public String toString() {
        return "StatisticalBaselineScorer{fitted=" + fitted + ", features=" + featureNames.size()
                + ", deviationFactor=" + deviationFactor + '}';
    }
}
