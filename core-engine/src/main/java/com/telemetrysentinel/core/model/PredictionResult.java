package com.telemetrysentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered labels for one telemetry table, aligned positionally with its rows.
 *
 * @since 1.0.0
 */
public final class PredictionResult {

    private final List<Label> labels;

    public PredictionResult(List<Label> labels) {
        Objects.requireNonNull(labels, "labels must not be null");
        this.labels = List.copyOf(labels);
    }

    /**
     * @return unmodifiable list of labels, one per table row
     */
    public List<Label> getLabels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public long anomalyCount() {
        return labels.stream().filter(Label::isAnomaly).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PredictionResult that))
            return false;
        return labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "PredictionResult{size=" + labels.size() + ", anomalies=" + anomalyCount() + '}';
    }
}
