package com.telemetrysentinel.core.model;

import java.util.List;

/**
 * Thrown when a telemetry table's feature columns do not match the feature
 * space a scorer was fitted on.
 *
 * @since 1.0.0
 */
public class FeatureMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> missing;
    private final List<String> unexpected;

    public FeatureMismatchException(List<String> missing, List<String> unexpected) {
        super("Feature columns do not match the fitted feature space: missing="
                + missing + ", unexpected=" + unexpected);
        this.missing = List.copyOf(missing);
        this.unexpected = List.copyOf(unexpected);
    }

    public List<String> getMissing() {
        return missing;
    }

    public List<String> getUnexpected() {
        return unexpected;
    }
}
