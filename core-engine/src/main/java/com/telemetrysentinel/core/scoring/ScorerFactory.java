package com.telemetrysentinel.core.scoring;

import com.telemetrysentinel.core.config.PipelineConfig;

import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates unfitted {@link Scorer} instances by type name.
 *
 * <p>
 * This is the single point of extension when adding new scorer types:
 * register the type string here and create the corresponding scorer.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerFactory {

    private ScorerFactory() {
        // utility class - not instantiable
    }

    /**
     * @param config pipeline configuration carrying type and tuning values
     * @return a new, unfitted scorer
     * @throws IllegalArgumentException if the scorer type is unknown
     */
    public static Scorer create(PipelineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return create(config.getScorerType(), config.getDeviationFactor(), config.getRangeTolerance());
    }

    /**
     * @param type            scorer type name, case-insensitive
     * @param deviationFactor sigma multiplier for {@code statistical}
     * @param rangeTolerance  envelope widening for {@code range}
     * @return a new, unfitted scorer
     * @throws NullPointerException     if {@code type} is {@code null}
     * @throws IllegalArgumentException if the scorer type is unknown
     */
    public static Scorer create(String type, double deviationFactor, double rangeTolerance) {
        Objects.requireNonNull(type, "Scorer type must not be null");
        return switch (type.toLowerCase(Locale.ROOT)) {
            case StatisticalBaselineScorer.TYPE -> new StatisticalBaselineScorer(deviationFactor);
            case RangeBaselineScorer.TYPE -> new RangeBaselineScorer(rangeTolerance);
            default -> throw new IllegalArgumentException(
                    "Unknown scorer type: '" + type + "'. Supported types: statistical, range");
        };
    }
}
