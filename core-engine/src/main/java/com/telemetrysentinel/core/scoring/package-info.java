/**
 * Pluggable baseline scorers.
 *
 * <p>
 * All scorers implement {@link com.telemetrysentinel.core.scoring.Scorer} and
 * are instantiated via {@link com.telemetrysentinel.core.scoring.ScorerFactory}.
 * Built-in scorer types:
 * </p>
 * <ul>
 * <li>{@link com.telemetrysentinel.core.scoring.StatisticalBaselineScorer} -
 * per-sensor mean ± N × σ</li>
 * <li>{@link com.telemetrysentinel.core.scoring.RangeBaselineScorer} - observed
 * min/max widened by a tolerance</li>
 * </ul>
 *
 * <p>
 * {@link com.telemetrysentinel.core.scoring.BootstrapStage} fits a scorer once,
 * {@link com.telemetrysentinel.core.scoring.ScorerRepository} persists it and
 * {@link com.telemetrysentinel.core.scoring.ScorerGateway} serves predictions
 * from the reloaded artifact.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new scorer, implement {@code Scorer} and register the type string
 * in {@code ScorerFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.scoring;
