package com.telemetrysentinel.core.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScorerFactory}.
 */
class ScorerFactoryTest {

    @Test
    @DisplayName("Should create a statistical scorer")
    void shouldCreateStatistical() {
        Scorer scorer = ScorerFactory.create("statistical", 2.5, 0.1);

        assertThat(scorer).isInstanceOf(StatisticalBaselineScorer.class);
        assertThat(((StatisticalBaselineScorer) scorer).getDeviationFactor()).isEqualTo(2.5);
        assertThat(scorer.isFitted()).isFalse();
    }

    @Test
    @DisplayName("Should create a range scorer, case-insensitively")
    void shouldCreateRange() {
        Scorer scorer = ScorerFactory.create("RANGE", 3.0, 0.2);

        assertThat(scorer).isInstanceOf(RangeBaselineScorer.class);
        assertThat(((RangeBaselineScorer) scorer).getTolerance()).isEqualTo(0.2);
    }

    @Test
    @DisplayName("Should throw for unknown scorer type")
    void shouldThrowForUnknownType() {
        assertThatThrownBy(() -> ScorerFactory.create("isolation_forest", 3.0, 0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown scorer type");
    }
}
