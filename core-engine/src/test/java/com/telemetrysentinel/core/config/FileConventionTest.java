package com.telemetrysentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FileConvention}.
 */
class FileConventionTest {

    private final FileConvention convention = FileConvention.defaults();

    @Test
    @DisplayName("Should treat prefixed CSV files as training files only")
    void shouldRecogniseTrainingFiles() {
        assertThat(convention.isTrainingFile(Path.of("/data/train_01.csv"))).isTrue();
        assertThat(convention.isArrival(Path.of("/data/train_01.csv"))).isFalse();
    }

    @Test
    @DisplayName("Should treat other CSV files as arrivals")
    void shouldRecogniseArrivals() {
        assertThat(convention.isArrival(Path.of("/data/reading_001.csv"))).isTrue();
        assertThat(convention.isArrival(Path.of("/data/READING.CSV"))).isTrue();
        assertThat(convention.isTrainingFile(Path.of("/data/reading_001.csv"))).isFalse();
    }

    @Test
    @DisplayName("Should ignore hidden, temporary and non-CSV files")
    void shouldIgnoreOtherFiles() {
        assertThat(convention.isArrival(Path.of("/data/.reading.csv"))).isFalse();
        assertThat(convention.isArrival(Path.of("/data/reading.csv.tmp"))).isFalse();
        assertThat(convention.isArrival(Path.of("/data/notes.txt"))).isFalse();
        assertThat(convention.isArrival(Path.of("/data/.csv"))).isFalse();
    }

    @Test
    @DisplayName("Should honour a custom prefix and extension")
    void shouldHonourCustomConvention() {
        FileConvention custom = new FileConvention("baseline-", ".dat");

        assertThat(custom.isTrainingFile(Path.of("baseline-a.dat"))).isTrue();
        assertThat(custom.isArrival(Path.of("a.dat"))).isTrue();
        assertThat(custom.isArrival(Path.of("a.csv"))).isFalse();
    }
}
