package com.telemetrysentinel.core.io;

import com.telemetrysentinel.core.model.TelemetryTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TelemetryReader}.
 */
class TelemetryReaderTest {

    private final TelemetryReader reader = new TelemetryReader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should drop the index column and keep the status column out of the features")
    void shouldSeparateFeaturesFromIndexAndStatus() throws IOException {
        TelemetryTable table;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("telemetry-sample.csv")) {
            table = reader.read("telemetry-sample.csv", in);
        }

        assertThat(table.getFeatureNames()).containsExactly("sensor_01", "sensor_02");
        assertThat(table.getStatusLabels()).hasValueSatisfying(
                labels -> assertThat(labels).containsExactly("NORMAL", "NORMAL", "BROKEN"));
    }

    @Test
    @DisplayName("Should drop rows with unparseable timestamps and count them")
    void shouldDropBadTimestamps() throws IOException {
        TelemetryTable table = read("""
                timestamp,sensor_01
                2018-04-01 00:00:00,1.0
                garbage,2.0
                ,3.0
                2018-04-01 00:03:00,4.0
                """);

        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.getDroppedRows()).isEqualTo(2);
        assertThat(table.getTimestamps()).containsExactly(
                LocalDateTime.of(2018, 4, 1, 0, 0), LocalDateTime.of(2018, 4, 1, 0, 3));
        assertThat(table.column("sensor_01")).containsExactly(1.0, 4.0);
    }

    @Test
    @DisplayName("Should read blank and missing trailing cells as NaN")
    void shouldReadBlankAsNaN() throws IOException {
        TelemetryTable table = read("""
                timestamp,a,b
                2018-04-01 00:00:00,,2.5
                2018-04-01 00:01:00,1.5
                """);

        assertThat(table.row(0)[0]).isNaN();
        assertThat(table.row(0)[1]).isEqualTo(2.5);
        assertThat(table.row(1)[1]).isNaN();
        assertThat(table.getStatusLabels()).isEmpty();
    }

    @Test
    @DisplayName("Should return an empty table when every timestamp is bad")
    void shouldReturnEmptyTable() throws IOException {
        TelemetryTable table = read("""
                timestamp,a
                x,1
                y,2
                """);

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.getDroppedRows()).isEqualTo(2);
        assertThat(table.getFeatureNames()).containsExactly("a");
    }

    @Test
    @DisplayName("Should fail the whole file on a non-numeric reading")
    void shouldRejectNonNumericReading() {
        assertThatThrownBy(() -> read("""
                timestamp,a
                2018-04-01 00:00:00,1.0
                2018-04-01 00:01:00,high
                """))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageContaining("line 3")
                .hasMessageContaining("'a'");
    }

    @Test
    @DisplayName("Should reject files without a timestamp column")
    void shouldRejectMissingTimestampColumn() {
        assertThatThrownBy(() -> read("time,a\n2018-04-01,1\n"))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    @DisplayName("Should reject empty files, duplicate columns and overlong rows")
    void shouldRejectStructuralProblems() {
        assertThatThrownBy(() -> read(""))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> read("timestamp,a,a\n2018-04-01,1,2\n"))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> read("timestamp,a\n2018-04-01,1,2\n"))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageContaining("fields");
    }

    @Test
    @DisplayName("Should report an unclosed quote as unreadable CSV")
    void shouldRejectUnclosedQuote() {
        assertThatThrownBy(() -> read("timestamp,a\n2018-04-01 00:00:00,\"1.0\n"))
                .isInstanceOf(MalformedTelemetryException.class)
                .hasMessageStartingWith("test.csv: unreadable CSV: Missing closing quote");
    }

    @Test
    @DisplayName("Should read from a file and name the table after it")
    void shouldReadFromFile() throws IOException {
        Path file = tempDir.resolve("reading_001.csv");
        Files.writeString(file, "timestamp,a\n2018-04-01 00:00:00,1\n");

        TelemetryTable table = reader.read(file);

        assertThat(table.getSource()).isEqualTo("reading_001.csv");
        assertThat(table.rowCount()).isEqualTo(1);
    }

    // Helpers

    private TelemetryTable read(String csv) throws IOException {
        return reader.read("test.csv", new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }
}
