package com.telemetrysentinel.core.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TimestampParser}.
 */
class TimestampParserTest {

    @Test
    @DisplayName("Should parse space-separated timestamps with and without seconds")
    void shouldParseSpaceSeparated() {
        assertThat(TimestampParser.parse("2018-04-01 00:05:00"))
                .contains(LocalDateTime.of(2018, 4, 1, 0, 5, 0));
        assertThat(TimestampParser.parse("2018-04-01 13:45"))
                .contains(LocalDateTime.of(2018, 4, 1, 13, 45));
        assertThat(TimestampParser.parse("2018-04-01 00:00:01.250"))
                .contains(LocalDateTime.of(2018, 4, 1, 0, 0, 1, 250_000_000));
    }

    @Test
    @DisplayName("Should parse ISO timestamps and convert offsets to UTC")
    void shouldParseIso() {
        assertThat(TimestampParser.parse("2018-04-01T10:00:00"))
                .contains(LocalDateTime.of(2018, 4, 1, 10, 0));
        assertThat(TimestampParser.parse("2018-04-01T10:00:00+02:00"))
                .contains(LocalDateTime.of(2018, 4, 1, 8, 0));
    }

    @Test
    @DisplayName("Should treat a bare date as midnight")
    void shouldParseBareDate() {
        assertThat(TimestampParser.parse(" 2018-04-01 "))
                .contains(LocalDateTime.of(2018, 4, 1, 0, 0));
    }

    @Test
    @DisplayName("Should return empty for blank or unparseable text")
    void shouldRejectGarbage() {
        assertThat(TimestampParser.parse(null)).isEmpty();
        assertThat(TimestampParser.parse("   ")).isEmpty();
        assertThat(TimestampParser.parse("not-a-time")).isEmpty();
        assertThat(TimestampParser.parse("2018-13-01 00:00:00")).isEmpty();
    }
}
