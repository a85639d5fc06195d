package com.telemetrysentinel.core.io;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lenient parser for telemetry timestamps.
 *
 * <p>
 * Accepts, in order: ISO-8601 date-times with an offset (normalised to UTC),
 * local date-times separated by {@code 'T'} or a space with optional seconds
 * and fraction, and bare dates (midnight). Anything else yields an empty
 * result so the caller can drop the row.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimestampParser {

    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .appendPattern("HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private static final List<Function<String, LocalDateTime>> FORMATS = List.of(
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            text -> LocalDateTime.parse(text, SPACE_SEPARATED),
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                    .withOffsetSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime(),
            text -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay());

    private TimestampParser() {
        // utility class - not instantiable
    }

    /**
     * @param raw cell text; may be {@code null}
     * @return the parsed timestamp, or empty when {@code raw} is not a timestamp
     */
    public static Optional<LocalDateTime> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        for (Function<String, LocalDateTime> format : FORMATS) {
            try {
                return Optional.of(format.apply(text));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }
}
