package com.telemetrysentinel.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.telemetrysentinel.core.model.TelemetryTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads a telemetry CSV file into a cleaned {@link TelemetryTable}.
 *
 * <h3>Cleaning rules</h3>
 * <ul>
 * <li>The header row is required and must name a {@value #TIMESTAMP_COLUMN}
 * column.</li>
 * <li>The serialisation index column ({@value #INDEX_COLUMN}, or a leading
 * column with a blank name) is dropped.</li>
 * <li>{@value #STATUS_COLUMN} is kept as the status label and excluded from
 * the features.</li>
 * <li>Rows whose timestamp does not parse are dropped and counted.</li>
 * <li>Blank feature cells become {@code NaN}; any other non-numeric cell in a
 * kept row fails the whole file.</li>
 * </ul>
 *
 * <p>
 * Stateless and safe to share between workers.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryReader {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryReader.class);

    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String INDEX_COLUMN = "Unnamed: 0";
    public static final String STATUS_COLUMN = "machine_status";

    private final ObjectReader rowReader;

    public TelemetryReader() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        this.rowReader = mapper.readerFor(String[].class);
    }

    /**
     * @param file the CSV file to read
     * @return the cleaned table; empty when no row has a valid timestamp
     * @throws IOException                  if the file cannot be read
     * @throws MalformedTelemetryException  if the content is not a telemetry table
     */
    public TelemetryTable read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        String source = String.valueOf(file.getFileName());
        try (InputStream in = Files.newInputStream(file)) {
            TelemetryTable table = read(source, in);
            if (table.getDroppedRows() > 0) {
                LOG.warn("Dropped {} row(s) with unparseable timestamps from {}", table.getDroppedRows(), file);
            }
            LOG.debug("Read {} from {}", table, file);
            return table;
        }
    }

    /**
     * @param source name used in the table and in error messages
     * @param in     CSV content; closed once the last row is read
     * @return the cleaned table
     * @throws IOException                 if the stream cannot be read
     * @throws MalformedTelemetryException if the content is not a telemetry table,
     *                                     including CSV syntax and encoding errors
     */
    public TelemetryTable read(String source, InputStream in) throws IOException {
        try (MappingIterator<String[]> rows = rowReader.readValues(in)) {
            if (!rows.hasNextValue()) {
                throw new MalformedTelemetryException(source, "file is empty, a header row is required");
            }
            Layout layout = Layout.of(source, rows.nextValue());

            TelemetryTable.Builder builder = TelemetryTable.builder(source, layout.featureNames);
            if (layout.statusIndex < 0) {
                builder.withoutStatusLabels();
            }

            int line = 1;
            int dropped = 0;
            while (rows.hasNextValue()) {
                String[] cells = rows.nextValue();
                line++;
                if (cells.length > layout.width) {
                    throw new MalformedTelemetryException(source, "line " + line + " has " + cells.length
                            + " fields, header has " + layout.width);
                }
                Optional<LocalDateTime> timestamp = TimestampParser.parse(cell(cells, layout.timestampIndex));
                if (timestamp.isEmpty()) {
                    dropped++;
                    continue;
                }
                double[] values = new double[layout.featureIndexes.length];
                for (int f = 0; f < values.length; f++) {
                    values[f] = parseReading(source, line, layout.featureNames.get(f),
                            cell(cells, layout.featureIndexes[f]));
                }
                String status = layout.statusIndex >= 0 ? cell(cells, layout.statusIndex) : null;
                builder.addRow(timestamp.get(), values, status);
            }
            return builder.droppedRows(dropped).build();
        } catch (JsonProcessingException e) {
            throw new MalformedTelemetryException(source, "unreadable CSV: " + e.getOriginalMessage(), e);
        } catch (CharConversionException e) {
            throw new MalformedTelemetryException(source, "unreadable CSV: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String cell(String[] cells, int index) {
        return index < cells.length ? cells[index] : null;
    }

    private static double parseReading(String source, int line, String column, String raw) {
        if (raw == null || raw.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedTelemetryException(source, "line " + line + ", column '" + column
                    + "': not a number: '" + raw + "'", e);
        }
    }

    /** Column positions resolved from the header row. */
    private static final class Layout {
        private final int width;
        private final int timestampIndex;
        private final int statusIndex;
        private final List<String> featureNames;
        private final int[] featureIndexes;

        private Layout(int width, int timestampIndex, int statusIndex, List<String> featureNames,
                       int[] featureIndexes) {
            this.width = width;
            this.timestampIndex = timestampIndex;
            this.statusIndex = statusIndex;
            this.featureNames = featureNames;
            this.featureIndexes = featureIndexes;
        }

        static Layout of(String source, String[] header) {
            int timestampIndex = -1;
            int statusIndex = -1;
            List<String> names = new ArrayList<>();
            List<Integer> indexes = new ArrayList<>();

            for (int i = 0; i < header.length; i++) {
                String name = header[i] == null ? "" : header[i].trim();
                if (name.equals(TIMESTAMP_COLUMN)) {
                    timestampIndex = i;
                } else if (name.equals(STATUS_COLUMN)) {
                    statusIndex = i;
                } else if (name.equals(INDEX_COLUMN) || name.isEmpty()) {
                    LOG.trace("{}: dropping index column at position {}", source, i);
                } else if (names.contains(name)) {
                    throw new MalformedTelemetryException(source, "duplicate column '" + name + "'");
                } else {
                    names.add(name);
                    indexes.add(i);
                }
            }
            if (timestampIndex < 0) {
                throw new MalformedTelemetryException(source, "no '" + TIMESTAMP_COLUMN
                        + "' column in header " + Arrays.toString(header));
            }
            return new Layout(header.length, timestampIndex, statusIndex, List.copyOf(names),
                    indexes.stream().mapToInt(Integer::intValue).toArray());
        }
    }
}
