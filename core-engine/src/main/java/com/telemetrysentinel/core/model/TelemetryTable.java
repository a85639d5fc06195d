package com.telemetrysentinel.core.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Cleaned, timestamp-indexed telemetry of one source file.
 *
 * <p>
 * Rows keep the order in which they appeared in the source. Every row has a
 * parsed timestamp; rows whose timestamp failed to parse have already been
 * dropped and are only reflected in {@link #getDroppedRows()}. Feature columns
 * are numeric, with {@code NaN} standing for a blank reading. The status label
 * column, when the source has one, is held apart from the features.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and may be shared between workers.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetryTable {

    private final String source;
    private final List<String> featureNames;
    private final Map<String, Integer> featureIndex;
    private final List<LocalDateTime> timestamps;
    private final double[][] rows;
    private final List<String> statusLabels;
    private final int droppedRows;

    private TelemetryTable(Builder b) {
        this.source = b.source;
        this.featureNames = List.copyOf(b.featureNames);
        this.timestamps = Collections.unmodifiableList(new ArrayList<>(b.timestamps));
        this.rows = b.rows.toArray(new double[0][]);
        this.statusLabels = b.statusLabels == null
                ? null
                : Collections.unmodifiableList(new ArrayList<>(b.statusLabels));
        this.droppedRows = b.droppedRows;

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < featureNames.size(); i++) {
            if (index.put(featureNames.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate feature column '" + featureNames.get(i)
                        + "' in " + source);
            }
        }
        this.featureIndex = Collections.unmodifiableMap(index);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return name of the file (or other origin) the table was read from
     */
    public String getSource() {
        return source;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public int rowCount() {
        return rows.length;
    }

    public boolean isEmpty() {
        return rows.length == 0;
    }

    /**
     * @return number of source rows dropped because their timestamp did not parse
     */
    public int getDroppedRows() {
        return droppedRows;
    }

    /**
     * @param i row index
     * @return a copy of the feature values of row {@code i}
     */
    public double[] row(int i) {
        return rows[i].clone();
    }

    /**
     * @param name feature column name
     * @return the column's values in row order
     * @throws IllegalArgumentException if the table has no such feature
     */
    public double[] column(String name) {
        Integer idx = featureIndex.get(name);
        if (idx == null) {
            throw new IllegalArgumentException("Sensor '" + name + "' is not a feature of " + source
                    + "; available: " + featureNames);
        }
        double[] values = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            values[r] = rows[r][idx];
        }
        return values;
    }

    public boolean hasFeature(String name) {
        return featureIndex.containsKey(name);
    }

    /**
     * @return the status label column, or empty if the source had none
     */
    public Optional<List<String>> getStatusLabels() {
        return Optional.ofNullable(statusLabels);
    }

    // ---------------------------------------------------------------
    // Derivations
    // ---------------------------------------------------------------

    /**
     * Project the rows onto the given feature order.
     *
     * <p>
     * Columns are matched by name, so a table whose columns are a permutation
     * of {@code expected} is accepted.
     * </p>
     *
     * @param expected the fitted feature names, in fitted order
     * @return a row-major matrix whose columns follow {@code expected}
     * @throws FeatureMismatchException if a feature is missing or unexpected
     */
    public double[][] alignTo(List<String> expected) {
        List<String> missing = new ArrayList<>();
        for (String name : expected) {
            if (!featureIndex.containsKey(name)) {
                missing.add(name);
            }
        }
        Set<String> expectedSet = new LinkedHashSet<>(expected);
        List<String> unexpected = featureNames.stream()
                .filter(name -> !expectedSet.contains(name))
                .toList();
        if (!missing.isEmpty() || !unexpected.isEmpty()) {
            throw new FeatureMismatchException(missing, unexpected);
        }

        int[] order = expected.stream().mapToInt(featureIndex::get).toArray();
        double[][] aligned = new double[rows.length][order.length];
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < order.length; c++) {
                aligned[r][c] = rows[r][order[c]];
            }
        }
        return aligned;
    }

    /**
     * Build the plot series of one sensor.
     *
     * @param sensor     feature column name
     * @param prediction labels aligned with this table's rows
     * @return the sensor's series with anomaly flags
     * @throws IllegalArgumentException if the sensor is not a feature or the
     *                                  prediction size differs from the row count
     */
    public SensorSeries series(String sensor, PredictionResult prediction) {
        Objects.requireNonNull(prediction, "prediction must not be null");
        if (prediction.size() != rows.length) {
            throw new IllegalArgumentException("Prediction has " + prediction.size()
                    + " labels but " + source + " has " + rows.length + " rows");
        }
        boolean[] flags = new boolean[rows.length];
        List<Label> labels = prediction.getLabels();
        for (int i = 0; i < flags.length; i++) {
            flags[i] = labels.get(i).isAnomaly();
        }
        return new SensorSeries(sensor, timestamps, column(sensor), flags);
    }

    /**
     * Concatenate tables sharing the same feature columns, in list order.
     *
     * @param tables tables to concatenate; must not be empty
     * @return a table holding every row of every input
     * @throws IllegalArgumentException if the list is empty or feature sets differ
     */
    public static TelemetryTable concat(List<TelemetryTable> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        TelemetryTable first = tables.get(0);
        if (tables.size() == 1) {
            return first;
        }

        List<String> names = first.featureNames;
        boolean allLabelled = tables.stream().allMatch(t -> t.statusLabels != null);
        Builder builder = builder("concat" + tables.stream().map(TelemetryTable::getSource).toList(), names);
        int dropped = 0;
        for (TelemetryTable table : tables) {
            double[][] aligned = table.alignTo(names);
            for (int r = 0; r < aligned.length; r++) {
                builder.addRow(table.timestamps.get(r), aligned[r],
                        allLabelled ? table.statusLabels.get(r) : null);
            }
            dropped += table.droppedRows;
        }
        if (!allLabelled) {
            builder.withoutStatusLabels();
        }
        return builder.droppedRows(dropped).build();
    }

    @Override
    public String toString() {
        return "TelemetryTable{source='" + source + "', rows=" + rows.length
                + ", features=" + featureNames.size() + ", dropped=" + droppedRows + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * @param source       origin of the rows, used in log and error messages
     * @param featureNames feature columns in source order
     * @return a new builder
     */
    public static Builder builder(String source, List<String> featureNames) {
        return new Builder(source, featureNames);
    }

    /**
     * Row-by-row builder used by readers. Not thread-safe.
     */
    public static class Builder {
        private final String source;
        private final List<String> featureNames;
        private final List<LocalDateTime> timestamps = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();
        private List<String> statusLabels = new ArrayList<>();
        private int droppedRows;

        private Builder(String source, List<String> featureNames) {
            this.source = Objects.requireNonNull(source, "source must not be null");
            this.featureNames = List.copyOf(featureNames);
        }

        /**
         * @param timestamp parsed row timestamp
         * @param values    feature values in builder column order
         * @param status    status label, or {@code null} when the source has none
         */
        public Builder addRow(LocalDateTime timestamp, double[] values, String status) {
            Objects.requireNonNull(timestamp, "timestamp must not be null");
            if (values.length != featureNames.size()) {
                throw new IllegalArgumentException("Row has " + values.length + " values, expected "
                        + featureNames.size() + " in " + source);
            }
            timestamps.add(timestamp);
            rows.add(Arrays.copyOf(values, values.length));
            if (statusLabels != null) {
                statusLabels.add(status);
            }
            return this;
        }

        public Builder withoutStatusLabels() {
            this.statusLabels = null;
            return this;
        }

        public Builder droppedRows(int droppedRows) {
            this.droppedRows = droppedRows;
            return this;
        }

        public TelemetryTable build() {
            return new TelemetryTable(this);
        }
    }
}
