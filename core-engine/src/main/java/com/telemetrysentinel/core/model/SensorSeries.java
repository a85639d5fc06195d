package com.telemetrysentinel.core.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Time-indexed values of a single sensor, with the anomaly verdict of each
 * row. Input to plot rendering.
 *
 * @since 1.0.0
 */
public final class SensorSeries {

    private final String sensor;
    private final List<LocalDateTime> timestamps;
    private final double[] values;
    private final boolean[] anomalies;

    /**
     * @param sensor     sensor (column) name
     * @param timestamps row timestamps
     * @param values     sensor values; {@code NaN} for missing readings
     * @param anomalies  per-row anomaly flags
     * @throws IllegalArgumentException if the three sequences differ in length
     */
    public SensorSeries(String sensor, List<LocalDateTime> timestamps, double[] values, boolean[] anomalies) {
        this.sensor = Objects.requireNonNull(sensor, "sensor must not be null");
        this.timestamps = List.copyOf(timestamps);
        this.values = values.clone();
        this.anomalies = anomalies.clone();
        if (this.values.length != this.timestamps.size() || this.anomalies.length != this.timestamps.size()) {
            throw new IllegalArgumentException("Series '" + sensor + "' has misaligned lengths: timestamps="
                    + this.timestamps.size() + ", values=" + this.values.length
                    + ", anomalies=" + this.anomalies.length);
        }
    }

    public String getSensor() {
        return sensor;
    }

    public List<LocalDateTime> getTimestamps() {
        return timestamps;
    }

    public int size() {
        return timestamps.size();
    }

    public double valueAt(int i) {
        return values[i];
    }

    public boolean isAnomalyAt(int i) {
        return anomalies[i];
    }

    @Override
    public String toString() {
        return "SensorSeries{sensor='" + sensor + "', size=" + size() + '}';
    }
}
