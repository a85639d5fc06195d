/**
 * Telemetry data model shared by the reader, the scorers and the writer.
 *
 * <ul>
 * <li>{@link com.telemetrysentinel.core.model.TelemetryTable} - cleaned,
 * timestamp-indexed table of sensor readings</li>
 * <li>{@link com.telemetrysentinel.core.model.PredictionResult} - one
 * {@link com.telemetrysentinel.core.model.Label} per table row</li>
 * <li>{@link com.telemetrysentinel.core.model.SensorSeries} - a single sensor
 * with its anomaly flags, ready for plotting</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.model;
