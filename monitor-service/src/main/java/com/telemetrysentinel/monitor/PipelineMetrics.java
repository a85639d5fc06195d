package com.telemetrysentinel.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the monitoring pipeline.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code arrivals_detected_total} - files handed to the coordinator</li>
 *   <li>{@code units_succeeded_total} - files scored, persisted and removed</li>
 *   <li>{@code units_failed_total} - failed or rejected units</li>
 *   <li>{@code units_skipped_total} - files with nothing to score</li>
 *   <li>{@code anomalies_detected_total} - anomalous rows across all files</li>
 *   <li>{@code unit_processing} - timer of per-file processing</li>
 * </ul>
 *
 * <p>
 * The registry is whatever the caller passes in; the no-arg constructor keeps
 * the meters in memory and {@link #snapshot()} is the only way they are read.
 * </p>
 */
public class PipelineMetrics {

    private final MeterRegistry registry;
    private final Counter arrivalsDetected;
    private final Counter unitsSucceeded;
    private final Counter unitsFailed;
    private final Counter unitsSkipped;
    private final Counter anomaliesDetected;
    private final Timer unitProcessing;

    public PipelineMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.arrivalsDetected = registry.counter("arrivals_detected_total");
        this.unitsSucceeded = registry.counter("units_succeeded_total");
        this.unitsFailed = registry.counter("units_failed_total");
        this.unitsSkipped = registry.counter("units_skipped_total");
        this.anomaliesDetected = registry.counter("anomalies_detected_total");
        this.unitProcessing = Timer.builder("unit_processing")
                .description("Time spent processing one arrived file")
                .register(registry);
    }

    public void incrementArrivals() {
        arrivalsDetected.increment();
    }

    /**
     * Count a finished unit by its status and record how long it took.
     */
    public void recordOutcome(UnitOutcome outcome, Duration elapsed) {
        unitProcessing.record(elapsed);
        switch (outcome.getStatus()) {
            case SUCCEEDED -> {
                unitsSucceeded.increment();
                anomaliesDetected.increment(outcome.getAnomalyCount());
            }
            case NOTHING_TO_SCORE -> unitsSkipped.increment();
            case FAILED, REJECTED -> unitsFailed.increment();
            case ALREADY_GONE -> {
                // repeat delivery, nothing was processed
            }
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @return current counter values and timer summary, keyed by meter name
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("arrivals_detected_total", (long) arrivalsDetected.count());
        values.put("units_succeeded_total", (long) unitsSucceeded.count());
        values.put("units_failed_total", (long) unitsFailed.count());
        values.put("units_skipped_total", (long) unitsSkipped.count());
        values.put("anomalies_detected_total", (long) anomaliesDetected.count());
        values.put("unit_processing_count", unitProcessing.count());
        values.put("unit_processing_max_ms", unitProcessing.max(TimeUnit.MILLISECONDS));
        values.put("unit_processing_mean_ms", unitProcessing.mean(TimeUnit.MILLISECONDS));
        return values;
    }
}
