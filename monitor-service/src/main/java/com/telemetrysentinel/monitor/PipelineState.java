package com.telemetrysentinel.monitor;

/**
 * Lifecycle of {@link MonitoringService}. Transitions only move forward.
 */
public enum PipelineState {

    /** Configured, no scorer yet. */
    UNFITTED,

    /** Baseline fitted and loaded; workers not started. */
    FITTED,

    /** Detector running, arrivals flow to the workers. */
    WATCHING,

    /** Detector stopped, in-flight files finishing. */
    DRAINING,

    STOPPED
}
