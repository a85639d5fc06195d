/**
 * Directory-watching service that scores telemetry files as they arrive.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.telemetrysentinel.monitor.TelemetrySentinelApp} - main entry
 * point</li>
 * <li>{@link com.telemetrysentinel.monitor.MonitoringService} - startup,
 * bootstrap and graceful shutdown</li>
 * <li>{@link com.telemetrysentinel.monitor.FileArrivalDetector} - watch on the
 * input directory</li>
 * <li>{@link com.telemetrysentinel.monitor.ProcessingCoordinator} - worker
 * pool with per-file failure isolation</li>
 * <li>{@link com.telemetrysentinel.monitor.ScoringUnitOfWork} - read, score,
 * persist, plot, delete</li>
 * <li>{@link com.telemetrysentinel.monitor.HealthServer} - HTTP health and
 * metrics endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.monitor;
