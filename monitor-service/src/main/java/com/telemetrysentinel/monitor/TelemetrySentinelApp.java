package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.config.ConfigLoader;
import com.telemetrysentinel.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the telemetry sentinel.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   training files (train_*.csv)
 *     → fit baseline scorer → scorer artifact
 *   new files in the input directory
 *     → read and clean → predict → predictions_&lt;file&gt;
 *     → anomaly_plot_&lt;sensor&gt;_&lt;stem&gt;.png per sensor
 *     → delete the input
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * The configuration file is the first argument, otherwise it is resolved by
 * {@link ConfigLoader#load()}: the {@value ConfigLoader#ENV_CONFIG_PATH}
 * environment variable, then {@value ConfigLoader#DEFAULT_CONFIG_FILE} in the
 * working directory.
 * </p>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0} - stopped through SIGINT/SIGTERM and every in-flight file
 * drained within the shutdown timeout</li>
 * <li>{@code 1} - configuration or bootstrap failed</li>
 * <li>{@code 2} - stopped, but the drain timed out and workers were
 * interrupted</li>
 * </ul>
 * <p>
 * The shutdown hook drains the service and then halts with one of these
 * codes, so the signal status never reaches the caller.
 * </p>
 *
 * @since 1.0.0
 */
public final class TelemetrySentinelApp {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetrySentinelApp.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_STARTUP_FAILURE = 1;
    static final int EXIT_DRAIN_TIMEOUT = 2;

    private TelemetrySentinelApp() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        MonitoringService service;
        try {
            // 1. Load configuration
            PipelineConfig config = loadConfig(args);

            // 2. Fit and start watching
            service = new MonitoringService(config);
            service.start();
        } catch (RuntimeException e) {
            LOG.error("Telemetry sentinel failed to start: {}", e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }

        // 3. Drain on SIGINT/SIGTERM
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            service.close();
            Runtime.getRuntime().halt(shutdownExitCode(service));
        }, "sentinel-shutdown"));

        // 4. Block until stopped
        try {
            service.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.close();
        }
        LOG.info("Telemetry sentinel exiting");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static int shutdownExitCode(MonitoringService service) {
        if (service.isDrainedCleanly()) {
            return EXIT_CLEAN;
        }
        LOG.warn("Shutdown did not drain cleanly, exiting with {}", EXIT_DRAIN_TIMEOUT);
        return EXIT_DRAIN_TIMEOUT;
    }

    static PipelineConfig loadConfig(String[] args) {
        if (args.length > 0 && !args[0].isBlank()) {
            return ConfigLoader.fromFile(Path.of(args[0]));
        }
        return ConfigLoader.load();
    }
}
