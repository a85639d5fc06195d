package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.config.PipelineConfig;
import com.telemetrysentinel.core.io.JFreeChartPlotRenderer;
import com.telemetrysentinel.core.io.OutputWriter;
import com.telemetrysentinel.core.io.PlotRenderer;
import com.telemetrysentinel.core.io.TelemetryReader;
import com.telemetrysentinel.core.scoring.BootstrapStage;
import com.telemetrysentinel.core.scoring.Scorer;
import com.telemetrysentinel.core.scoring.ScorerFactory;
import com.telemetrysentinel.core.scoring.ScorerGateway;
import com.telemetrysentinel.core.scoring.ScorerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires the pipeline together and owns its lifecycle.
 *
 * <h3>Startup</h3>
 * <pre>
 *   prepare directories
 *     → bootstrap scorer from training files
 *     → save artifact to scorer path, reload through the gateway
 *     → start worker and plot pools
 *     → start detector (and health server when a port is set)
 * </pre>
 * <p>
 * Any startup failure is thrown to the caller and leaves nothing running.
 * Bootstrap is the only fitting step; the scorer is never refitted while
 * watching.
 * </p>
 *
 * <h3>Shutdown</h3>
 * <p>
 * {@link #stop()} stops the detector first so no new work is accepted, then
 * drains the coordinator for at most the configured shutdown timeout. It is
 * idempotent and safe to call from a JVM shutdown hook.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringService.class);

    private final PipelineConfig config;
    private final PlotRenderer plotRenderer;
    private final PipelineMetrics metrics;
    private final TelemetryReader reader = new TelemetryReader();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile PipelineState state = PipelineState.UNFITTED;
    private volatile boolean drainedCleanly;
    private ScorerGateway gateway;
    private ExecutorService plotPool;
    private ProcessingCoordinator coordinator;
    private FileArrivalDetector detector;
    private HealthServer healthServer;

    public MonitoringService(PipelineConfig config) {
        this(config, new JFreeChartPlotRenderer(), new PipelineMetrics());
    }

    public MonitoringService(PipelineConfig config, PlotRenderer plotRenderer, PipelineMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.plotRenderer = Objects.requireNonNull(plotRenderer, "plotRenderer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Fit the baseline and start watching.
     *
     * @throws IllegalStateException if called twice or if any startup step fails
     */
    public synchronized void start() {
        if (state != PipelineState.UNFITTED) {
            throw new IllegalStateException("Service already started, state is " + state);
        }
        LOG.info("Starting telemetry sentinel with config: {}", config);
        try {
            config.prepareDirectories();

            // 1. fit once, persist, and reload the artifact the workers will use
            BootstrapStage bootstrap = new BootstrapStage(config.getFileConvention(), reader,
                    () -> ScorerFactory.create(config));
            Scorer fitted = bootstrap.bootstrap(config.getInputDir());
            ScorerRepository.save(fitted, config.getScorerPath());
            gateway = ScorerGateway.load(config.getScorerPath());
            requirePlottableSensors(gateway.getFeatureNames());
            state = PipelineState.FITTED;

            // 2. pools and coordinator
            plotPool = Executors.newFixedThreadPool(config.getPlotThreads(),
                    ProcessingCoordinator.namedThreads("plot-worker"));
            OutputWriter writer = new OutputWriter(config.getOutputDir(), config.getImageDir(), plotRenderer);
            UnitOfWork unit = new ScoringUnitOfWork(reader, gateway, writer, config.getSensorsToPlot(),
                    plotPool, config.getSettleTime());
            coordinator = new ProcessingCoordinator(config.getWorkerThreads(), unit, metrics);

            // 3. optional health endpoint
            if (config.getHealthPort() > 0) {
                healthServer = new HealthServer(this::getState, metrics);
                healthServer.start(config.getHealthPort());
            }

            // 4. detector last, so every arrival finds the workers ready
            detector = new FileArrivalDetector(config.getInputDir(), config.getFileConvention(),
                    coordinator::submit, config.isProcessExisting());
            state = PipelineState.WATCHING;
            detector.start();
            LOG.info("Monitoring {} with {} worker(s) and {} plot thread(s)",
                    config.getInputDir(), config.getWorkerThreads(), config.getPlotThreads());
        } catch (IOException e) {
            shutdownQuietly();
            throw new UncheckedIOException("Failed to start monitoring " + config.getInputDir(), e);
        } catch (RuntimeException e) {
            shutdownQuietly();
            throw e;
        }
    }

    /**
     * Block until {@link #stop()} is called, waking every check interval.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitShutdown() throws InterruptedException {
        long intervalMs = Math.max(1L, config.getCheckInterval().toMillis());
        while (!stopped.await(intervalMs, TimeUnit.MILLISECONDS)) {
            LOG.trace("Still watching {} ({} in flight)", config.getInputDir(),
                    coordinator == null ? 0 : coordinator.inFlightCount());
        }
    }

    /**
     * Stop watching and drain in-flight work. Idempotent.
     */
    public synchronized void stop() {
        if (state == PipelineState.STOPPED || state == PipelineState.DRAINING) {
            return;
        }
        LOG.info("Stopping telemetry sentinel");
        state = PipelineState.DRAINING;
        if (detector != null) {
            detector.close();
        }
        drainedCleanly = coordinator == null || coordinator.drain(config.getShutdownTimeout());
        if (plotPool != null) {
            shutdownPool(plotPool);
        }
        if (healthServer != null) {
            healthServer.stop();
        }
        state = PipelineState.STOPPED;
        stopped.countDown();
        LOG.info("Telemetry sentinel stopped: {}", metrics.snapshot());
    }

    @Override
    public void close() {
        stop();
    }

    public PipelineState getState() {
        return state;
    }

    /**
     * @return {@code true} once stopped with every in-flight unit finished
     *         within the shutdown timeout
     */
    public boolean isDrainedCleanly() {
        return state == PipelineState.STOPPED && drainedCleanly;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    /**
     * @return the coordinator, or {@code null} before a successful start
     */
    ProcessingCoordinator getCoordinator() {
        return coordinator;
    }

    HealthServer getHealthServer() {
        return healthServer;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void requirePlottableSensors(List<String> features) {
        List<String> unknown = config.getSensorsToPlot().stream()
                .filter(sensor -> !features.contains(sensor))
                .toList();
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("sensors_to_plot " + unknown
                    + " are not features of the training data " + features);
        }
    }

    private void shutdownQuietly() {
        LOG.error("Startup failed, releasing resources");
        stop();
    }

    private static void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
