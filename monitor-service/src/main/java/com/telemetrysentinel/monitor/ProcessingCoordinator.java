package com.telemetrysentinel.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one {@link UnitOfWork} per arrival on a fixed pool of workers.
 *
 * <h3>Isolation</h3>
 * <p>
 * Exceptions, assertion and linkage errors thrown by a unit are caught at the
 * unit boundary, logged with the file and its {@link UnitOutcome.FailureKind}
 * and turned into a {@link UnitOutcome.Status#FAILED FAILED} outcome. A
 * failing file never affects other files. A {@link VirtualMachineError} fails
 * the arrival's future and is rethrown on the worker, which the pool
 * replaces.
 * </p>
 *
 * <h3>De-duplication</h3>
 * <p>
 * A path already queued or running is not scheduled again; the caller gets
 * the in-flight future. The path becomes schedulable again once its unit ends.
 * </p>
 *
 * <p>
 * The backlog is unbounded. Arrivals submitted after {@link #drain(Duration)}
 * complete immediately as {@link UnitOutcome.Status#REJECTED REJECTED}.
 * </p>
 *
 * @since 1.0.0
 */
public class ProcessingCoordinator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessingCoordinator.class);

    private final ThreadPoolExecutor workers;
    private final UnitOfWork unitOfWork;
    private final PipelineMetrics metrics;
    private final Map<Path, CompletableFuture<UnitOutcome>> inFlight = new ConcurrentHashMap<>();

    /**
     * @param workerThreads number of concurrent units; must be positive
     * @param unitOfWork    per-file strategy
     * @param metrics       outcome counters
     */
    public ProcessingCoordinator(int workerThreads, UnitOfWork unitOfWork, PipelineMetrics metrics) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
        }
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.workers = new ThreadPoolExecutor(workerThreads, workerThreads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), namedThreads("scoring-worker"));
    }

    /**
     * Schedule an arrival.
     *
     * @param event the arrival
     * @return a future completed with the unit's outcome, or exceptionally
     *         only if the unit hit a {@link VirtualMachineError}
     */
    public CompletableFuture<UnitOutcome> submit(ArrivalEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        Path path = event.getPath();

        CompletableFuture<UnitOutcome> future = new CompletableFuture<>();
        CompletableFuture<UnitOutcome> existing = inFlight.putIfAbsent(path, future);
        if (existing != null) {
            LOG.debug("{} is already in flight, not scheduling it again", path);
            return existing;
        }
        metrics.incrementArrivals();

        try {
            workers.execute(() -> run(event, future));
        } catch (RejectedExecutionException e) {
            LOG.warn("Rejected {}: coordinator is no longer accepting work", path);
            complete(event, future, UnitOutcome.rejected(path), Duration.ZERO);
        }
        return future;
    }

    /**
     * Stop taking new work and wait for queued and running units.
     *
     * @param timeout how long to wait before interrupting the workers
     * @return {@code true} if every unit finished within the timeout
     */
    public boolean drain(Duration timeout) {
        workers.shutdown();
        try {
            if (workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.info("Processing coordinator drained");
                return true;
            }
            LOG.warn("{} unit(s) still running after {}, forcing shutdown", inFlight.size(), timeout);
            workers.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        drain(Duration.ZERO);
    }

    public boolean isAccepting() {
        return !workers.isShutdown();
    }

    /**
     * @return number of arrivals queued or running
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void run(ArrivalEvent event, CompletableFuture<UnitOutcome> future) {
        long started = System.nanoTime();
        UnitOutcome outcome;
        try {
            outcome = Objects.requireNonNull(unitOfWork.process(event), "unit of work returned no outcome");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = failed(event, e);
        } catch (Exception | AssertionError | LinkageError e) {
            outcome = failed(event, e);
        } catch (VirtualMachineError e) {
            inFlight.remove(event.getPath(), future);
            future.completeExceptionally(e);
            throw e;
        }
        complete(event, future, outcome, Duration.ofNanos(System.nanoTime() - started));
    }

    private static UnitOutcome failed(ArrivalEvent event, Throwable t) {
        UnitOutcome outcome = UnitOutcome.failed(event.getPath(), t);
        Throwable cause = outcome.getFailure().orElse(t);
        LOG.error("Processing failed for {} [{}]: {}", event.getPath(),
                outcome.getFailureKind().orElse(UnitOutcome.FailureKind.UNEXPECTED), cause.toString(), cause);
        return outcome;
    }

    private void complete(ArrivalEvent event, CompletableFuture<UnitOutcome> future, UnitOutcome outcome,
                          Duration elapsed) {
        inFlight.remove(event.getPath(), future);
        metrics.recordOutcome(outcome, elapsed);
        LOG.debug("Finished {} in {} ms: {}", event.getPath(), elapsed.toMillis(), outcome);
        future.complete(outcome);
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
