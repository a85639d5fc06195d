package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.io.OutputWriter;
import com.telemetrysentinel.core.io.TelemetryReader;
import com.telemetrysentinel.core.model.PredictionResult;
import com.telemetrysentinel.core.model.TelemetryTable;
import com.telemetrysentinel.core.scoring.ScorerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The production unit of work: read, score, persist, plot, delete.
 *
 * <h3>Ordering</h3>
 * <p>
 * Steps run strictly in order. Plots of the different sensors are rendered
 * concurrently on the plot executor and all of them must finish before the
 * source file is removed. If any step throws, the source stays in the input
 * directory for inspection.
 * </p>
 *
 * <h3>Settling</h3>
 * <p>
 * A creation event fires as soon as a writer opens the file. Before reading,
 * the unit waits until the file size stops changing across one settle
 * interval (disabled with a zero settle time).
 * </p>
 *
 * <p>
 * A delivery for a file that no longer exists is a no-op: a repeat event for
 * a file an earlier unit already retired ends as
 * {@link UnitOutcome.Status#ALREADY_GONE}.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoringUnitOfWork implements UnitOfWork {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringUnitOfWork.class);

    static final int MAX_SETTLE_ROUNDS = 20;

    private final TelemetryReader reader;
    private final ScorerGateway gateway;
    private final OutputWriter writer;
    private final List<String> sensorsToPlot;
    private final Executor plotExecutor;
    private final Duration settleTime;

    /**
     * @param reader        telemetry reader
     * @param gateway       fitted scorer
     * @param writer        output writer
     * @param sensorsToPlot sensors to render for each file
     * @param plotExecutor  executor for plot rendering; must not be the worker
     *                      pool itself
     * @param settleTime    interval between size checks, zero to skip
     */
    public ScoringUnitOfWork(TelemetryReader reader, ScorerGateway gateway, OutputWriter writer,
                             List<String> sensorsToPlot, Executor plotExecutor, Duration settleTime) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.sensorsToPlot = List.copyOf(sensorsToPlot);
        this.plotExecutor = Objects.requireNonNull(plotExecutor, "plotExecutor must not be null");
        this.settleTime = Objects.requireNonNull(settleTime, "settleTime must not be null");
    }

    @Override
    public UnitOutcome process(ArrivalEvent event) throws IOException, InterruptedException {
        Path source = event.getPath();
        String fileName = event.getFileName();
        if (Files.notExists(source)) {
            LOG.debug("{} is gone, already processed by an earlier delivery", source);
            return UnitOutcome.alreadyGone(source);
        }
        LOG.info("Processing started for {}", source);

        awaitStableSize(source);

        // 1. load and clean
        TelemetryTable table = reader.read(source);
        if (table.isEmpty()) {
            LOG.warn("Nothing to score in {}: all {} row(s) had unparseable timestamps; leaving file in place",
                    source, table.getDroppedRows());
            return UnitOutcome.nothingToScore(source);
        }

        // 2. score
        PredictionResult result = gateway.predict(table);

        // 3. persist predictions
        Path predictionFile = writer.writePredictions(fileName, result);

        // 4. plots, concurrently
        List<Path> plotFiles = renderPlots(fileName, table, result);

        // 5. retire the input
        if (Files.deleteIfExists(source)) {
            LOG.info("Removed original data file {}", source);
        } else {
            LOG.warn("Original data file {} was already gone", source);
        }
        return UnitOutcome.succeeded(source, predictionFile, plotFiles, table.rowCount(), result.anomalyCount());
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Path> renderPlots(String fileName, TelemetryTable table, PredictionResult result) {
        List<CompletableFuture<Path>> plots = sensorsToPlot.stream()
                .map(sensor -> CompletableFuture.supplyAsync(() -> {
                    try {
                        return writer.writePlot(fileName, table.series(sensor, result));
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }, plotExecutor))
                .toList();

        // allOf completes only after every plot has finished, failed or not
        CompletableFuture.allOf(plots.toArray(new CompletableFuture<?>[0])).join();
        return plots.stream().map(CompletableFuture::join).toList();
    }

    private void awaitStableSize(Path source) throws IOException, InterruptedException {
        if (settleTime.isZero()) {
            return;
        }
        long previous = Files.size(source);
        for (int round = 0; round < MAX_SETTLE_ROUNDS; round++) {
            Thread.sleep(settleTime.toMillis());
            long current = Files.size(source);
            if (current == previous) {
                return;
            }
            LOG.debug("{} still growing ({} -> {} bytes)", source, previous, current);
            previous = current;
        }
        LOG.warn("{} kept growing for {} settle rounds; processing anyway", source, MAX_SETTLE_ROUNDS);
    }
}
