package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.config.FileConvention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Watches the input directory and emits an {@link ArrivalEvent} for every new
 * file that passes {@link FileConvention#isArrival(Path)}.
 *
 * <p>
 * The watch is registered before the optional scan of files already present,
 * so a file written during startup is seen at least once. The coordinator
 * drops duplicates. When the platform reports an overflow the directory is
 * rescanned.
 * </p>
 *
 * <p>
 * Events are delivered on a single daemon thread named
 * {@value #THREAD_NAME}; the sink must not block for long.
 * </p>
 *
 * @since 1.0.0
 */
public class FileArrivalDetector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FileArrivalDetector.class);

    static final String THREAD_NAME = "arrival-detector";

    private final Path directory;
    private final FileConvention convention;
    private final Consumer<ArrivalEvent> sink;
    private final boolean processExisting;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private WatchService watchService;
    private Thread thread;

    /**
     * @param directory       directory to watch; must exist
     * @param convention      decides which files are arrivals
     * @param sink            receives each arrival
     * @param processExisting also emit arrivals already present at start
     */
    public FileArrivalDetector(Path directory, FileConvention convention, Consumer<ArrivalEvent> sink,
                               boolean processExisting) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath();
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.processExisting = processExisting;
    }

    /**
     * Register the watch and start the detector thread.
     *
     * @throws IOException           if the watch cannot be registered
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Detector already started for " + directory);
        }
        try {
            watchService = directory.getFileSystem().newWatchService();
            directory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            running.set(false);
            closeWatchService();
            throw e;
        }
        LOG.info("Watching {} for new '*{}' files", directory, convention.getExtension());

        if (processExisting) {
            scan("startup");
        }

        thread = new Thread(this::pollLoop, THREAD_NAME);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stop the detector thread and release the watch. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closeWatchService();
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Stopped watching {}", directory);
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void pollLoop() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (ClosedWatchServiceException e) {
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    LOG.warn("Watch events overflowed for {}, rescanning", directory);
                    scan("overflow");
                    continue;
                }
                Path created = directory.resolve((Path) event.context());
                emitIfArrival(created);
            }

            if (!key.reset()) {
                LOG.error("Watch on {} is no longer valid; detector stopping", directory);
                running.set(false);
                break;
            }
        }
        LOG.debug("Detector thread exiting");
    }

    private void scan(String reason) {
        List<Path> present;
        try (Stream<Path> files = Files.list(directory)) {
            present = files.sorted().toList();
        } catch (IOException e) {
            LOG.error("Cannot list {} during {} scan: {}", directory, reason, e.getMessage(), e);
            return;
        }
        LOG.info("Found {} file(s) in {} during {} scan", present.size(), directory, reason);
        present.forEach(this::emitIfArrival);
    }

    private void emitIfArrival(Path file) {
        if (!convention.isArrival(file) || Files.isDirectory(file)) {
            LOG.trace("Ignoring {}", file);
            return;
        }
        LOG.info("New file detected: {}", file);
        try {
            sink.accept(ArrivalEvent.now(file));
        } catch (RuntimeException e) {
            LOG.error("Arrival sink failed for {}: {}", file, e.getMessage(), e);
        }
    }

    private void closeWatchService() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            LOG.warn("Failed to close watch service for {}: {}", directory, e.getMessage());
        }
    }
}
