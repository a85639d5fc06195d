package com.telemetrysentinel.monitor;

import com.telemetrysentinel.core.io.MalformedTelemetryException;
import com.telemetrysentinel.core.model.FeatureMismatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Result of one unit of work.
 *
 * <p>
 * Only {@link Status#SUCCEEDED} means the source file was removed by this
 * unit; {@link Status#ALREADY_GONE} means it was missing before the unit
 * started. Every other status leaves it in the input directory.
 * </p>
 *
 * @since 1.0.0
 */
public final class UnitOutcome {

    /** Terminal state of a unit of work. */
    public enum Status {
        SUCCEEDED,
        /** Every row was dropped during cleaning. */
        NOTHING_TO_SCORE,
        FAILED,
        /** Submitted after the coordinator stopped accepting work. */
        REJECTED,
        /** The file was no longer there, usually a repeat delivery of a finished unit. */
        ALREADY_GONE
    }

    /** Classification of a failure, used in logs and metrics. */
    public enum FailureKind {
        MALFORMED_INPUT,
        FEATURE_MISMATCH,
        IO,
        UNEXPECTED;

        /**
         * @param error the exception raised by the unit
         * @return the matching kind, looking through wrapper exceptions
         */
        public static FailureKind classify(Throwable error) {
            Throwable cause = unwrap(error);
            if (cause instanceof MalformedTelemetryException) {
                return MALFORMED_INPUT;
            }
            if (cause instanceof FeatureMismatchException) {
                return FEATURE_MISMATCH;
            }
            if (cause instanceof IOException) {
                return IO;
            }
            return UNEXPECTED;
        }

        static Throwable unwrap(Throwable error) {
            Throwable current = error;
            while ((current instanceof CompletionException
                    || current instanceof ExecutionException
                    || current instanceof UncheckedIOException)
                    && current.getCause() != null) {
                current = current.getCause();
            }
            return current;
        }
    }

    private final Status status;
    private final Path source;
    private final Path predictionFile;
    private final List<Path> plotFiles;
    private final int rowCount;
    private final long anomalyCount;
    private final FailureKind failureKind;
    private final Throwable failure;

    private UnitOutcome(Status status, Path source, Path predictionFile, List<Path> plotFiles,
                        int rowCount, long anomalyCount, FailureKind failureKind, Throwable failure) {
        this.status = status;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.predictionFile = predictionFile;
        this.plotFiles = List.copyOf(plotFiles);
        this.rowCount = rowCount;
        this.anomalyCount = anomalyCount;
        this.failureKind = failureKind;
        this.failure = failure;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static UnitOutcome succeeded(Path source, Path predictionFile, List<Path> plotFiles,
                                        int rowCount, long anomalyCount) {
        Objects.requireNonNull(predictionFile, "predictionFile must not be null");
        return new UnitOutcome(Status.SUCCEEDED, source, predictionFile, plotFiles, rowCount, anomalyCount,
                null, null);
    }

    public static UnitOutcome nothingToScore(Path source) {
        return new UnitOutcome(Status.NOTHING_TO_SCORE, source, null, List.of(), 0, 0, null, null);
    }

    public static UnitOutcome failed(Path source, Throwable failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        Throwable cause = FailureKind.unwrap(failure);
        return new UnitOutcome(Status.FAILED, source, null, List.of(), 0, 0, FailureKind.classify(cause), cause);
    }

    public static UnitOutcome rejected(Path source) {
        return new UnitOutcome(Status.REJECTED, source, null, List.of(), 0, 0, null, null);
    }

    public static UnitOutcome alreadyGone(Path source) {
        return new UnitOutcome(Status.ALREADY_GONE, source, null, List.of(), 0, 0, null, null);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Status getStatus() {
        return status;
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }

    public Path getSource() {
        return source;
    }

    public Optional<Path> getPredictionFile() {
        return Optional.ofNullable(predictionFile);
    }

    public List<Path> getPlotFiles() {
        return plotFiles;
    }

    public int getRowCount() {
        return rowCount;
    }

    public long getAnomalyCount() {
        return anomalyCount;
    }

    public Optional<FailureKind> getFailureKind() {
        return Optional.ofNullable(failureKind);
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "UnitOutcome{" +
                "status=" + status +
                ", source=" + source +
                ", rows=" + rowCount +
                ", anomalies=" + anomalyCount +
                (failureKind != null ? ", failureKind=" + failureKind : "") +
                '}';
    }
}
