package com.telemetrysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of the monitoring pipeline.
 *
 * <p>
 * Resolved once at startup, usually by {@link ConfigLoader} from a JSON or
 * YAML document. Tests and embedding code use the {@link Builder}, which
 * validates every value at {@link Builder#build()} time.
 * </p>
 *
 * <h3>Directories</h3>
 * <p>
 * All paths are absolute and normalised. {@link #prepareDirectories()} must
 * run before monitoring starts: the input directory defines the watched
 * contract and has to exist, while the output and image directories are
 * created on demand.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineConfig.class);

    // ---------------------------------------------------------------
    // Locations
    // ---------------------------------------------------------------
    private final Path inputDir;
    private final Path outputDir;
    private final Path imageDir;
    private final Path scorerPath;

    // ---------------------------------------------------------------
    // Monitoring
    // ---------------------------------------------------------------
    private final List<String> sensorsToPlot;
    private final Duration checkInterval;
    private final int workerThreads;
    private final int plotThreads;
    private final Duration shutdownTimeout;
    private final Duration settleTime;
    private final boolean processExisting;
    private final FileConvention fileConvention;

    // ---------------------------------------------------------------
    // Scorer
    // ---------------------------------------------------------------
    private final String scorerType;
    private final double deviationFactor;
    private final double rangeTolerance;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private PipelineConfig(Builder b) {
        this.inputDir = b.inputDir;
        this.outputDir = b.outputDir;
        this.imageDir = b.imageDir;
        this.scorerPath = b.scorerPath;
        this.sensorsToPlot = List.copyOf(new LinkedHashSet<>(b.sensorsToPlot));
        this.checkInterval = b.checkInterval;
        this.workerThreads = b.workerThreads;
        this.plotThreads = b.plotThreads;
        this.shutdownTimeout = b.shutdownTimeout;
        this.settleTime = b.settleTime;
        this.processExisting = b.processExisting;
        this.fileConvention = new FileConvention(b.trainingPrefix, b.fileExtension);
        this.scorerType = b.scorerType;
        this.deviationFactor = b.deviationFactor;
        this.rangeTolerance = b.rangeTolerance;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Startup checks
    // ---------------------------------------------------------------

    /**
     * Verify the input directory and create the output and image directories.
     *
     * @throws IllegalStateException if the input directory is missing or is not
     *                               a directory, or an output location cannot
     *                               be created
     */
    public void prepareDirectories() {
        if (!Files.isDirectory(inputDir)) {
            throw new IllegalStateException("Input directory not found: " + inputDir);
        }
        createIfMissing(outputDir);
        createIfMissing(imageDir);
        Path scorerParent = scorerPath.getParent();
        if (scorerParent != null) {
            createIfMissing(scorerParent);
        }
    }

    private static void createIfMissing(Path dir) {
        if (Files.isDirectory(dir)) {
            return;
        }
        try {
            LOG.info("Creating directory: {}", dir);
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create directory " + dir,
                    new UncheckedIOException(e));
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getImageDir() {
        return imageDir;
    }

    public Path getScorerPath() {
        return scorerPath;
    }

    /**
     * @return unmodifiable, duplicate-free sensor names in configured order
     */
    public List<String> getSensorsToPlot() {
        return sensorsToPlot;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getPlotThreads() {
        return plotThreads;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getSettleTime() {
        return settleTime;
    }

    public boolean isProcessExisting() {
        return processExisting;
    }

    public FileConvention getFileConvention() {
        return fileConvention;
    }

    public String getScorerType() {
        return scorerType;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public double getRangeTolerance() {
        return rangeTolerance;
    }

    /**
     * @return health server port, or {@code 0} when the server is disabled
     */
    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link PipelineConfig}.
     *
     * <p>
     * {@link #build()} checks that the directories and scorer path are set,
     * durations and thread counts are positive, the health port is
     * {@code 0} or in [1, 65535], and sensor names are non-blank.
     * </p>
     */
    public static class Builder {
        private Path inputDir;
        private Path outputDir;
        private Path imageDir;
        private Path scorerPath;
        private List<String> sensorsToPlot = new ArrayList<>();
        private Duration checkInterval = Duration.ofSeconds(1);
        private int workerThreads = 4;
        private int plotThreads = 2;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration settleTime = Duration.ofMillis(200);
        private boolean processExisting = true;
        private String trainingPrefix = FileConvention.DEFAULT_TRAINING_PREFIX;
        private String fileExtension = FileConvention.DEFAULT_EXTENSION;
        private String scorerType = "statistical";
        private double deviationFactor = 3.0;
        private double rangeTolerance = 0.1;
        private int healthPort = 0;

        public Builder inputDir(Path v) {
            this.inputDir = v;
            return this;
        }

        public Builder outputDir(Path v) {
            this.outputDir = v;
            return this;
        }

        public Builder imageDir(Path v) {
            this.imageDir = v;
            return this;
        }

        public Builder scorerPath(Path v) {
            this.scorerPath = v;
            return this;
        }

        public Builder sensorsToPlot(List<String> v) {
            this.sensorsToPlot = v != null ? new ArrayList<>(v) : new ArrayList<>();
            return this;
        }

        public Builder checkInterval(Duration v) {
            this.checkInterval = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder plotThreads(int v) {
            this.plotThreads = v;
            return this;
        }

        public Builder shutdownTimeout(Duration v) {
            this.shutdownTimeout = v;
            return this;
        }

        public Builder settleTime(Duration v) {
            this.settleTime = v;
            return this;
        }

        public Builder processExisting(boolean v) {
            this.processExisting = v;
            return this;
        }

        public Builder trainingPrefix(String v) {
            this.trainingPrefix = v;
            return this;
        }

        public Builder fileExtension(String v) {
            this.fileExtension = v;
            return this;
        }

        public Builder scorerType(String v) {
            this.scorerType = v;
            return this;
        }

        public Builder deviationFactor(double v) {
            this.deviationFactor = v;
            return this;
        }

        public Builder rangeTolerance(double v) {
            this.rangeTolerance = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link PipelineConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public PipelineConfig build() {
            inputDir = requirePath(inputDir, "inputDir");
            outputDir = requirePath(outputDir, "outputDir");
            imageDir = requirePath(imageDir, "imageDir");
            scorerPath = requirePath(scorerPath, "scorerPath");
            requireNonBlank(trainingPrefix, "trainingPrefix");
            requireNonBlank(fileExtension, "fileExtension");
            requireNonBlank(scorerType, "scorerType");

            for (String sensor : sensorsToPlot) {
                requireNonBlank(sensor, "sensorsToPlot entry");
            }
            requirePositive(checkInterval, "checkInterval");
            requirePositive(shutdownTimeout, "shutdownTimeout");
            Objects.requireNonNull(settleTime, "settleTime required");
            if (settleTime.isNegative()) {
                throw new IllegalArgumentException("settleTime must be >= 0, got: " + settleTime);
            }
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (plotThreads < 1) {
                throw new IllegalArgumentException("plotThreads must be >= 1, got: " + plotThreads);
            }
            if (deviationFactor <= 0) {
                throw new IllegalArgumentException("deviationFactor must be > 0, got: " + deviationFactor);
            }
            if (rangeTolerance < 0) {
                throw new IllegalArgumentException("rangeTolerance must be >= 0, got: " + rangeTolerance);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be 0 (disabled) or in [1, 65535], got: " + healthPort);
            }

            return new PipelineConfig(this);
        }

        private static Path requirePath(Path value, String name) {
            Objects.requireNonNull(value, name + " required");
            return value.toAbsolutePath().normalize();
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "inputDir=" + inputDir +
                ", outputDir=" + outputDir +
                ", imageDir=" + imageDir +
                ", scorerPath=" + scorerPath +
                ", sensorsToPlot=" + sensorsToPlot +
                ", checkInterval=" + checkInterval +
                ", workerThreads=" + workerThreads +
                ", plotThreads=" + plotThreads +
                ", shutdownTimeout=" + shutdownTimeout +
                ", settleTime=" + settleTime +
                ", processExisting=" + processExisting +
                ", fileConvention=" + fileConvention +
                ", scorerType='" + scorerType + '\'' +
                ", deviationFactor=" + deviationFactor +
                ", rangeTolerance=" + rangeTolerance +
                ", healthPort=" + healthPort +
                '}';
    }
}
