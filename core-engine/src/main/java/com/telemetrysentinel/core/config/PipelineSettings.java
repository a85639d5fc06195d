package com.telemetrysentinel.core.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Document POJO for the pipeline configuration file.
 *
 * <p>
 * Expected structure (JSON shown; the same keys work in YAML):
 * </p>
 *
 * <pre>
 * {
 *   "input_directory": "data/input",
 *   "output_directory": "data/output",
 *   "img_directory": "data/img",
 *   "sensors_to_plot": ["sensor_01", "sensor_04"],
 *   "check_interval": 5,
 *   "model_path": "data/model/scorer.bin"
 * }
 * </pre>
 *
 * <p>
 * The keys above are required. {@code sensors} and {@code interval} are
 * accepted as aliases of {@code sensors_to_plot} and {@code check_interval}.
 * Call {@link #validate()} before {@link #toConfig(Path)}.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineSettings {

    @JsonProperty("input_directory")
    private String inputDirectory;

    @JsonProperty("output_directory")
    private String outputDirectory;

    @JsonProperty("img_directory")
    private String imgDirectory;

    @JsonProperty("sensors_to_plot")
    @JsonAlias("sensors")
    private List<String> sensorsToPlot;

    /** Seconds between liveness checks of the main loop. */
    @JsonProperty("check_interval")
    @JsonAlias("interval")
    private Integer checkInterval;

    @JsonProperty("model_path")
    private String modelPath;

    // --- Optional tuning ---
    @JsonProperty("worker_threads")
    private Integer workerThreads;

    @JsonProperty("plot_threads")
    private Integer plotThreads;

    /** Seconds to wait for in-flight files on shutdown. */
    @JsonProperty("shutdown_timeout")
    private Integer shutdownTimeout;

    @JsonProperty("settle_time_ms")
    private Long settleTimeMs;

    @JsonProperty("process_existing")
    private Boolean processExisting;

    @JsonProperty("training_prefix")
    private String trainingPrefix;

    @JsonProperty("file_extension")
    private String fileExtension;

    @JsonProperty("scorer_type")
    private String scorerType;

    @JsonProperty("deviation_factor")
    private Double deviationFactor;

    @JsonProperty("range_tolerance")
    private Double rangeTolerance;

    @JsonProperty("health_port")
    private Integer healthPort;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every required key is present and every value is legal.
     *
     * @throws IllegalStateException listing all problems found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requireText(inputDirectory, "input_directory", errors);
        requireText(outputDirectory, "output_directory", errors);
        requireText(imgDirectory, "img_directory", errors);
        requireText(modelPath, "model_path", errors);

        if (sensorsToPlot == null) {
            errors.add("'sensors_to_plot' is required");
        } else if (sensorsToPlot.stream().anyMatch(s -> s == null || s.isBlank())) {
            errors.add("'sensors_to_plot' must not contain blank names");
        }
        if (checkInterval == null) {
            errors.add("'check_interval' is required");
        } else if (checkInterval <= 0) {
            errors.add("'check_interval' must be > 0 seconds, got: " + checkInterval);
        }

        if (workerThreads != null && workerThreads < 1) {
            errors.add("'worker_threads' must be >= 1, got: " + workerThreads);
        }
        if (plotThreads != null && plotThreads < 1) {
            errors.add("'plot_threads' must be >= 1, got: " + plotThreads);
        }
        if (shutdownTimeout != null && shutdownTimeout <= 0) {
            errors.add("'shutdown_timeout' must be > 0 seconds, got: " + shutdownTimeout);
        }
        if (settleTimeMs != null && settleTimeMs < 0) {
            errors.add("'settle_time_ms' must be >= 0, got: " + settleTimeMs);
        }
        if (deviationFactor != null && deviationFactor <= 0) {
            errors.add("'deviation_factor' must be > 0, got: " + deviationFactor);
        }
        if (rangeTolerance != null && rangeTolerance < 0) {
            errors.add("'range_tolerance' must be >= 0, got: " + rangeTolerance);
        }
        if (healthPort != null && (healthPort < 0 || healthPort > 65_535)) {
            errors.add("'health_port' must be 0 or in [1, 65535], got: " + healthPort);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void requireText(String value, String key, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add("'" + key + "' is required");
        }
    }

    // ---------------------------------------------------------------
    // Conversion
    // ---------------------------------------------------------------

    /**
     * Convert into a {@link PipelineConfig}, resolving relative paths against
     * {@code baseDir}.
     *
     * @param baseDir directory relative paths are resolved against
     * @return validated configuration
     * @throws IllegalArgumentException if the builder rejects a value
     */
    public PipelineConfig toConfig(Path baseDir) {
        PipelineConfig.Builder builder = PipelineConfig.builder()
                .inputDir(baseDir.resolve(inputDirectory))
                .outputDir(baseDir.resolve(outputDirectory))
                .imageDir(baseDir.resolve(imgDirectory))
                .scorerPath(baseDir.resolve(modelPath))
                .sensorsToPlot(sensorsToPlot)
                .checkInterval(Duration.ofSeconds(checkInterval));

        if (workerThreads != null) {
            builder.workerThreads(workerThreads);
        }
        if (plotThreads != null) {
            builder.plotThreads(plotThreads);
        }
        if (shutdownTimeout != null) {
            builder.shutdownTimeout(Duration.ofSeconds(shutdownTimeout));
        }
        if (settleTimeMs != null) {
            builder.settleTime(Duration.ofMillis(settleTimeMs));
        }
        if (processExisting != null) {
            builder.processExisting(processExisting);
        }
        if (trainingPrefix != null) {
            builder.trainingPrefix(trainingPrefix);
        }
        if (fileExtension != null) {
            builder.fileExtension(fileExtension);
        }
        if (scorerType != null) {
            builder.scorerType(scorerType);
        }
        if (deviationFactor != null) {
            builder.deviationFactor(deviationFactor);
        }
        if (rangeTolerance != null) {
            builder.rangeTolerance(rangeTolerance);
        }
        if (healthPort != null) {
            builder.healthPort(healthPort);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(String inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public String getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getImgDirectory() {
        return imgDirectory;
    }

    public void setImgDirectory(String imgDirectory) {
        this.imgDirectory = imgDirectory;
    }

    /**
     * @return unmodifiable sensor list, or {@code null} when unset
     */
    public List<String> getSensorsToPlot() {
        return sensorsToPlot != null ? Collections.unmodifiableList(sensorsToPlot) : null;
    }

    public void setSensorsToPlot(List<String> sensorsToPlot) {
        this.sensorsToPlot = sensorsToPlot != null ? new ArrayList<>(sensorsToPlot) : null;
    }

    public Integer getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Integer checkInterval) {
        this.checkInterval = checkInterval;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public Integer getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(Integer workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Integer getPlotThreads() {
        return plotThreads;
    }

    public void setPlotThreads(Integer plotThreads) {
        this.plotThreads = plotThreads;
    }

    public Integer getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Integer shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Long getSettleTimeMs() {
        return settleTimeMs;
    }

    public void setSettleTimeMs(Long settleTimeMs) {
        this.settleTimeMs = settleTimeMs;
    }

    public Boolean getProcessExisting() {
        return processExisting;
    }

    public void setProcessExisting(Boolean processExisting) {
        this.processExisting = processExisting;
    }

    public String getTrainingPrefix() {
        return trainingPrefix;
    }

    public void setTrainingPrefix(String trainingPrefix) {
        this.trainingPrefix = trainingPrefix;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getScorerType() {
        return scorerType;
    }

    public void setScorerType(String scorerType) {
        this.scorerType = scorerType;
    }

    public Double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(Double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public Double getRangeTolerance() {
        return rangeTolerance;
    }

    public void setRangeTolerance(Double rangeTolerance) {
        this.rangeTolerance = rangeTolerance;
    }

    public Integer getHealthPort() {
        return healthPort;
    }

    public void setHealthPort(Integer healthPort) {
        this.healthPort = healthPort;
    }

    @Override
    public String toString() {
        return "PipelineSettings{" +
                "inputDirectory='" + inputDirectory + '\'' +
                ", outputDirectory='" + outputDirectory + '\'' +
                ", imgDirectory='" + imgDirectory + '\'' +
                ", sensorsToPlot=" + sensorsToPlot +
                ", checkInterval=" + checkInterval +
                ", modelPath='" + modelPath + '\'' +
                '}';
    }
}
