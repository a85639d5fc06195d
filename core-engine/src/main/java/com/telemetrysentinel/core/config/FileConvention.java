package com.telemetrysentinel.core.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Naming rules that split the watched directory into training files and
 * arrivals.
 *
 * <p>
 * A training file starts with the training prefix and carries the target
 * extension. Every other file with the target extension is an arrival,
 * except hidden files (leading dot) which writers use for partial uploads.
 * Extensions compare case-insensitively; the prefix compares exactly.
 * </p>
 *
 * @since 1.0.0
 */
public final class FileConvention {

    public static final String DEFAULT_TRAINING_PREFIX = "train_";
    public static final String DEFAULT_EXTENSION = ".csv";

    private final String trainingPrefix;
    private final String extension;

    public FileConvention(String trainingPrefix, String extension) {
        this.trainingPrefix = Objects.requireNonNull(trainingPrefix, "trainingPrefix must not be null");
        Objects.requireNonNull(extension, "extension must not be null");
        String normalised = extension.toLowerCase(Locale.ROOT);
        this.extension = normalised.startsWith(".") ? normalised : "." + normalised;
    }

    public static FileConvention defaults() {
        return new FileConvention(DEFAULT_TRAINING_PREFIX, DEFAULT_EXTENSION);
    }

    public boolean isTrainingFile(Path path) {
        String name = fileName(path);
        return hasExtension(name) && name.startsWith(trainingPrefix);
    }

    public boolean isArrival(Path path) {
        String name = fileName(path);
        return hasExtension(name) && !name.startsWith(".") && !name.startsWith(trainingPrefix);
    }

    public String getTrainingPrefix() {
        return trainingPrefix;
    }

    public String getExtension() {
        return extension;
    }

    private boolean hasExtension(String name) {
        return name.toLowerCase(Locale.ROOT).endsWith(extension) && name.length() > extension.length();
    }

    private static String fileName(Path path) {
        Path name = Objects.requireNonNull(path, "path must not be null").getFileName();
        return name == null ? "" : name.toString();
    }

    @Override
    public String toString() {
        return "FileConvention{trainingPrefix='" + trainingPrefix + "', extension='" + extension + "'}";
    }
}
