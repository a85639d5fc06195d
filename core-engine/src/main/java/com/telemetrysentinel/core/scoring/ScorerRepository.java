package com.telemetrysentinel.core.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Saves and loads fitted scorer artifacts.
 *
 * <p>
 * Artifacts are plain Java serialization streams. Loading applies an
 * allow-list filter so that only scorer classes of this project, JDK
 * collections and primitive arrays can be materialised.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScorerRepository {

    private static final Logger LOG = LoggerFactory.getLogger(ScorerRepository.class);

    private static final ObjectInputFilter ALLOWED_CLASSES = ObjectInputFilter.Config.createFilter(
            "maxdepth=20;com.telemetrysentinel.core.scoring.*;java.util.*;java.lang.*;!*");

    private ScorerRepository() {
        // utility class - not instantiable
    }

    /**
     * Write a fitted scorer to {@code path}, replacing any previous artifact.
     *
     * @param scorer fitted scorer
     * @param path   artifact location; its directory must exist
     * @throws IllegalArgumentException if the scorer is not fitted
     * @throws ScorerLoadException      if the artifact cannot be written
     */
    public static void save(Scorer scorer, Path path) {
        Objects.requireNonNull(scorer, "scorer must not be null");
        Objects.requireNonNull(path, "path must not be null");
        if (!scorer.isFitted()) {
            throw new IllegalArgumentException("Refusing to save an unfitted scorer to " + path);
        }
        Path absolute = path.toAbsolutePath();
        try {
            Path temp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(temp);
                     ObjectOutputStream oos = new ObjectOutputStream(out)) {
                    oos.writeObject(scorer);
                }
                try {
                    Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new ScorerLoadException(absolute, "Failed to write scorer artifact", e);
        }
        LOG.info("Model trained and saved to {}", absolute);
    }

    /**
     * Read a fitted scorer from {@code path}.
     *
     * @param path artifact location
     * @return the fitted scorer
     * @throws ScorerLoadException if the artifact is missing, unreadable, of a
     *                             foreign type or not fitted
     */
    public static Scorer load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        Path absolute = path.toAbsolutePath();
        Object artifact;
        try (InputStream in = Files.newInputStream(absolute);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            ois.setObjectInputFilter(ALLOWED_CLASSES);
            artifact = ois.readObject();
        } catch (NoSuchFileException e) {
            throw new ScorerLoadException(absolute, "Scorer artifact not found", e);
        } catch (InvalidClassException e) {
            throw new ScorerLoadException(absolute, "Scorer artifact contains a rejected class", e);
        } catch (IOException | ClassNotFoundException e) {
            throw new ScorerLoadException(absolute, "Scorer artifact failed to deserialize", e);
        }

        if (!(artifact instanceof Scorer scorer)) {
            throw new ScorerLoadException(absolute, "Artifact is not a scorer ("
                    + (artifact == null ? "null" : artifact.getClass().getName()) + ")");
        }
        if (!scorer.isFitted()) {
            throw new ScorerLoadException(absolute, "Scorer artifact is not fitted");
        }
        LOG.info("Loaded {} scorer with {} feature(s) from {}",
                scorer.getType(), scorer.getFeatureNames().size(), absolute);
        return scorer;
    }
}
