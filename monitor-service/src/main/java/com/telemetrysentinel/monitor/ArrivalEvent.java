package com.telemetrysentinel.monitor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A file that is newly ready to be processed.
 *
 * <p>
 * Created by {@link FileArrivalDetector} and consumed once by
 * {@link ProcessingCoordinator}.
 * </p>
 */
public final class ArrivalEvent {

    private final Path path;
    private final Instant discoveredAt;

    public ArrivalEvent(Path path, Instant discoveredAt) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath().normalize();
        this.discoveredAt = Objects.requireNonNull(discoveredAt, "discoveredAt must not be null");
    }

    public static ArrivalEvent now(Path path) {
        return new ArrivalEvent(path, Instant.now());
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    public Instant getDiscoveredAt() {
        return discoveredAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ArrivalEvent that))
            return false;
        return path.equals(that.path) && discoveredAt.equals(that.discoveredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, discoveredAt);
    }

    @Override
    public String toString() {
        return "ArrivalEvent{path=" + path + ", discoveredAt=" + discoveredAt + '}';
    }
}
