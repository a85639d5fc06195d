package com.telemetrysentinel.core.io;

import com.telemetrysentinel.core.model.SensorSeries;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders a sensor series to an image file.
 *
 * <p>
 * Implementations must be safe to call from several plot workers at once.
 * The target may be a temporary file; the caller moves it into place.
 * </p>
 */
@FunctionalInterface
public interface PlotRenderer {

    /**
     * @param series the series to draw
     * @param title  chart title
     * @param target file to write; overwritten if present
     * @throws IOException if the image cannot be written
     */
    void render(SensorSeries series, String title, Path target) throws IOException;
}
