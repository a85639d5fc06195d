package com.telemetrysentinel.core.io;

/**
 * Thrown when a telemetry file cannot be turned into a table: no header, no
 * timestamp column, or a non-numeric reading in a kept row.
 *
 * @since 1.0.0
 */
public class MalformedTelemetryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public MalformedTelemetryException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public MalformedTelemetryException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    /**
     * @return the file or resource that failed to parse
     */
    public String getSource() {
        return source;
    }
}
