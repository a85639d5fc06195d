package com.telemetrysentinel.core.scoring;

/**
 * Thrown when bootstrap cannot produce a fitted scorer. Fatal at startup.
 *
 * @since 1.0.0
 */
public class BootstrapException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public BootstrapException(String message) {
        super(message);
    }

    public BootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
