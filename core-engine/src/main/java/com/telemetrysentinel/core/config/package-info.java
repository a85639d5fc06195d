/**
 * Configuration loading and validation for the telemetry sentinel.
 *
 * <p>
 * Settings are read from JSON or YAML by
 * {@link com.telemetrysentinel.core.config.ConfigLoader} into a validated,
 * immutable {@link com.telemetrysentinel.core.config.PipelineConfig}.
 * Validation runs right after parsing so bad settings fail at startup.
 * </p>
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.config;
