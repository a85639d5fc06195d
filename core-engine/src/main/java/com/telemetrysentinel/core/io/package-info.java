/**
 * CSV reading, prediction and plot writing.
 *
 * @since 1.0.0
 */
package com.telemetrysentinel.core.io;
