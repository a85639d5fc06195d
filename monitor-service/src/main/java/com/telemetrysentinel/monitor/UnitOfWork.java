package com.telemetrysentinel.monitor;

/**
 * Per-file processing strategy run by {@link ProcessingCoordinator}.
 *
 * <p>
 * Implementations may throw; the coordinator converts any exception into a
 * {@link UnitOutcome.Status#FAILED FAILED} outcome and keeps the worker alive.
 * </p>
 */
@FunctionalInterface
public interface UnitOfWork {

    /**
     * @param event the arrival to process
     * @return the outcome of a unit that completed without throwing
     * @throws Exception any failure; the source file must then be left in place
     */
    UnitOutcome process(ArrivalEvent event) throws Exception;
}
