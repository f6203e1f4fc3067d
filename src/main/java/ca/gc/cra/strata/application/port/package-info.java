/**
 * Ports connecting the STRATA delivery engine to formatters, writers, backup stores, clocks and metrics.
 * <p><strong>Role:</strong> Boundary contracts; adapters live under {@code ca.gc.cra.strata.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Each port documents which threads call it.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.port;
