/**
 * <strong>Purpose:</strong> Helpers for STRATA's internal diagnostics, which go through SLF4J and Logback and
 * never through a STRATA pipeline.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.logging;
