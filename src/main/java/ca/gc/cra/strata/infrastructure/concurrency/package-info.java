/**
 * Resource-aware {@link ca.gc.cra.strata.application.port.ConcurrencyPolicy} implementations.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.infrastructure.concurrency;
