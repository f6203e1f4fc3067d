/**
 * Layer configuration and the router resolving layer names to sinks through the fallback chain.
 * <p><strong>Concurrency:</strong> Configurations are immutable; the router swaps them atomically on reload.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.routing;
