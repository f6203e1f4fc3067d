/**
 * Metrics adapters that bridge the STRATA metrics port to OpenTelemetry or no-op implementations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Performance:</strong> Instruments are created once per metric key and cached.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code sink.*}, {@code dispatch.*} and {@code logger.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys are exported, never log message contents.</p>
 */
package ca.gc.cra.strata.infrastructure.metrics;
