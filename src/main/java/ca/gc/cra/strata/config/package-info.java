/**
 * Configuration loading (YAML via SnakeYAML, environment profiles) and the composition root wiring loggers.
 * <p><strong>Concurrency:</strong> Settings are immutable records; loading runs once at startup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.config;
