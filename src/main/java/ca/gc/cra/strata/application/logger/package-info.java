/**
 * Logger facades (synchronous, asynchronous, composite) and the registry that owns named loggers.
 * <p><strong>Contract:</strong> nothing on the delivery path throws into application code.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code logger.*} namespace.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.logger;
