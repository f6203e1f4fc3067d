/**
 * Asynchronous dispatch: primary and overflow queues, a permit-limited worker pool and deadline-bound draining.
 * <p><strong>Concurrency:</strong> Producers never block; workers are the only consumers of the queues.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code dispatch.*} namespace.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.dispatch;
