/**
 * Buffered batching sinks and the timer that flushes them.
 * <p><strong>Role:</strong> Last stage of the delivery engine; owns formatter and writer collaborators.</p>
 * <p><strong>Concurrency:</strong> Each sink serializes buffer access and writer calls behind its own lock.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code sink.*} namespace.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.application.sink;
