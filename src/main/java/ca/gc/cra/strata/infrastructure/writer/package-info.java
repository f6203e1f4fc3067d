/**
 * Destination writers: console streams, append-only files, and a discarding writer.
 * <p><strong>Concurrency:</strong> Writers are called only by their owning sink under its lock.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.infrastructure.writer;
