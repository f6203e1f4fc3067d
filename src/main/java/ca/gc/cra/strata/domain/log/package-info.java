/**
 * <strong>Purpose:</strong> Immutable log event values shared by every stage of the delivery engine.
 * <p><strong>Pipeline role:</strong> Built by logger facades, read by routers, dispatchers and sinks.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across worker threads.
 * <p><strong>Performance:</strong> Maps are copied once at construction; records are never pooled.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.domain.log;
