/**
 * Thread pool factories with named threads and uncaught-exception handlers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.infrastructure.exec;
