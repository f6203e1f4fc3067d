/**
 * Default line formatters: plain text and JSON lines (Jackson streaming generator).
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.infrastructure.format;
