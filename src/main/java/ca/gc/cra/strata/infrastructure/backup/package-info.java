/**
 * File-backed data-loss protection for batches that could not be delivered.
 * <p><strong>Security:</strong> Backup files contain formatted log lines; place the directory where log files
 * would be acceptable.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.strata.infrastructure.backup;
