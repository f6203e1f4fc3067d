package ca.gc.cra.strata.application.sink;

import ca.gc.cra.strata.domain.log.LogLevel;

/**
 * Point-in-time counters for one {@link Sink}.
 *
 * @param name sink name
 * @param threshold minimum accepted level
 * @param buffered records waiting for the next flush
 * @param accepted records appended to the buffer since creation
 * @param rejected records filtered out by level or refused after close
 * @param batchesWritten successful writer calls
 * @param recordsWritten lines delivered by successful writer calls
 * @param writeErrors failed writer calls
 * @param formatErrors records the formatter could not render
 * @param backedUpBatches failed batches handed to the backup port
 * @param backupErrors failed batches the backup port could not persist
 * @param closed whether {@link Sink#close()} has run
 * @since 0.1.0
 */
public record SinkStats(
    String name,
    LogLevel threshold,
    int buffered,
    long accepted,
    long rejected,
    long batchesWritten,
    long recordsWritten,
    long writeErrors,
    long formatErrors,
    long backedUpBatches,
    long backupErrors,
    boolean closed) {

  /**
   * Whether the sink has lost records to write or format failures.
   *
   * @return {@code true} when any error counter is non-zero
   */
  public boolean degraded() {
    return writeErrors > 0 || formatErrors > 0;
  }
}
