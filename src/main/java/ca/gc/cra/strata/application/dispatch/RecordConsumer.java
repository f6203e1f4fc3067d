package ca.gc.cra.strata.application.dispatch;

import ca.gc.cra.strata.domain.log.LogRecord;

/**
 * Work performed by dispatch workers for each dequeued record, typically {@code LayerRouter::route}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordConsumer {
  /**
   * Delivers one record.
   *
   * @param record dequeued record
   */
  void accept(LogRecord record);
}
