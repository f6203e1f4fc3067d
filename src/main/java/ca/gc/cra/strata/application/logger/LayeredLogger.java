package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Entry point applications log through.
 * <p><strong>Contract:</strong> no log method ever throws into the caller. Calls on a logger that is not
 * {@link LoggerState#INITIALIZED} return {@code false} and do nothing.</p>
 * <p><strong>Lifecycle:</strong> the code that builds a logger owns it and must call {@link #close()},
 * usually through try-with-resources; nothing is flushed by garbage collection.</p>
 * <p><strong>Thread-safety:</strong> all implementations accept concurrent calls from any thread.</p>
 *
 * @since 0.1.0
 */
public interface LayeredLogger extends AutoCloseable {
  /**
   * Returns the logger name stamped on every record.
   *
   * @return logger name
   */
  String name();

  /**
   * Logs a message.
   *
   * @param level severity
   * @param message message text
   * @param layer routing layer; blank means {@value LogRecord#DEFAULT_LAYER}
   * @param extra caller key/value pairs; may be {@code null}
   * @param caller explicit source location; may be {@code null}
   * @return {@code true} when the record was handed to the delivery path
   */
  boolean log(LogLevel level, String message, String layer, Map<String, Object> extra, CallerContext caller);

  default boolean log(LogLevel level, String message) {
    return log(level, message, LogRecord.DEFAULT_LAYER, null, null);
  }

  default boolean log(LogLevel level, String message, String layer) {
    return log(level, message, layer, null, null);
  }

  default boolean log(LogLevel level, String message, String layer, Map<String, Object> extra) {
    return log(level, message, layer, extra, null);
  }

  default boolean log(LogEntry entry) {
    return log(entry.level(), entry.message(), entry.layer(), entry.extra(), entry.caller());
  }

  default boolean debug(String message) {
    return log(LogLevel.DEBUG, message);
  }

  default boolean debug(String message, String layer) {
    return log(LogLevel.DEBUG, message, layer);
  }

  default boolean info(String message) {
    return log(LogLevel.INFO, message);
  }

  default boolean info(String message, String layer) {
    return log(LogLevel.INFO, message, layer);
  }

  default boolean warning(String message) {
    return log(LogLevel.WARNING, message);
  }

  default boolean warning(String message, String layer) {
    return log(LogLevel.WARNING, message, layer);
  }

  default boolean error(String message) {
    return log(LogLevel.ERROR, message);
  }

  default boolean error(String message, String layer) {
    return log(LogLevel.ERROR, message, layer);
  }

  default boolean critical(String message) {
    return log(LogLevel.CRITICAL, message);
  }

  default boolean critical(String message, String layer) {
    return log(LogLevel.CRITICAL, message, layer);
  }

  /**
   * Logs several entries.
   *
   * @param entries entries in submission order
   * @return number of entries handed to the delivery path
   */
  default int logBatch(List<LogEntry> entries) {
    int accepted = 0;
    for (LogEntry entry : entries) {
      if (log(entry)) {
        accepted++;
      }
    }
    return accepted;
  }

  /**
   * Returns the lifecycle state.
   *
   * @return current state
   */
  LoggerState state();

  /**
   * Snapshots counters for this logger and what it owns.
   *
   * @return health snapshot
   */
  LoggerHealth health();

  /**
   * Flushes and releases every owned resource. Idempotent.
   */
  @Override
  void close();
}
