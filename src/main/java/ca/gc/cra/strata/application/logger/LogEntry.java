package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.util.Map;
import java.util.Objects;

/**
 * One element of a batched log submission.
 *
 * @param level severity
 * @param message message text
 * @param layer routing layer; blank means {@value LogRecord#DEFAULT_LAYER}
 * @param extra caller key/value pairs; may be empty
 * @param caller explicit source location; may be {@code null}
 * @since 0.1.0
 */
public record LogEntry(LogLevel level, String message, String layer, Map<String, Object> extra, CallerContext caller) {
  /**
   * Requires a level and normalizes the optional fields.
   */
  public LogEntry {
    Objects.requireNonNull(level, "level");
    layer = (layer == null || layer.isBlank()) ? LogRecord.DEFAULT_LAYER : layer;
    extra = extra == null ? Map.of() : extra;
  }

  /**
   * Entry for the default layer without extras.
   *
   * @param level severity
   * @param message text
   * @return new entry
   */
  public static LogEntry of(LogLevel level, String message) {
    return new LogEntry(level, message, LogRecord.DEFAULT_LAYER, Map.of(), null);
  }

  /**
   * Entry for a named layer without extras.
   *
   * @param level severity
   * @param message text
   * @param layer routing layer
   * @return new entry
   */
  public static LogEntry of(LogLevel level, String message, String layer) {
    return new LogEntry(level, message, layer, Map.of(), null);
  }
}
