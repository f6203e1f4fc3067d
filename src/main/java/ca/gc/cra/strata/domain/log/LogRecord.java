package ca.gc.cra.strata.domain.log;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable log event produced once per accepted log call and shared read-only by every sink.
 *
 * @param timestamp wall-clock time the record was built
 * @param level severity
 * @param layer routing layer name
 * @param loggerName name of the emitting logger
 * @param message rendered message text; never {@code null}
 * @param caller optional source location; may be {@code null} when not captured
 * @param extra caller-supplied key/value pairs in insertion order
 * @param context ambient key/value pairs contributed by the logger
 * @since 0.1.0
 */
public record LogRecord(
    Instant timestamp,
    LogLevel level,
    String layer,
    String loggerName,
    String message,
    CallerContext caller,
    Map<String, Object> extra,
    Map<String, Object> context) {

  /** Layer name used when a caller does not pick one. */
  public static final String DEFAULT_LAYER = "default";

  /**
   * Validates required fields and copies the maps so later changes by the caller stay invisible.
   */
  public LogRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    layer = (layer == null || layer.isBlank()) ? DEFAULT_LAYER : layer;
    loggerName = Objects.requireNonNullElse(loggerName, "");
    message = Objects.requireNonNullElse(message, "");
    extra = freeze(extra);
    context = freeze(context);
  }

  /**
   * Convenience factory for records without caller context or maps.
   *
   * @param timestamp creation time
   * @param level severity
   * @param layer routing layer
   * @param loggerName emitting logger
   * @param message message text
   * @return new record
   */
  public static LogRecord of(
      Instant timestamp, LogLevel level, String layer, String loggerName, String message) {
    return new LogRecord(timestamp, level, layer, loggerName, message, null, Map.of(), Map.of());
  }

  /**
   * Returns the numeric severity.
   *
   * @return level value
   */
  public int levelValue() {
    return level.value();
  }

  /**
   * Returns the severity name.
   *
   * @return level name such as {@code INFO}
   */
  public String levelName() {
    return level.name();
  }

  /**
   * Returns a copy of this record carrying a different message.
   *
   * @param replacement new message text
   * @return new record; this instance is unchanged
   */
  public LogRecord withMessage(String replacement) {
    return new LogRecord(timestamp, level, layer, loggerName, replacement, caller, extra, context);
  }

  private static Map<String, Object> freeze(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
