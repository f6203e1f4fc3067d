package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.port.RedactionHook;
import ca.gc.cra.strata.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * Settings shared by every logger variant.
 *
 * @param name logger name
 * @param clock timestamps records
 * @param metrics receives {@code logger.*} counters
 * @param redaction fail-open message hook
 * @param captureCaller whether to walk the stack for a caller when none is passed
 * @param context key/value pairs stamped on every record
 * @since 0.1.0
 */
public record LoggerOptions(
    String name,
    ClockPort clock,
    MetricsPort metrics,
    RedactionHook redaction,
    boolean captureCaller,
    Map<String, Object> context) {

  /**
   * Validates the name and defaults the collaborators.
   */
  public LoggerOptions {
    name = Strings.requireNonBlank("name", name);
    clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
    metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    redaction = Objects.requireNonNullElse(redaction, RedactionHook.NONE);
    context = context == null ? Map.of() : Map.copyOf(context);
  }

  /**
   * Options with the system clock, no metrics, no redaction and no caller capture.
   *
   * @param name logger name
   * @return default options
   */
  public static LoggerOptions named(String name) {
    return new LoggerOptions(name, ClockPort.SYSTEM, MetricsPort.NO_OP, RedactionHook.NONE, false, Map.of());
  }

  public LoggerOptions withMetrics(MetricsPort replacement) {
    return new LoggerOptions(name, clock, replacement, redaction, captureCaller, context);
  }

  public LoggerOptions withRedaction(RedactionHook replacement) {
    return new LoggerOptions(name, clock, metrics, replacement, captureCaller, context);
  }

  public LoggerOptions withClock(ClockPort replacement) {
    return new LoggerOptions(name, replacement, metrics, redaction, captureCaller, context);
  }

  public LoggerOptions withCallerCapture(boolean enabled) {
    return new LoggerOptions(name, clock, metrics, redaction, enabled, context);
  }

  public LoggerOptions withContext(Map<String, Object> replacement) {
    return new LoggerOptions(name, clock, metrics, redaction, captureCaller, replacement);
  }
}
