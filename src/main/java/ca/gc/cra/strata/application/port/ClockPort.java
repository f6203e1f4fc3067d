package ca.gc.cra.strata.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to sinks and loggers.
 * <p><strong>Why:</strong> Sink age-based flush triggers and record timestamps need a clock that tests can drive.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; reads happen on producer threads and on
 * the flush scheduler.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.strata.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
