package ca.gc.cra.strata.application.sink;

import java.time.Duration;
import java.util.Objects;

/**
 * Flush tuning for a {@link Sink}.
 *
 * @param maxBufferSize buffered record count that forces a flush; clamped to at least one
 * @param maxBufferAge time since the last flush after which the next accept or timer check flushes the buffer
 * @since 0.1.0
 */
public record SinkSettings(int maxBufferSize, Duration maxBufferAge) {
  private static final int CONSOLE_BUFFER_SIZE = 5_000;
  private static final Duration CONSOLE_BUFFER_AGE = Duration.ofMillis(500);
  private static final int FILE_BUFFER_SIZE = 50_000;
  private static final Duration FILE_BUFFER_AGE = Duration.ofSeconds(5);

  /**
   * Normalizes settings by clamping the size and defaulting a missing or negative age.
   *
   * @param maxBufferSize requested buffer size
   * @param maxBufferAge requested buffer age
   */
  public SinkSettings {
    maxBufferSize = Math.max(1, maxBufferSize);
    maxBufferAge = Objects.requireNonNullElse(maxBufferAge, CONSOLE_BUFFER_AGE);
    if (maxBufferAge.isNegative()) {
      maxBufferAge = Duration.ZERO;
    }
  }

  /**
   * Latency-oriented tuning for interactive destinations.
   *
   * @return 5,000 records or 500 ms
   */
  public static SinkSettings console() {
    return new SinkSettings(CONSOLE_BUFFER_SIZE, CONSOLE_BUFFER_AGE);
  }

  /**
   * Throughput-oriented tuning for file destinations.
   *
   * @return 50,000 records or 5 s
   */
  public static SinkSettings file() {
    return new SinkSettings(FILE_BUFFER_SIZE, FILE_BUFFER_AGE);
  }

  /**
   * Flushes on every record; useful for tests and destinations that must not lag.
   *
   * @return settings with a buffer size of one
   */
  public static SinkSettings unbuffered() {
    return new SinkSettings(1, Duration.ZERO);
  }
}
