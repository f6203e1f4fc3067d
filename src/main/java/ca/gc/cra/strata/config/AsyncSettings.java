package ca.gc.cra.strata.config;

import ca.gc.cra.strata.application.dispatch.DispatcherSettings;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Dispatcher configuration used when {@link LoggingSettings.Mode#ASYNC} is selected.
 *
 * @param primaryCapacity primary queue bound; {@link DispatcherSettings#UNBOUNDED} for no bound
 * @param overflowCapacity overflow queue bound
 * @param concurrency {@code fixed} or {@code memory}
 * @param workers worker thread count
 * @param permits permit count for the {@code fixed} policy
 * @param drainGrace close deadline
 * @since 0.1.0
 */
public record AsyncSettings(
    int primaryCapacity, int overflowCapacity, String concurrency, int workers, int permits, Duration drainGrace) {
  public static final String FIXED = "fixed";
  public static final String MEMORY = "memory";
  public static final Set<String> POLICIES = Set.of(FIXED, MEMORY);

  /**
   * Requires a known policy name and defaults the grace period.
   */
  public AsyncSettings {
    concurrency = Objects.requireNonNullElse(concurrency, FIXED);
    if (!POLICIES.contains(concurrency)) {
      throw new IllegalArgumentException("Unknown concurrency policy: " + concurrency);
    }
    drainGrace = Objects.requireNonNullElse(drainGrace, Duration.ofSeconds(5));
  }

  /**
   * Unbounded primary queue, 100,000 overflow slots, two workers, one hundred permits, five second grace.
   *
   * @return default settings
   */
  public static AsyncSettings defaults() {
    return new AsyncSettings(DispatcherSettings.UNBOUNDED, 100_000, FIXED, 2, 100, Duration.ofSeconds(5));
  }
}
