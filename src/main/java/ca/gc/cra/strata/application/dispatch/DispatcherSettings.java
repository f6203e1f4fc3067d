package ca.gc.cra.strata.application.dispatch;

import ca.gc.cra.strata.application.port.ConcurrencyPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Queue sizing and worker policy for an {@link AsyncDispatcher}.
 *
 * @param primaryCapacity primary queue bound; {@link Integer#MAX_VALUE} means unbounded
 * @param overflowCapacity overflow queue bound
 * @param concurrency worker and permit counts
 * @param drainGrace default deadline used by {@link AsyncDispatcher#close()}
 * @since 0.1.0
 */
public record DispatcherSettings(
    int primaryCapacity, int overflowCapacity, ConcurrencyPolicy concurrency, Duration drainGrace) {
  /** Unbounded primary queue marker. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private static final int DEFAULT_OVERFLOW_CAPACITY = 100_000;
  private static final Duration DEFAULT_DRAIN_GRACE = Duration.ofSeconds(5);

  /**
   * Normalizes settings by clamping capacities and defaulting missing values.
   *
   * @param primaryCapacity requested primary capacity
   * @param overflowCapacity requested overflow capacity
   * @param concurrency requested policy
   * @param drainGrace requested grace period
   */
  public DispatcherSettings {
    primaryCapacity = Math.max(1, primaryCapacity);
    overflowCapacity = Math.max(1, overflowCapacity);
    concurrency = Objects.requireNonNullElse(concurrency, ConcurrencyPolicy.DEFAULT);
    drainGrace = Objects.requireNonNullElse(drainGrace, DEFAULT_DRAIN_GRACE);
    if (drainGrace.isNegative()) {
      drainGrace = Duration.ZERO;
    }
  }

  /**
   * Unbounded primary queue, 100,000-entry overflow, the default policy and a five second grace period.
   *
   * @return default settings
   */
  public static DispatcherSettings defaults() {
    return new DispatcherSettings(UNBOUNDED, DEFAULT_OVERFLOW_CAPACITY, ConcurrencyPolicy.DEFAULT, DEFAULT_DRAIN_GRACE);
  }

  /**
   * Copy with different queue capacities.
   *
   * @param primary primary capacity
   * @param overflow overflow capacity
   * @return new settings
   */
  public DispatcherSettings withCapacities(int primary, int overflow) {
    return new DispatcherSettings(primary, overflow, concurrency, drainGrace);
  }

  /**
   * Copy with a different concurrency policy.
   *
   * @param policy worker policy
   * @return new settings
   */
  public DispatcherSettings withConcurrency(ConcurrencyPolicy policy) {
    return new DispatcherSettings(primaryCapacity, overflowCapacity, policy, drainGrace);
  }
}
