package ca.gc.cra.strata.infrastructure.concurrency;

import ca.gc.cra.strata.application.port.ConcurrencyPolicy;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConcurrencyPolicy} scaling the dispatch permit count with the JVM's maximum heap.
 *
 * <table>
 *   <caption>Permit tiers</caption>
 *   <tr><th>Max heap</th><th>Permits</th></tr>
 *   <tr><td>8 GiB or more</td><td>500</td></tr>
 *   <tr><td>4 GiB or more</td><td>250</td></tr>
 *   <tr><td>2 GiB or more</td><td>100</td></tr>
 *   <tr><td>less</td><td>50</td></tr>
 * </table>
 *
 * <p>The heap size is read once, at construction. Worker count is fixed.</p>
 *
 * @since 0.1.0
 */
public final class MemoryAwareConcurrencyPolicy implements ConcurrencyPolicy {
  private static final Logger log = LoggerFactory.getLogger(MemoryAwareConcurrencyPolicy.class);
  private static final long GIB = 1024L * 1024L * 1024L;

  private final int workers;
  private final int permits;

  /**
   * Creates a policy sized from {@link Runtime#maxMemory()}.
   *
   * @param workers worker count; clamped to at least one
   */
  public MemoryAwareConcurrencyPolicy(int workers) {
    this(workers, () -> Runtime.getRuntime().maxMemory());
  }

  MemoryAwareConcurrencyPolicy(int workers, LongSupplier maxMemoryBytes) {
    this.workers = Math.max(1, workers);
    long maxMemory = maxMemoryBytes.getAsLong();
    this.permits = permitsFor(maxMemory);
    log.debug("Memory-aware concurrency: max heap {} MiB -> {} permits", maxMemory / (1024 * 1024), permits);
  }

  static int permitsFor(long maxMemoryBytes) {
    if (maxMemoryBytes <= 0 || maxMemoryBytes == Long.MAX_VALUE) {
      return DEFAULT.permitCount();
    }
    if (maxMemoryBytes >= 8 * GIB) {
      return 500;
    }
    if (maxMemoryBytes >= 4 * GIB) {
      return 250;
    }
    if (maxMemoryBytes >= 2 * GIB) {
      return 100;
    }
    return 50;
  }

  @Override
  public int workerCount() {
    return workers;
  }

  @Override
  public int permitCount() {
    return permits;
  }

  @Override
  public String toString() {
    return "memory(workers=" + workers + ", permits=" + permits + ")";
  }
}
