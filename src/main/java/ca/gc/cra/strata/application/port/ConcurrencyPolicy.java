package ca.gc.cra.strata.application.port;

/**
 * <strong>What:</strong> Policy deciding how many dispatch workers run and how many records they may process
 * concurrently.
 * <p><strong>Role:</strong> Consulted once when an {@code AsyncDispatcher} starts.</p>
 * <p><strong>Default:</strong> {@link #DEFAULT}, a fixed pool of two workers sharing one hundred permits.
 * Resource-aware implementations live in the infrastructure layer.</p>
 *
 * @since 0.1.0
 */
public interface ConcurrencyPolicy {
  /**
   * Number of worker threads draining the dispatcher queues.
   *
   * @return positive worker count
   */
  int workerCount();

  /**
   * Number of semaphore permits limiting records processed at the same time.
   *
   * @return positive permit count
   */
  int permitCount();

  /**
   * Creates a policy with static values.
   *
   * @param workers worker count; clamped to at least one
   * @param permits permit count; clamped to at least one
   * @return fixed policy
   */
  static ConcurrencyPolicy fixed(int workers, int permits) {
    int effectiveWorkers = Math.max(1, workers);
    int effectivePermits = Math.max(1, permits);
    return new ConcurrencyPolicy() {
      @Override
      public int workerCount() {
        return effectiveWorkers;
      }

      @Override
      public int permitCount() {
        return effectivePermits;
      }

      @Override
      public String toString() {
        return "fixed(workers=" + effectiveWorkers + ", permits=" + effectivePermits + ")";
      }
    };
  }

  /** Two workers, one hundred permits. */
  ConcurrencyPolicy DEFAULT = fixed(2, 100);
}
