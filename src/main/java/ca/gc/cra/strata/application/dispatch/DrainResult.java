package ca.gc.cra.strata.application.dispatch;

/**
 * Outcome of {@link AsyncDispatcher#drain(java.time.Duration)}.
 *
 * @param timedOut whether workers were still busy when the deadline elapsed
 * @param discarded records still queued at the deadline and counted as dropped
 * @param totalDropped dispatcher drop counter after the drain
 * @since 0.1.0
 */
public record DrainResult(boolean timedOut, long discarded, long totalDropped) {
  /**
   * Whether every queued record was delivered.
   *
   * @return {@code true} when nothing was discarded and the deadline was met
   */
  public boolean clean() {
    return !timedOut && discarded == 0;
  }
}
