package ca.gc.cra.strata.application.dispatch;

/**
 * Lifecycle of an {@link AsyncDispatcher}: {@code CREATED -> RUNNING -> DRAINING -> STOPPED}.
 *
 * @since 0.1.0
 */
public enum DispatcherState {
  /** Queues accept records; no workers yet. */
  CREATED,
  /** Workers are consuming. */
  RUNNING,
  /** New records are refused while queued work finishes. */
  DRAINING,
  /** Workers stopped and sinks closed. */
  STOPPED
}
