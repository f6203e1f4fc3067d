package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.application.dispatch.DispatcherStats;
import ca.gc.cra.strata.application.sink.SinkStats;
import java.util.List;

/**
 * Health snapshot of a logger and everything it owns.
 *
 * @param name logger name
 * @param state lifecycle state
 * @param logged records handed to the router or dispatcher
 * @param rejected calls refused by the layer fast-reject check
 * @param dropped records the dispatcher refused
 * @param sinks per-sink counters; empty for composite loggers
 * @param dispatcher dispatcher counters; {@code null} for synchronous and composite loggers
 * @param components component snapshots; empty unless composite
 * @since 0.1.0
 */
public record LoggerHealth(
    String name,
    LoggerState state,
    long logged,
    long rejected,
    long dropped,
    List<SinkStats> sinks,
    DispatcherStats dispatcher,
    List<LoggerHealth> components) {

  /**
   * Copies the lists.
   */
  public LoggerHealth {
    sinks = List.copyOf(sinks);
    components = List.copyOf(components);
  }

  /**
   * Whether the logger is open and has lost nothing so far.
   *
   * @return {@code false} once records were dropped, a sink failed, a worker failed, or a component is unhealthy
   */
  public boolean healthy() {
    if (state != LoggerState.INITIALIZED || dropped > 0) {
      return false;
    }
    if (sinks.stream().anyMatch(SinkStats::degraded)) {
      return false;
    }
    if (dispatcher != null && (dispatcher.dropped() > 0 || dispatcher.workerErrors() > 0)) {
      return false;
    }
    return components.stream().allMatch(LoggerHealth::healthy);
  }

  /**
   * Sum of write errors across owned sinks and components.
   *
   * @return failed writer calls
   */
  public long sinkWriteErrors() {
    long own = sinks.stream().mapToLong(SinkStats::writeErrors).sum();
    return own + components.stream().mapToLong(LoggerHealth::sinkWriteErrors).sum();
  }
}
