package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.application.dispatch.AsyncDispatcher;
import ca.gc.cra.strata.application.dispatch.DispatcherStats;
import ca.gc.cra.strata.application.dispatch.DrainResult;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.SinkFlushScheduler;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger handing records to an {@link AsyncDispatcher}; calls return without waiting for I/O.
 *
 * <p>Closing drains the dispatcher with the configured grace period. Records still queued at the deadline
 * are counted as dropped, and the dispatcher's stop hook closes the sinks.</p>
 *
 * @since 0.1.0
 */
public final class AsyncLayeredLogger extends AbstractLayeredLogger {
  private static final Logger log = LoggerFactory.getLogger(AsyncLayeredLogger.class);

  private final AsyncDispatcher dispatcher;
  private final SinkFlushScheduler scheduler;
  private final Duration closeGrace;
  private volatile DrainResult drainResult;

  /**
   * Creates a logger.
   *
   * @param options shared logger options
   * @param router router used for fast-reject checks; the dispatcher delivers through the same router
   * @param dispatcher dispatcher owned by this logger
   * @param scheduler optional flush timer
   * @param closeGrace deadline for draining on close
   */
  public AsyncLayeredLogger(
      LoggerOptions options,
      LayerRouter router,
      AsyncDispatcher dispatcher,
      SinkFlushScheduler scheduler,
      Duration closeGrace) {
    super(options, router);
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.scheduler = scheduler;
    this.closeGrace = Objects.requireNonNull(closeGrace, "closeGrace");
  }

  @Override
  protected boolean dispatch(LogRecord record) {
    return dispatcher.enqueue(record);
  }

  /**
   * Builds every entry that passes the fast-reject check and enqueues them together.
   */
  @Override
  public int logBatch(List<LogEntry> entries) {
    try {
      List<LogRecord> records = new ArrayList<>(entries.size());
      for (LogEntry entry : entries) {
        LogRecord record = prepare(entry);
        if (record != null) {
          records.add(record);
        }
      }
      if (records.isEmpty()) {
        return 0;
      }
      int queued = dispatcher.enqueueAll(records);
      countDispatched(queued, records.size());
      return queued;
    } catch (RuntimeException ex) {
      metrics().increment("logger.dispatch.error");
      log.warn("Logger {} failed to dispatch a batch", name(), ex);
      return 0;
    }
  }

  /**
   * Returns the dispatcher owned by this logger.
   *
   * @return dispatcher
   */
  public AsyncDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * Returns the outcome of the drain performed by {@link #close()}.
   *
   * @return drain result, or {@code null} while the logger is open
   */
  public DrainResult drainResult() {
    return drainResult;
  }

  @Override
  protected void onInitialize() {
    dispatcher.start();
    if (scheduler != null) {
      scheduler.start();
    }
  }

  @Override
  protected void onClose() {
    if (scheduler != null) {
      scheduler.close();
    }
    drainResult = dispatcher.drain(closeGrace);
    if (!drainResult.clean()) {
      log.warn("Logger {} closed with {} records discarded (timed out: {})",
          name(), drainResult.discarded(), drainResult.timedOut());
    }
  }

  @Override
  protected DispatcherStats dispatcherStats() {
    return dispatcher.stats();
  }
}
