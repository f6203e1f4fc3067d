package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.SinkFlushScheduler;
import ca.gc.cra.strata.domain.log.LogRecord;

/**
 * Logger delivering records to sinks on the calling thread.
 *
 * <p>A call may block on destination I/O when it triggers a flush. Concurrent callers are serialized only by
 * each sink's own lock.</p>
 *
 * @since 0.1.0
 */
public final class SyncLayeredLogger extends AbstractLayeredLogger {
  private final SinkFlushScheduler scheduler;

  /**
   * Creates a logger without a flush timer; buffers flush on size or on the next accept after their age elapses.
   *
   * @param options shared logger options
   * @param router layer router owning the sinks
   */
  public SyncLayeredLogger(LoggerOptions options, LayerRouter router) {
    this(options, router, null);
  }

  /**
   * Creates a logger.
   *
   * @param options shared logger options
   * @param router layer router owning the sinks
   * @param scheduler optional flush timer started with the logger and stopped before its sinks close
   */
  public SyncLayeredLogger(LoggerOptions options, LayerRouter router, SinkFlushScheduler scheduler) {
    super(options, router);
    this.scheduler = scheduler;
  }

  @Override
  protected boolean dispatch(LogRecord record) {
    router().route(record);
    return true;
  }

  @Override
  protected void onInitialize() {
    if (scheduler != null) {
      scheduler.start();
    }
  }

  @Override
  protected void onClose() {
    if (scheduler != null) {
      scheduler.close();
    }
    router().closeSinks();
  }
}
