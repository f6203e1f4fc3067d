package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.application.dispatch.DispatcherStats;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared pipeline for router-backed loggers: state check, layer fast-reject, record construction,
 * fail-open redaction, then {@link #dispatch(LogRecord)} supplied by the variant.
 *
 * <p>Any runtime exception escaping those steps is counted under {@code logger.dispatch.error} and
 * reported through SLF4J; it never reaches the caller.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractLayeredLogger implements LayeredLogger {
  private static final Logger log = LoggerFactory.getLogger(AbstractLayeredLogger.class);
  private static final Set<String> LOGGER_FRAMES = Set.of(
      LayeredLogger.class.getName(),
      AbstractLayeredLogger.class.getName(),
      SyncLayeredLogger.class.getName(),
      AsyncLayeredLogger.class.getName(),
      CompositeLayeredLogger.class.getName());

  private final LoggerOptions options;
  private final LayerRouter router;
  private final MetricsPort metrics;
  private final AtomicReference<LoggerState> state = new AtomicReference<>(LoggerState.UNINITIALIZED);
  private final LongAdder logged = new LongAdder();
  private final LongAdder rejected = new LongAdder();
  private final LongAdder dropped = new LongAdder();

  protected AbstractLayeredLogger(LoggerOptions options, LayerRouter router) {
    this.options = Objects.requireNonNull(options, "options");
    this.router = Objects.requireNonNull(router, "router");
    this.metrics = options.metrics();
  }

  /**
   * Moves the logger to {@link LoggerState#INITIALIZED}, starting any background work.
   *
   * @return this logger
   * @throws IllegalStateException when the logger was already initialized or closed
   */
  public final AbstractLayeredLogger initialize() {
    if (!state.compareAndSet(LoggerState.UNINITIALIZED, LoggerState.INITIALIZED)) {
      throw new IllegalStateException("Logger " + name() + " cannot initialize from state " + state.get());
    }
    try {
      onInitialize();
    } catch (RuntimeException ex) {
      state.set(LoggerState.CLOSED);
      throw ex;
    }
    log.debug("Logger {} initialized with layers {}", name(), router.configuration());
    return this;
  }

  @Override
  public final String name() {
    return options.name();
  }

  @Override
  public final boolean log(
      LogLevel level, String message, String layer, Map<String, Object> extra, CallerContext caller) {
    try {
      LogRecord record = prepare(level, message, layer, extra, caller);
      if (record == null) {
        return false;
      }
      boolean accepted = dispatch(record);
      if (accepted) {
        logged.increment();
      } else {
        dropped.increment();
      }
      return accepted;
    } catch (RuntimeException ex) {
      metrics.increment("logger.dispatch.error");
      log.warn("Logger {} failed to dispatch a record", name(), ex);
      return false;
    }
  }

  @Override
  public final LoggerState state() {
    return state.get();
  }

  /**
   * Returns the router; {@link LayerRouter#reload} on it swaps layers for this logger.
   *
   * @return router
   */
  public final LayerRouter router() {
    return router;
  }

  @Override
  public LoggerHealth health() {
    List<Sink> sinks = router.sinks();
    return new LoggerHealth(
        name(),
        state.get(),
        logged.sum(),
        rejected.sum(),
        dropped.sum(),
        sinks.stream().map(Sink::stats).toList(),
        dispatcherStats(),
        List.of());
  }

  @Override
  public final void close() {
    while (true) {
      LoggerState current = state.get();
      if (current == LoggerState.CLOSING || current == LoggerState.CLOSED) {
        return;
      }
      if (state.compareAndSet(current, LoggerState.CLOSING)) {
        break;
      }
    }
    try {
      onClose();
    } catch (RuntimeException ex) {
      log.warn("Logger {} did not close cleanly", name(), ex);
    } finally {
      state.set(LoggerState.CLOSED);
    }
    log.debug("Logger {} closed", name());
  }

  /**
   * Runs the synchronous part of the pipeline and builds the record.
   *
   * @return the record to dispatch, or {@code null} when the call is a no-op
   */
  protected final LogRecord prepare(
      LogLevel level, String message, String layer, Map<String, Object> extra, CallerContext caller) {
    if (state.get() != LoggerState.INITIALIZED || level == null) {
      return null;
    }
    String effectiveLayer = (layer == null || layer.isBlank()) ? LogRecord.DEFAULT_LAYER : layer;
    if (!router.isEnabled(effectiveLayer, level)) {
      rejected.increment();
      metrics.increment("logger.record.rejected");
      return null;
    }
    CallerContext effectiveCaller = caller;
    if (effectiveCaller == null && options.captureCaller()) {
      effectiveCaller = CallerContext.capture(LOGGER_FRAMES).orElse(null);
    }
    LogRecord record = new LogRecord(
        Instant.ofEpochMilli(options.clock().nowMillis()),
        level,
        effectiveLayer,
        name(),
        message,
        effectiveCaller,
        extra,
        options.context());
    metrics.increment("logger.record.built");
    return redact(record);
  }

  protected final LogRecord prepare(LogEntry entry) {
    return prepare(entry.level(), entry.message(), entry.layer(), entry.extra(), entry.caller());
  }

  protected final void countDispatched(int accepted, int attempted) {
    logged.add(accepted);
    dropped.add(attempted - accepted);
  }

  protected final MetricsPort metrics() {
    return metrics;
  }

  /**
   * Hands a built record to the delivery path.
   *
   * @param record record to deliver
   * @return {@code false} when the record was dropped
   */
  protected abstract boolean dispatch(LogRecord record);

  protected void onInitialize() {}

  protected abstract void onClose();

  protected DispatcherStats dispatcherStats() {
    return null;
  }

  private LogRecord redact(LogRecord record) {
    try {
      String processed = options.redaction().process(record.message());
      if (processed == null || processed.equals(record.message())) {
        return record;
      }
      return record.withMessage(processed);
    } catch (RuntimeException ex) {
      metrics.increment("logger.redaction.error");
      log.debug("Redaction hook failed for logger {}; keeping original message", name(), ex);
      return record;
    }
  }
}
