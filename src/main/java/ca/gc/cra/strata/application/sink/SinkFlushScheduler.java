package ca.gc.cra.strata.application.sink;

import ca.gc.cra.strata.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic timer driving {@link Sink#flushIfDue()} so idle sinks still honour their maximum buffer age.
 *
 * <p>The sink collection is re-read on every tick, so sinks introduced by a configuration reload are
 * picked up without restarting the scheduler.</p>
 *
 * @since 0.1.0
 */
public final class SinkFlushScheduler implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SinkFlushScheduler.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final Supplier<? extends Collection<Sink>> sinks;
  private final Duration interval;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile ScheduledExecutorService executor;

  /**
   * Creates a scheduler.
   *
   * @param sinks supplies the sinks to check on each tick
   * @param interval delay between ticks; must be positive
   */
  public SinkFlushScheduler(Supplier<? extends Collection<Sink>> sinks, Duration interval) {
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /**
   * Starts the timer thread. Calling twice has no further effect.
   *
   * @return this scheduler
   * @throws IllegalStateException when already closed
   */
  public SinkFlushScheduler start() {
    if (closed.get()) {
      throw new IllegalStateException("Flush scheduler already closed");
    }
    if (started.compareAndSet(false, true)) {
      ScheduledExecutorService scheduler = ExecutorFactories.newFlushScheduler("strata-flush");
      long millis = interval.toMillis();
      scheduler.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
      executor = scheduler;
    }
    return this;
  }

  /**
   * Runs one timer check on the calling thread.
   *
   * @return number of sinks that flushed
   */
  public int tick() {
    int flushed = 0;
    for (Sink sink : sinks.get()) {
      try {
        if (sink.flushIfDue()) {
          flushed++;
        }
      } catch (RuntimeException ex) {
        log.warn("Timed flush of {} failed", sink.name(), ex);
      }
    }
    return flushed;
  }

  /**
   * Stops the timer thread; does not flush or close sinks.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    ScheduledExecutorService scheduler = executor;
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Flush scheduler still running after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        scheduler.shutdownNow();
      }
    } catch (InterruptedException ie) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
