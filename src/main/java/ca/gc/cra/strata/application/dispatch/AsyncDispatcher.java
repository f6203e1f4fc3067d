package ca.gc.cra.strata.application.dispatch;

import ca.gc.cra.strata.application.port.BackupPort;
import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.domain.log.LogRecord;
import ca.gc.cra.strata.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.strata.logging.Logs;
import ca.gc.cra.strata.validation.Strings;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queue-backed hand-off between producer threads and a small pool of delivery workers.
 *
 * <p>{@link #enqueue(LogRecord)} never blocks: a record goes to the primary queue, spills to the bounded
 * overflow queue when the primary is full, and is counted as dropped when both are full. Workers prefer
 * the primary queue, fall back to overflow, acquire a permit from a semaphore sized by the
 * {@link ca.gc.cra.strata.application.port.ConcurrencyPolicy}, and hand each record to the
 * {@link RecordConsumer}. A record that spilled to overflow may be delivered after later records that
 * stayed in the primary queue.</p>
 *
 * <p>Records sharing an ordering key are delivered one at a time, in the order they were dequeued: a worker
 * takes the next record and claims the lock striped for its key as one step, so a second record with the
 * same key waits until the first has been delivered. Records with different keys are delivered in
 * parallel. {@link #forRouter} keys records by {@link LayerRouter#orderingKey(LogRecord)}, which keeps
 * each sink's buffer in enqueue order for any worker count.</p>
 *
 * <p>Every record is, at any moment, in exactly one queue, held by a worker, delivered, or counted in
 * {@link #droppedCount()}. {@link #drain(Duration)} lets workers finish queued work until the deadline,
 * counts and backs up anything left, then runs the stop hook (normally closing every sink).</p>
 *
 * <p>Workers run on non-daemon threads named {@code <name>-worker-N}. A failure delivering one record is
 * logged through SLF4J and the worker moves on to the next record.</p>
 *
 * @since 0.1.0
 */
public final class AsyncDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncDispatcher.class);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final Duration FORCED_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final int SATURATION_LOG_THRESHOLD = 1_000;
  private static final int LOG_PAYLOAD_BYTES = 256;
  private static final int ORDERING_STRIPES_PER_WORKER = 4;

  private final String name;
  private final RecordConsumer consumer;
  private final Runnable onStop;
  private final DispatcherSettings settings;
  private final MetricsPort metrics;
  private final BackupPort backup;
  private final LogFormatter backupFormatter;
  private final Function<LogRecord, ?> orderingKey;

  private final BlockingQueue<LogRecord> primaryQueue;
  private final BlockingQueue<LogRecord> overflowQueue;
  private final Semaphore permits;
  private final int workerCount;
  private final int permitCount;
  private final ReentrantLock takeLock = new ReentrantLock();
  private final ReentrantLock[] orderingLocks;
  private final ReadWriteLock intakeLock = new ReentrantReadWriteLock();

  private final AtomicReference<DispatcherState> state = new AtomicReference<>(DispatcherState.CREATED);
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger saturationLogLimiter = new AtomicInteger();
  private final LongAdder dropped = new LongAdder();
  private final LongAdder enqueuedPrimary = new LongAdder();
  private final LongAdder enqueuedOverflow = new LongAdder();
  private final LongAdder processed = new LongAdder();
  private final LongAdder workerErrors = new LongAdder();
  private final UncaughtExceptionHandler workerUncaughtHandler = this::handleWorkerCrash;

  private ExecutorService executor;
  private DrainResult drainResult;

  /**
   * Creates a dispatcher ordering records by their layer name.
   *
   * @param name prefix for worker thread names and the backup source
   * @param consumer delivery step run by workers for each record
   * @param onStop hook run once after the final drain, typically closing sinks
   * @param settings queue capacities and concurrency policy
   * @param metrics metrics sink for {@code dispatch.*} counters
   * @param backup receives records discarded at the drain deadline
   * @param backupFormatter renders discarded records before backup
   */
  public AsyncDispatcher(
      String name,
      RecordConsumer consumer,
      Runnable onStop,
      DispatcherSettings settings,
      MetricsPort metrics,
      BackupPort backup,
      LogFormatter backupFormatter) {
    this(name, consumer, LogRecord::layer, onStop, settings, metrics, backup, backupFormatter);
  }

  /**
   * Creates a dispatcher.
   *
   * @param name prefix for worker thread names and the backup source
   * @param consumer delivery step run by workers for each record
   * @param orderingKey records with equal keys are delivered one at a time in dequeue order
   * @param onStop hook run once after the final drain, typically closing sinks
   * @param settings queue capacities and concurrency policy
   * @param metrics metrics sink for {@code dispatch.*} counters
   * @param backup receives records discarded at the drain deadline
   * @param backupFormatter renders discarded records before backup
   */
  public AsyncDispatcher(
      String name,
      RecordConsumer consumer,
      Function<LogRecord, ?> orderingKey,
      Runnable onStop,
      DispatcherSettings settings,
      MetricsPort metrics,
      BackupPort backup,
      LogFormatter backupFormatter) {
    this.name = Strings.requireNonBlank("name", name);
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.orderingKey = Objects.requireNonNull(orderingKey, "orderingKey");
    this.onStop = Objects.requireNonNullElse(onStop, () -> {});
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.backup = Objects.requireNonNullElse(backup, BackupPort.NONE);
    this.backupFormatter = Objects.requireNonNullElse(backupFormatter, LogFormatter.SIMPLE);
    this.primaryQueue = settings.primaryCapacity() == DispatcherSettings.UNBOUNDED
        ? new LinkedBlockingQueue<>()
        : new LinkedBlockingQueue<>(settings.primaryCapacity());
    this.overflowQueue = new ArrayBlockingQueue<>(settings.overflowCapacity());
    this.workerCount = Math.max(1, settings.concurrency().workerCount());
    this.permitCount = Math.max(1, settings.concurrency().permitCount());
    this.permits = new Semaphore(permitCount);
    this.orderingLocks = new ReentrantLock[workerCount == 1 ? 1 : workerCount * ORDERING_STRIPES_PER_WORKER];
    for (int i = 0; i < orderingLocks.length; i++) {
      orderingLocks[i] = new ReentrantLock();
    }
  }

  /**
   * Creates a dispatcher delivering through a router and closing the router's sinks when stopped.
   *
   * @param router destination router
   * @param settings queue capacities and concurrency policy
   * @param metrics metrics sink
   * @param backup receives records discarded at the drain deadline
   * @return new dispatcher in {@link DispatcherState#CREATED}
   */
  public static AsyncDispatcher forRouter(
      LayerRouter router, DispatcherSettings settings, MetricsPort metrics, BackupPort backup) {
    Objects.requireNonNull(router, "router");
    return new AsyncDispatcher(
        "strata-dispatch",
        router::route,
        router::orderingKey,
        router::closeSinks,
        settings,
        metrics,
        backup,
        LogFormatter.SIMPLE);
  }

  /**
   * Starts the worker pool.
   *
   * @throws IllegalStateException when the dispatcher was already started or stopped
   */
  public synchronized void start() {
    if (!state.compareAndSet(DispatcherState.CREATED, DispatcherState.RUNNING)) {
      throw new IllegalStateException("Dispatcher " + name + " cannot start from state " + state.get());
    }
    executor = ExecutorFactories.newDispatchPool(workerCount, name + "-worker", workerUncaughtHandler);
    for (int i = 0; i < workerCount; i++) {
      executor.execute(new Worker());
    }
    log.info(
        "Started {} dispatch workers with {} permits (primary capacity {}, overflow capacity {})",
        workerCount,
        permitCount,
        settings.primaryCapacity() == DispatcherSettings.UNBOUNDED ? "unbounded" : settings.primaryCapacity(),
        settings.overflowCapacity());
  }

  /**
   * Offers a record without blocking.
   *
   * @param record record to deliver
   * @return {@code true} when queued; {@code false} when both queues are full or the dispatcher is
   *     draining or stopped, in which case the record is counted as dropped. A queued record still waiting
   *     when a drain reaches its deadline is counted as dropped at that point.
   */
  public boolean enqueue(LogRecord record) {
    Objects.requireNonNull(record, "record");
    intakeLock.readLock().lock();
    try {
      if (stopRequested.get()) {
        recordDrop();
        return false;
      }
      if (primaryQueue.offer(record)) {
        enqueuedPrimary.increment();
        metrics.increment("dispatch.enqueue.primary");
        return true;
      }
      if (overflowQueue.offer(record)) {
        enqueuedOverflow.increment();
        metrics.increment("dispatch.enqueue.overflow");
        metrics.observe("dispatch.queue.overflow.depth", overflowQueue.size());
        return true;
      }
    } finally {
      intakeLock.readLock().unlock();
    }
    recordDrop();
    logSaturation();
    return false;
  }

  /**
   * Offers several records, preserving their order within each queue.
   *
   * @param records records to deliver
   * @return number of records queued
   */
  public int enqueueAll(Collection<LogRecord> records) {
    int queued = 0;
    for (LogRecord record : records) {
      if (enqueue(record)) {
        queued++;
      }
    }
    return queued;
  }

  /**
   * Stops intake, lets workers finish until {@code deadline}, discards what is left, and runs the stop hook.
   *
   * <p>Calling again after the dispatcher stopped returns the first result.</p>
   *
   * @param deadline maximum time to wait for workers
   * @return what happened to queued work
   */
  public synchronized DrainResult drain(Duration deadline) {
    if (drainResult != null) {
      return drainResult;
    }
    Duration grace = Objects.requireNonNullElse(deadline, settings.drainGrace());
    state.set(DispatcherState.DRAINING);
    // Waits out enqueue calls already past the stop check; later calls are refused.
    intakeLock.writeLock().lock();
    try {
      stopRequested.set(true);
    } finally {
      intakeLock.writeLock().unlock();
    }
    metrics.observe("dispatch.queue.primary.depth", primaryQueue.size());
    metrics.observe("dispatch.queue.overflow.depth", overflowQueue.size());
    log.info("Draining dispatcher {} ({} primary, {} overflow queued)", name, primaryQueue.size(), overflowQueue.size());

    boolean timedOut = awaitWorkers(grace);

    List<LogRecord> leftovers = new ArrayList<>();
    primaryQueue.drainTo(leftovers);
    overflowQueue.drainTo(leftovers);
    if (!leftovers.isEmpty()) {
      dropped.add(leftovers.size());
      metrics.observe("dispatch.drain.discarded", leftovers.size());
      log.warn("Dispatcher {} discarded {} queued records at shutdown", name, leftovers.size());
      backupLeftovers(leftovers);
    }

    try {
      onStop.run();
    } catch (RuntimeException ex) {
      log.error("Dispatcher {} stop hook failed", name, ex);
    }
    state.set(DispatcherState.STOPPED);
    drainResult = new DrainResult(timedOut, leftovers.size(), dropped.sum());
    return drainResult;
  }

  /**
   * Drains using {@link DispatcherSettings#drainGrace()}.
   */
  @Override
  public void close() {
    drain(settings.drainGrace());
  }

  /**
   * Returns the lifecycle state.
   *
   * @return current state
   */
  public DispatcherState state() {
    return state.get();
  }

  /**
   * Returns the number of records refused or discarded.
   *
   * @return monotonic drop count
   */
  public long droppedCount() {
    return dropped.sum();
  }

  /**
   * Returns the current primary queue depth.
   *
   * @return queued record count
   */
  public int primaryDepth() {
    return primaryQueue.size();
  }

  /**
   * Returns the current overflow queue depth.
   *
   * @return queued record count
   */
  public int overflowDepth() {
    return overflowQueue.size();
  }

  /**
   * Snapshots queue depths and counters.
   *
   * @return dispatcher statistics
   */
  public DispatcherStats stats() {
    return new DispatcherStats(
        state.get(),
        primaryQueue.size(),
        overflowQueue.size(),
        inFlight.get(),
        enqueuedPrimary.sum(),
        enqueuedOverflow.sum(),
        processed.sum(),
        workerErrors.sum(),
        dropped.sum(),
        workerCount,
        permitCount);
  }

  private boolean awaitWorkers(Duration grace) {
    ExecutorService pool = executor;
    if (pool == null) {
      return false;
    }
    pool.shutdown();
    boolean terminated = false;
    try {
      terminated = pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        metrics.increment("dispatch.shutdown.force");
        log.warn("Dispatch workers active after {} ms; forcing shutdown", grace.toMillis());
        pool.shutdownNow();
        if (!pool.awaitTermination(FORCED_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.error("Dispatch workers failed to terminate cleanly");
        }
      }
    } catch (InterruptedException ie) {
      metrics.increment("dispatch.shutdown.interrupted");
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
    executor = null;
    return !terminated;
  }

  private void backupLeftovers(List<LogRecord> leftovers) {
    List<String> lines = new ArrayList<>(leftovers.size());
    for (LogRecord record : leftovers) {
      try {
        lines.add(backupFormatter.format(record));
      } catch (RuntimeException ex) {
        lines.add(LogFormatter.SIMPLE.format(record));
      }
    }
    try {
      backup.backup(name, List.copyOf(lines));
    } catch (IOException | RuntimeException ex) {
      log.error("Dispatcher {} could not back up {} discarded records", name, lines.size(), ex);
    }
  }

  private void recordDrop() {
    dropped.increment();
    metrics.increment("dispatch.enqueue.dropped");
  }

  private void logSaturation() {
    int count = saturationLogLimiter.incrementAndGet();
    if (count == 1 || count % SATURATION_LOG_THRESHOLD == 0) {
      log.warn(
          "Dispatcher {} queues saturated; {} records dropped so far (overflow capacity={})",
          name,
          dropped.sum(),
          settings.overflowCapacity());
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("dispatch.worker.uncaught");
    log.error("Dispatch worker {} threw an uncaught exception", thread.getName(), throwable);
  }

  private ReentrantLock orderingLockFor(LogRecord record) {
    if (orderingLocks.length == 1) {
      return orderingLocks[0];
    }
    Object key;
    try {
      key = orderingKey.apply(record);
    } catch (RuntimeException ex) {
      workerErrors.increment();
      metrics.increment("dispatch.worker.error");
      log.warn("Dispatcher {} could not compute an ordering key; using the record layer", name, ex);
      key = record.layer();
    }
    return orderingLocks[Math.floorMod(Objects.hashCode(key), orderingLocks.length)];
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (true) {
          LogRecord record;
          ReentrantLock ordering = null;
          takeLock.lock();
          try {
            record = next();
            if (record != null) {
              ordering = claim(record);
            }
          } finally {
            takeLock.unlock();
          }
          if (record == null) {
            if (stopRequested.get() && primaryQueue.isEmpty() && overflowQueue.isEmpty()) {
              break;
            }
            continue;
          }
          try {
            deliver(record);
          } finally {
            ordering.unlock();
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          metrics.increment("dispatch.worker.interrupted");
        }
      }
    }

    private LogRecord next() throws InterruptedException {
      LogRecord record = primaryQueue.poll();
      if (record != null) {
        return record;
      }
      record = overflowQueue.poll();
      if (record != null) {
        return record;
      }
      return primaryQueue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
    }

    // Runs under takeLock so ordering locks are claimed in dequeue order.
    private ReentrantLock claim(LogRecord record) throws InterruptedException {
      ReentrantLock ordering = orderingLockFor(record);
      try {
        ordering.lockInterruptibly();
      } catch (InterruptedException ie) {
        recordDrop();
        throw ie;
      }
      return ordering;
    }

    private void deliver(LogRecord record) throws InterruptedException {
      inFlight.incrementAndGet();
      boolean acquired = false;
      try {
        permits.acquire();
        acquired = true;
        consumer.accept(record);
        processed.increment();
        metrics.increment("dispatch.worker.processed");
      } catch (InterruptedException ie) {
        recordDrop();
        throw ie;
      } catch (RuntimeException ex) {
        workerErrors.increment();
        metrics.increment("dispatch.worker.error");
        log.error(
            "Dispatch worker {} failed to deliver record for layer {}: {}",
            Thread.currentThread().getName(),
            record.layer(),
            Logs.truncate(record.message(), LOG_PAYLOAD_BYTES),
            ex);
      } finally {
        if (acquired) {
          permits.release();
        }
        inFlight.decrementAndGet();
      }
    }
  }
}
