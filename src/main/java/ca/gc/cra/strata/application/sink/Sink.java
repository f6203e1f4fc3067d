package ca.gc.cra.strata.application.sink;

import ca.gc.cra.strata.application.port.BackupPort;
import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.application.port.LogWriter;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import ca.gc.cra.strata.logging.Logs;
import ca.gc.cra.strata.validation.Strings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffered, batching consumer that formats records and writes them to a single destination.
 *
 * <p>Records passing the level threshold are appended under a per-sink lock. A flush runs when the
 * buffer reaches {@link SinkSettings#maxBufferSize()} or when {@link SinkSettings#maxBufferAge()} has passed
 * since the last flush (or since construction); both triggers are checked on every {@link #accept(LogRecord)} and
 * again by {@link #flushIfDue()} from a periodic timer. A flush formats every buffered record, issues one
 * {@link LogWriter#write(List)} call, clears the buffer whether or not the write succeeded, and resets the
 * flush timer. A record arriving after the sink sat idle for longer than the age limit is flushed at once.</p>
 *
 * <p>Write failures never leave the sink: they are counted, logged through SLF4J at a limited rate, and
 * the lost batch is handed to the {@link BackupPort}. The writer is owned exclusively by this sink and
 * released by {@link #close()}, which runs at most once.</p>
 *
 * @since 0.1.0
 */
public final class Sink implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Sink.class);
  private static final int FAILURE_LOG_THRESHOLD = 1_000;
  private static final int LOG_PAYLOAD_BYTES = 256;

  private final String name;
  private final LogLevel threshold;
  private final LogFormatter formatter;
  private final LogWriter writer;
  private final SinkSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final BackupPort backup;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<LogRecord> buffer = new ArrayList<>();
  private long lastFlushMillis;

  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicInteger failureLogLimiter = new AtomicInteger();
  private final LongAdder accepted = new LongAdder();
  private final LongAdder rejected = new LongAdder();
  private final LongAdder batchesWritten = new LongAdder();
  private final LongAdder recordsWritten = new LongAdder();
  private final LongAdder writeErrors = new LongAdder();
  private final LongAdder formatErrors = new LongAdder();
  private final LongAdder backedUpBatches = new LongAdder();
  private final LongAdder backupErrors = new LongAdder();

  /**
   * Creates a sink using the system clock, no metrics and no backup.
   *
   * @param name sink name used in diagnostics and backup grouping
   * @param threshold minimum level accepted
   * @param formatter renders records to lines
   * @param writer destination owned by this sink
   * @param settings flush tuning
   */
  public Sink(String name, LogLevel threshold, LogFormatter formatter, LogWriter writer, SinkSettings settings) {
    this(name, threshold, formatter, writer, settings, ClockPort.SYSTEM, MetricsPort.NO_OP, BackupPort.NONE);
  }

  /**
   * Creates a sink.
   *
   * @param name sink name used in diagnostics and backup grouping
   * @param threshold minimum level accepted
   * @param formatter renders records to lines
   * @param writer destination owned by this sink
   * @param settings flush tuning
   * @param clock time source for age-based flushing
   * @param metrics metrics sink for flush and failure counters
   * @param backup receives batches that could not be written
   */
  public Sink(
      String name,
      LogLevel threshold,
      LogFormatter formatter,
      LogWriter writer,
      SinkSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      BackupPort backup) {
    this.name = Strings.requireNonBlank("name", name);
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.backup = Objects.requireNonNullElse(backup, BackupPort.NONE);
    this.lastFlushMillis = clock.nowMillis();
  }

  /**
   * Buffers a record when it passes the level threshold, flushing if a trigger fires.
   *
   * <p>Safe to call concurrently from producer threads and dispatch workers. The calling thread performs
   * the flush and may block on destination I/O.</p>
   *
   * @param record record to buffer; never {@code null}
   * @return {@code true} when the record was buffered; {@code false} when filtered or the sink is closed
   */
  public boolean accept(LogRecord record) {
    Objects.requireNonNull(record, "record");
    if (!record.level().isAtLeast(threshold)) {
      rejected.increment();
      metrics.increment("sink.rejected.level");
      return false;
    }
    lock.lock();
    try {
      if (closed.get()) {
        rejected.increment();
        metrics.increment("sink.rejected.closed");
        return false;
      }
      buffer.add(record);
      accepted.increment();
      metrics.increment("sink.accepted");
      if (buffer.size() >= settings.maxBufferSize() || ageExceeded(clock.nowMillis())) {
        flushLocked();
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Timer hook: flushes a non-empty buffer once the configured age has passed since the last flush.
   *
   * @return {@code true} when a flush ran
   */
  public boolean flushIfDue() {
    lock.lock();
    try {
      if (buffer.isEmpty() || !ageExceeded(clock.nowMillis())) {
        return false;
      }
      flushLocked();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flushes any buffered records immediately.
   *
   * @return number of records removed from the buffer
   */
  public int flush() {
    lock.lock();
    try {
      return flushLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Performs a final flush and releases the writer. Later calls return immediately.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lock.lock();
    try {
      flushLocked();
    } finally {
      lock.unlock();
    }
    try {
      writer.close();
    } catch (IOException | RuntimeException ex) {
      metrics.increment("sink.close.error");
      log.warn("Sink {} failed to release its writer", name, ex);
    }
    log.debug("Sink {} closed after {} batches", name, batchesWritten.sum());
  }

  /**
   * Returns the sink name.
   *
   * @return name supplied at construction
   */
  public String name() {
    return name;
  }

  /**
   * Returns the minimum accepted level.
   *
   * @return level threshold
   */
  public LogLevel threshold() {
    return threshold;
  }

  /**
   * Returns the flush tuning.
   *
   * @return settings supplied at construction
   */
  public SinkSettings settings() {
    return settings;
  }

  /**
   * Whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Snapshots counters and the current buffer depth.
   *
   * @return sink statistics
   */
  public SinkStats stats() {
    int depth;
    lock.lock();
    try {
      depth = buffer.size();
    } finally {
      lock.unlock();
    }
    return new SinkStats(
        name,
        threshold,
        depth,
        accepted.sum(),
        rejected.sum(),
        batchesWritten.sum(),
        recordsWritten.sum(),
        writeErrors.sum(),
        formatErrors.sum(),
        backedUpBatches.sum(),
        backupErrors.sum(),
        closed.get());
  }

  @Override
  public String toString() {
    return "Sink[" + name + ", threshold=" + threshold + "]";
  }

  private boolean ageExceeded(long now) {
    return now - lastFlushMillis >= settings.maxBufferAge().toMillis();
  }

  private int flushLocked() {
    if (buffer.isEmpty()) {
      return 0;
    }
    List<LogRecord> pending = new ArrayList<>(buffer);
    buffer.clear();
    lastFlushMillis = clock.nowMillis();

    List<String> lines = format(pending);
    if (lines.isEmpty()) {
      return pending.size();
    }
    long startNanos = System.nanoTime();
    try {
      writer.write(lines);
      batchesWritten.increment();
      recordsWritten.add(lines.size());
      metrics.increment("sink.flush.batches");
      metrics.observe("sink.flush.records", lines.size());
      metrics.observe("sink.flush.latencyNanos", System.nanoTime() - startNanos);
    } catch (IOException | RuntimeException ex) {
      writeErrors.increment();
      metrics.increment("sink.write.error");
      logWriteFailure(lines.size(), ex);
      backup(lines);
    }
    return pending.size();
  }

  private List<String> format(List<LogRecord> pending) {
    List<String> lines = new ArrayList<>(pending.size());
    for (LogRecord record : pending) {
      try {
        String line = formatter.format(record);
        if (line == null) {
          throw new IllegalStateException("formatter returned null");
        }
        lines.add(line);
      } catch (RuntimeException ex) {
        formatErrors.increment();
        metrics.increment("sink.format.error");
        log.debug("Sink {} could not format record {}", name, Logs.truncate(record.message(), LOG_PAYLOAD_BYTES), ex);
      }
    }
    return List.copyOf(lines);
  }

  private void backup(List<String> lines) {
    try {
      backup.backup(name, lines);
      backedUpBatches.increment();
      metrics.increment("sink.backup.success");
    } catch (IOException | RuntimeException ex) {
      backupErrors.increment();
      metrics.increment("sink.backup.error");
      log.warn("Sink {} lost {} records; backup failed", name, lines.size(), ex);
    }
  }

  private void logWriteFailure(int size, Exception ex) {
    int count = failureLogLimiter.incrementAndGet();
    if (count == 1 || count % FAILURE_LOG_THRESHOLD == 0) {
      log.warn("Sink {} failed to write batch of {} records (failure #{})", name, size, count, ex);
    }
  }
}
