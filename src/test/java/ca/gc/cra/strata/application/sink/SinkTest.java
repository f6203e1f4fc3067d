package ca.gc.cra.strata.application.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.support.InMemoryLogWriter;
import ca.gc.cra.strata.support.ManualClock;
import ca.gc.cra.strata.support.RecordingBackupPort;
import ca.gc.cra.strata.support.RecordingMetricsPort;
import ca.gc.cra.strata.support.TestRecords;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SinkTest {
  private InMemoryLogWriter writer;
  private ManualClock clock;
  private RecordingMetricsPort metrics;
  private RecordingBackupPort backup;

  @BeforeEach
  void setUp() {
    writer = new InMemoryLogWriter();
    clock = new ManualClock(1_000L);
    metrics = new RecordingMetricsPort();
    backup = new RecordingBackupPort();
  }

  @Test
  void sizeTriggerWritesOneBatchInArrivalOrder() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(3, Duration.ofSeconds(60)));

    sink.accept(TestRecords.info("A"));
    sink.accept(TestRecords.info("B"));
    assertTrue(writer.batches().isEmpty());
    sink.accept(TestRecords.info("C"));

    assertEquals(List.of(List.of("A", "B", "C")), writer.batches());
    assertEquals(0, sink.stats().buffered());
    assertEquals(1, metrics.count("sink.flush.batches"));
  }

  @Test
  void ageTriggerFlushesOnTimerCheck() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(100, Duration.ofSeconds(60)));
    sink.accept(TestRecords.info("first"));
    sink.accept(TestRecords.info("second"));

    assertFalse(sink.flushIfDue());
    clock.advance(Duration.ofSeconds(60));

    assertTrue(sink.flushIfDue());
    assertEquals(List.of(List.of("first", "second")), writer.batches());
    assertFalse(sink.flushIfDue());
  }

  @Test
  void recordArrivingAfterIdleAgeIsFlushedOnAccept() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(3, Duration.ofSeconds(60)));
    clock.advance(Duration.ofSeconds(61));

    sink.accept(TestRecords.info("late"));

    assertEquals(List.of(List.of("late")), writer.batches());
  }

  @Test
  void flushResetsTheAgeTimer() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(100, Duration.ofSeconds(10)));
    clock.advance(Duration.ofSeconds(4));
    sink.accept(TestRecords.info("a"));
    sink.flush();

    clock.advance(Duration.ofSeconds(8));
    sink.accept(TestRecords.info("b"));
    assertFalse(sink.flushIfDue());

    clock.advance(Duration.ofSeconds(2));
    assertTrue(sink.flushIfDue());
    assertEquals(List.of(List.of("a"), List.of("b")), writer.batches());
  }

  @Test
  void ageTriggerAlsoFiresOnAccept() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(100, Duration.ofSeconds(1)));
    sink.accept(TestRecords.info("a"));
    clock.advance(Duration.ofSeconds(2));
    sink.accept(TestRecords.info("b"));

    assertEquals(List.of(List.of("a", "b")), writer.batches());
  }

  @Test
  void recordsBelowThresholdAreRejected() {
    Sink sink = sink(LogLevel.WARNING, LogFormatter.MESSAGE_ONLY, SinkSettings.unbuffered());

    assertFalse(sink.accept(TestRecords.record(LogLevel.INFO, "app", "quiet")));
    assertTrue(sink.accept(TestRecords.record(LogLevel.ERROR, "app", "loud")));

    assertEquals(List.of("loud"), writer.lines());
    assertEquals(1, sink.stats().rejected());
    assertEquals(1, metrics.count("sink.rejected.level"));
  }

  @Test
  void writeFailureIsContainedCountedAndBackedUp() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(2, Duration.ofSeconds(60)));
    writer.failWrites(true);

    sink.accept(TestRecords.info("x"));
    sink.accept(TestRecords.info("y"));

    SinkStats stats = sink.stats();
    assertEquals(1, stats.writeErrors());
    assertEquals(0, stats.buffered());
    assertEquals(1, stats.backedUpBatches());
    assertTrue(stats.degraded());
    assertEquals(List.of(List.of("x", "y")), backup.batches());
    assertEquals(List.of("sink"), backup.sources());
    assertEquals(1, metrics.count("sink.write.error"));

    writer.failWrites(false);
    sink.accept(TestRecords.info("z"));
    sink.flush();
    assertEquals(List.of("z"), writer.lines());
  }

  @Test
  void failedBackupIsCounted() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, SinkSettings.unbuffered());
    writer.failWrites(true);
    backup.failBackups(true);

    sink.accept(TestRecords.info("lost"));

    assertEquals(1, sink.stats().backupErrors());
    assertEquals(1, metrics.count("sink.backup.error"));
  }

  @Test
  void formatFailureSkipsOnlyThatRecord() {
    LogFormatter picky = record -> {
      if (record.message().equals("bad")) {
        throw new IllegalStateException("cannot render");
      }
      return record.message();
    };
    Sink sink = sink(LogLevel.NOTSET, picky, new SinkSettings(3, Duration.ofSeconds(60)));

    sink.accept(TestRecords.info("ok-1"));
    sink.accept(TestRecords.info("bad"));
    sink.accept(TestRecords.info("ok-2"));

    assertEquals(List.of(List.of("ok-1", "ok-2")), writer.batches());
    assertEquals(1, sink.stats().formatErrors());
  }

  @Test
  void closeFlushesOnceAndReleasesWriter() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(100, Duration.ofSeconds(60)));
    sink.accept(TestRecords.info("pending"));

    sink.close();
    sink.close();

    assertTrue(sink.isClosed());
    assertEquals(List.of(List.of("pending")), writer.batches());
    assertEquals(1, writer.closeCount());
    assertFalse(sink.accept(TestRecords.info("after close")));
    assertEquals(1, metrics.count("sink.rejected.closed"));
  }

  @Test
  void flushOfEmptyBufferWritesNothing() {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, SinkSettings.console());

    assertEquals(0, sink.flush());
    assertTrue(writer.batches().isEmpty());
  }

  @Test
  void concurrentProducersLoseNothing() throws Exception {
    Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(7, Duration.ofSeconds(60)));
    int threads = 4;
    int perThread = 250;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    for (int t = 0; t < threads; t++) {
      int id = t;
      executor.submit(() -> {
        for (int i = 0; i < perThread; i++) {
          sink.accept(TestRecords.info(id + "-" + i));
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "producers not finished");
    sink.close();

    List<String> lines = writer.lines();
    assertEquals(threads * perThread, lines.size());
    for (int t = 0; t < threads; t++) {
      String prefix = t + "-";
      List<String> own = lines.stream().filter(line -> line.startsWith(prefix)).toList();
      for (int i = 0; i < perThread; i++) {
        assertEquals(prefix + i, own.get(i));
      }
    }
  }

  @Test
  void writeFailureIsLoggedAsWarning() {
    Logger logger = (Logger) LoggerFactory.getLogger(Sink.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    boolean additive = logger.isAdditive();
    logger.setAdditive(false);
    try {
      Sink sink = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, SinkSettings.unbuffered());
      writer.failWrites(true);

      sink.accept(TestRecords.info("one"));
      sink.accept(TestRecords.info("two"));

      List<ILoggingEvent> warnings = appender.list.stream()
          .filter(event -> event.getLevel() == ch.qos.logback.classic.Level.WARN)
          .toList();
      assertEquals(1, warnings.size(), "second failure is rate limited");
      assertTrue(warnings.get(0).getFormattedMessage().contains("failed to write batch"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(additive);
    }
  }

  @Test
  void flushSchedulerTickFlushesDueSinks() {
    Sink due = sink(LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, new SinkSettings(100, Duration.ofSeconds(1)));
    InMemoryLogWriter otherWriter = new InMemoryLogWriter();
    Sink fresh = new Sink("fresh", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, otherWriter,
        new SinkSettings(100, Duration.ofMinutes(1)), clock, metrics, backup);
    due.accept(TestRecords.info("due"));
    fresh.accept(TestRecords.info("fresh"));
    clock.advance(Duration.ofSeconds(2));

    try (SinkFlushScheduler scheduler = new SinkFlushScheduler(() -> List.of(due, fresh), Duration.ofMinutes(1))) {
      assertEquals(1, scheduler.tick());
    }

    assertEquals(List.of("due"), writer.lines());
    assertTrue(otherWriter.lines().isEmpty());
  }

  private Sink sink(LogLevel threshold, LogFormatter formatter, SinkSettings settings) {
    return new Sink("sink", threshold, formatter, writer, settings, clock, metrics, backup);
  }
}
