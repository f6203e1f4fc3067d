package ca.gc.cra.strata.application.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.application.routing.LayerConfiguration;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.application.sink.SinkSettings;
import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import ca.gc.cra.strata.support.InMemoryLogWriter;
import ca.gc.cra.strata.support.ManualClock;
import ca.gc.cra.strata.support.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncLayeredLoggerTest {
  private InMemoryLogWriter writer;
  private ManualClock clock;
  private RecordingMetricsPort metrics;

  @BeforeEach
  void setUp() {
    writer = new InMemoryLogWriter();
    clock = new ManualClock(1_700_000_000_000L);
    metrics = new RecordingMetricsPort();
  }

  @Test
  void appLayerBatchIsWrittenOnceInOrder() {
    SyncLayeredLogger logger = logger(router("APP", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY,
        new SinkSettings(3, Duration.ofSeconds(60))), LoggerOptions.named("svc"));

    assertTrue(logger.info("A", "APP"));
    assertTrue(logger.info("B", "APP"));
    assertTrue(writer.batches().isEmpty());
    assertTrue(logger.info("C", "APP"));

    assertEquals(List.of(List.of("A", "B", "C")), writer.batches());
    logger.close();
    assertEquals(1, writer.batches().size());
  }

  @Test
  void noLayersMeansNothingIsLogged() {
    SyncLayeredLogger logger = logger(new LayerRouter(LayerConfiguration.empty()), LoggerOptions.named("svc"));

    assertFalse(logger.info("ignored"));
    assertFalse(logger.critical("ignored", "APP"));
    assertEquals(2, logger.health().rejected());
    logger.close();
  }

  @Test
  void layerThresholdRejectsBeforeBuildingRecord() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.WARNING, LogFormatter.MESSAGE_ONLY,
        SinkSettings.unbuffered()), LoggerOptions.named("svc").withMetrics(metrics));

    assertFalse(logger.debug("noise"));
    assertTrue(logger.error("signal"));

    assertEquals(1, metrics.count("logger.record.rejected"));
    assertEquals(1, metrics.count("logger.record.built"));
    assertEquals(List.of("signal"), writer.lines());
  }

  @Test
  void recordsCarryClockTimestampLoggerNameAndContext() {
    AtomicReference<LogRecord> seen = new AtomicReference<>();
    LogFormatter capturing = record -> {
      seen.set(record);
      return record.message();
    };
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, capturing, SinkSettings.unbuffered()),
        LoggerOptions.named("billing").withClock(clock).withContext(Map.of("region", "ca-central")));

    logger.log(LogLevel.INFO, "paid", "default", Map.of("amount", 12));

    LogRecord record = seen.get();
    assertEquals(clock.nowMillis(), record.timestamp().toEpochMilli());
    assertEquals("billing", record.loggerName());
    assertEquals("ca-central", record.context().get("region"));
    assertEquals(12, record.extra().get("amount"));
    assertNull(record.caller());
  }

  @Test
  void callerCaptureReportsTheCallingMethod() {
    AtomicReference<LogRecord> seen = new AtomicReference<>();
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, record -> {
      seen.set(record);
      return record.message();
    }, SinkSettings.unbuffered()), LoggerOptions.named("svc").withCallerCapture(true));

    logger.info("where am I");

    CallerContext caller = seen.get().caller();
    assertNotNull(caller);
    assertEquals("callerCaptureReportsTheCallingMethod", caller.function());
  }

  @Test
  void explicitCallerIsKept() {
    AtomicReference<LogRecord> seen = new AtomicReference<>();
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, record -> {
      seen.set(record);
      return record.message();
    }, SinkSettings.unbuffered()), LoggerOptions.named("svc").withCallerCapture(true));
    CallerContext caller = new CallerContext("Job.java", "run", 42);

    logger.log(LogLevel.INFO, "explicit", "default", null, caller);

    assertEquals(caller, seen.get().caller());
  }

  @Test
  void redactionRewritesMessage() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY,
        SinkSettings.unbuffered()), LoggerOptions.named("svc").withRedaction(m -> m.replace("4111", "****")));

    logger.info("card 4111");

    assertEquals(List.of("card ****"), writer.lines());
  }

  @Test
  void failingRedactionKeepsOriginalMessage() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY,
        SinkSettings.unbuffered()), LoggerOptions.named("svc").withMetrics(metrics).withRedaction(m -> {
          throw new IllegalStateException("hook broken");
        }));

    assertTrue(logger.info("original"));

    assertEquals(List.of("original"), writer.lines());
    assertEquals(1, metrics.count("logger.redaction.error"));
  }

  @Test
  void closedLoggerIgnoresCallsAndClosesOnce() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY,
        new SinkSettings(10, Duration.ofSeconds(60))), LoggerOptions.named("svc"));
    logger.info("buffered");

    logger.close();
    logger.close();

    assertEquals(LoggerState.CLOSED, logger.state());
    assertFalse(logger.info("late"));
    assertEquals(List.of("buffered"), writer.lines());
    assertEquals(1, writer.closeCount());
  }

  @Test
  void uninitializedLoggerDropsRecords() {
    SyncLayeredLogger logger = new SyncLayeredLogger(LoggerOptions.named("svc"),
        router("default", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, SinkSettings.unbuffered()));

    assertEquals(LoggerState.UNINITIALIZED, logger.state());
    assertFalse(logger.info("too early"));
    logger.initialize();
    assertThrows(IllegalStateException.class, logger::initialize);
    assertTrue(logger.info("on time"));
    assertEquals(List.of("on time"), writer.lines());
    logger.close();
  }

  @Test
  void batchCountsAcceptedEntries() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.INFO, LogFormatter.MESSAGE_ONLY,
        SinkSettings.unbuffered()), LoggerOptions.named("svc"));

    int accepted = logger.logBatch(List.of(
        LogEntry.of(LogLevel.INFO, "one"),
        LogEntry.of(LogLevel.DEBUG, "skipped"),
        LogEntry.of(LogLevel.ERROR, "two")));

    assertEquals(2, accepted);
    assertEquals(List.of("one", "two"), writer.lines());
    logger.close();
  }

  @Test
  void healthReflectsSinkWriteErrors() {
    SyncLayeredLogger logger = logger(router("default", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY,
        SinkSettings.unbuffered()), LoggerOptions.named("svc"));
    assertTrue(logger.health().healthy());

    writer.failWrites(true);
    logger.info("lost");

    LoggerHealth health = logger.health();
    assertFalse(health.healthy());
    assertEquals(1, health.sinkWriteErrors());
    assertNull(health.dispatcher());
    logger.close();
    assertFalse(logger.health().healthy());
  }

  private SyncLayeredLogger logger(LayerRouter router, LoggerOptions options) {
    SyncLayeredLogger logger = new SyncLayeredLogger(options, router);
    logger.initialize();
    return logger;
  }

  private LayerRouter router(String layer, LogLevel threshold, LogFormatter formatter, SinkSettings settings) {
    Sink sink = new Sink("sink", LogLevel.NOTSET, formatter, writer, settings, clock, metrics, null);
    return new LayerRouter(LayerConfiguration.builder().layer(layer, threshold, List.of(sink)).build(), metrics);
  }
}
