package ca.gc.cra.strata.application.logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.dispatch.AsyncDispatcher;
import ca.gc.cra.strata.application.dispatch.DispatcherSettings;
import ca.gc.cra.strata.application.dispatch.DispatcherState;
import ca.gc.cra.strata.application.port.BackupPort;
import ca.gc.cra.strata.application.port.ConcurrencyPolicy;
import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.routing.LayerConfiguration;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.application.sink.SinkSettings;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.support.InMemoryLogWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncLayeredLoggerTest {
  private InMemoryLogWriter writer;

  @BeforeEach
  void setUp() {
    writer = new InMemoryLogWriter();
  }

  @Test
  void appLayerRecordsArriveAsOneBatchAfterClose() {
    AsyncLayeredLogger logger = logger("APP", new SinkSettings(3, Duration.ofSeconds(60)), 1);

    assertTrue(logger.info("A", "APP"));
    assertTrue(logger.info("B", "APP"));
    assertTrue(logger.info("C", "APP"));
    logger.close();

    assertEquals(List.of(List.of("A", "B", "C")), writer.batches());
    assertTrue(logger.drainResult().clean());
    assertEquals(DispatcherState.STOPPED, logger.dispatcher().state());
    assertEquals(1, writer.closeCount());
  }

  @Test
  void closeDeliversEverythingQueued() {
    AsyncLayeredLogger logger = logger("default", new SinkSettings(50, Duration.ofSeconds(60)), 2);

    for (int i = 0; i < 500; i++) {
      logger.info("m" + i);
    }
    logger.close();

    assertEquals(500, writer.lines().size());
    assertEquals(500, logger.health().logged());
  }

  @Test
  void batchIsPreparedAndQueuedTogether() {
    AsyncLayeredLogger logger = logger("default", new SinkSettings(100, Duration.ofSeconds(60)), 1);
    List<LogEntry> entries = new ArrayList<>();
    entries.add(LogEntry.of(LogLevel.INFO, "first"));
    entries.add(LogEntry.of(LogLevel.DEBUG, "filtered"));
    entries.add(LogEntry.of(LogLevel.WARNING, "second"));

    assertEquals(2, logger.logBatch(entries));
    logger.close();

    assertEquals(List.of("first", "second"), writer.lines());
  }

  @Test
  void noLayersRejectsWithoutQueueing() {
    LayerRouter router = new LayerRouter(LayerConfiguration.empty());
    AsyncDispatcher dispatcher = AsyncDispatcher.forRouter(router, DispatcherSettings.defaults(), MetricsPort.NO_OP,
        BackupPort.NONE);
    AsyncLayeredLogger logger = new AsyncLayeredLogger(
        LoggerOptions.named("svc"), router, dispatcher, null, Duration.ofSeconds(1));
    logger.initialize();

    assertFalse(logger.info("nowhere"));
    assertEquals(0, dispatcher.stats().enqueuedPrimary());
    logger.close();
  }

  @Test
  void healthIncludesDispatcherStats() {
    AsyncLayeredLogger logger = logger("default", SinkSettings.unbuffered(), 1);
    logger.info("one");

    LoggerHealth health = logger.health();
    assertNotNull(health.dispatcher());
    assertEquals(1, health.dispatcher().workers());
    logger.close();
    assertEquals(LoggerState.CLOSED, logger.state());
    assertFalse(logger.info("after close"));
  }

  private AsyncLayeredLogger logger(String layer, SinkSettings sinkSettings, int workers) {
    Sink sink = new Sink("sink", LogLevel.NOTSET, LogFormatter.MESSAGE_ONLY, writer, sinkSettings);
    LayerRouter router = new LayerRouter(LayerConfiguration.builder()
        .layer(layer, LogLevel.INFO, List.of(sink))
        .build());
    DispatcherSettings settings = DispatcherSettings.defaults()
        .withConcurrency(ConcurrencyPolicy.fixed(workers, 10));
    AsyncDispatcher dispatcher = AsyncDispatcher.forRouter(router, settings, MetricsPort.NO_OP, BackupPort.NONE);
    AsyncLayeredLogger logger = new AsyncLayeredLogger(
        LoggerOptions.named("svc"), router, dispatcher, null, Duration.ofSeconds(5));
    logger.initialize();
    return logger;
  }
}
