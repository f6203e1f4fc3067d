package ca.gc.cra.strata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.dispatch.DispatcherSettings;
import ca.gc.cra.strata.domain.log.LogLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggingConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadParsesFullDocument() throws IOException {
    Path yaml = tempDir.resolve("strata.yaml");
    Files.writeString(yaml, """
        strata:
          mode: async
          defaultLevel: warn
          captureCaller: true
          flushIntervalMillis: 100
          metrics: otel
          backupDirectory: /var/spool/strata
          async:
            primaryCapacity: 1000
            overflowCapacity: 50
            concurrency: memory
            workers: 4
            drainGraceMillis: 2000
          layers:
            default:
              destinations:
                - type: console
            db:
              level: DEBUG
              destinations:
                - type: file
                  path: logs/db.log
                  format: json
                  level: 30
                  bufferSize: 10
                  flushAgeMillis: 750
                - type: null
        """);

    LoggingSettings settings = LoggingConfigLoader.load(yaml).orElseThrow();

    assertEquals(LoggingSettings.Mode.ASYNC, settings.mode());
    assertEquals(LogLevel.WARNING, settings.defaultLevel());
    assertTrue(settings.captureCaller());
    assertEquals(Duration.ofMillis(100), settings.flushInterval());
    assertEquals(LoggingSettings.METRICS_OTEL, settings.metrics());
    assertEquals(Path.of("/var/spool/strata"), settings.backupDirectory());

    AsyncSettings async = settings.async();
    assertEquals(1000, async.primaryCapacity());
    assertEquals(50, async.overflowCapacity());
    assertEquals(AsyncSettings.MEMORY, async.concurrency());
    assertEquals(4, async.workers());
    assertEquals(Duration.ofSeconds(2), async.drainGrace());

    assertEquals(2, settings.layers().size());
    LayerSettings defaults = settings.layer("default").orElseThrow();
    assertEquals(LogLevel.WARNING, defaults.level());
    assertEquals(DestinationSettings.CONSOLE, defaults.destinations().get(0).type());

    LayerSettings db = settings.layer("db").orElseThrow();
    assertEquals(LogLevel.DEBUG, db.level());
    DestinationSettings file = db.destinations().get(0);
    assertEquals(DestinationSettings.FILE, file.type());
    assertEquals(DestinationSettings.JSON, file.format());
    assertEquals(Path.of("logs/db.log"), file.path());
    assertEquals(LogLevel.WARNING, file.level());
    assertEquals(10, file.sink().maxBufferSize());
    assertEquals(Duration.ofMillis(750), file.sink().maxBufferAge());
    assertEquals(DestinationSettings.NULL, db.destinations().get(1).type());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertTrue(LoggingConfigLoader.load(tempDir.resolve("absent.yaml")).isEmpty());
  }

  @Test
  void emptyDocumentYieldsDefaults() {
    LoggingSettings settings = LoggingConfigLoader.parse("");

    assertEquals(LoggingSettings.defaults(), settings);
  }

  @Test
  void missingSectionsUseDefaults() {
    LoggingSettings settings = LoggingConfigLoader.parse("""
        strata:
          defaultLevel: ERROR
        """);

    assertEquals(LoggingSettings.Mode.SYNC, settings.mode());
    assertFalse(settings.verbose());
    assertNull(settings.backupDirectory());
    assertEquals(DispatcherSettings.UNBOUNDED, settings.async().primaryCapacity());
    assertEquals(LogLevel.ERROR, settings.layer("default").orElseThrow().level());
  }

  @Test
  void disabledLayerIsKeptButMarked() {
    LoggingSettings settings = LoggingConfigLoader.parse("""
        strata:
          layers:
            audit:
              enabled: false
              destinations:
                - type: stderr
        """);

    assertFalse(settings.layer("audit").orElseThrow().enabled());
  }

  @Test
  void fileDestinationWithoutPathIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> LoggingConfigLoader.parse("""
        strata:
          layers:
            app:
              destinations:
                - type: file
        """));

    assertEquals("strata.layers.app.destinations[0].path is required for file destinations", ex.getMessage());
  }

  @Test
  void unknownValuesNameTheOffendingKey() {
    IllegalArgumentException mode = assertThrows(IllegalArgumentException.class,
        () -> LoggingConfigLoader.parse("strata:\n  mode: turbo\n"));
    assertTrue(mode.getMessage().startsWith("strata.mode"));

    IllegalArgumentException level = assertThrows(IllegalArgumentException.class,
        () -> LoggingConfigLoader.parse("strata:\n  layers:\n    app:\n      level: LOUD\n"));
    assertTrue(level.getMessage().startsWith("strata.layers.app.level"));

    IllegalArgumentException workers = assertThrows(IllegalArgumentException.class,
        () -> LoggingConfigLoader.parse("strata:\n  async:\n    workers: 0\n"));
    assertTrue(workers.getMessage().startsWith("strata.async.workers"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigLoader.parse("strata: [unclosed"));
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigLoader.parse("strata: 5"));
  }
}
