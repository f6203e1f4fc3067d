package ca.gc.cra.strata.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PlainTextFormatterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private final PlainTextFormatter formatter = new PlainTextFormatter();

  @Test
  void rendersTimestampLevelLayerLoggerAndMessage() {
    LogRecord record = LogRecord.of(NOW, LogLevel.INFO, "db", "orders", "connected");

    assertEquals("2024-05-01T12:00:00Z INFO     [db] orders - connected", formatter.format(record));
  }

  @Test
  void appendsPairsAndCaller() {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("rows", 3);
    extra.put("table", "t1");
    LogRecord record = new LogRecord(NOW, LogLevel.WARNING, "db", "", "slow query",
        new CallerContext("Repo.java", "load", 88), extra, Map.of("env", "prod"));

    assertEquals("2024-05-01T12:00:00Z WARNING  [db] slow query env=prod rows=3 table=t1 (Repo.java:88 in load)",
        formatter.format(record));
  }
}
