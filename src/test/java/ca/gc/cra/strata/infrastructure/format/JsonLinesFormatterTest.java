package ca.gc.cra.strata.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLinesFormatterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private final JsonLinesFormatter formatter = new JsonLinesFormatter();

  @Test
  void rendersSingleLineObject() {
    LogRecord record = LogRecord.of(NOW, LogLevel.ERROR, "api", "gateway", "upstream \"timeout\"");

    String line = formatter.format(record);

    assertEquals("{\"timestamp\":\"2024-05-01T12:00:00Z\",\"level\":\"ERROR\",\"levelValue\":40,"
        + "\"layer\":\"api\",\"logger\":\"gateway\",\"message\":\"upstream \\\"timeout\\\"\"}", line);
  }

  @Test
  void rendersCallerContextAndTypedExtras() {
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("attempt", 2);
    extra.put("ratio", 0.5);
    extra.put("retry", true);
    extra.put("note", null);
    LogRecord record = new LogRecord(NOW, LogLevel.INFO, "api", "gw", "multi\nline",
        new CallerContext("Gw.java", "call", 7), extra, Map.of("pod", "p-1"));

    String line = formatter.format(record);

    assertFalse(line.contains("\n"));
    assertEquals("{\"timestamp\":\"2024-05-01T12:00:00Z\",\"level\":\"INFO\",\"levelValue\":20,"
        + "\"layer\":\"api\",\"logger\":\"gw\",\"message\":\"multi\\nline\","
        + "\"caller\":{\"file\":\"Gw.java\",\"function\":\"call\",\"line\":7},"
        + "\"context\":{\"pod\":\"p-1\"},"
        + "\"extra\":{\"attempt\":2,\"ratio\":0.5,\"retry\":true,\"note\":null}}", line);
  }
}
