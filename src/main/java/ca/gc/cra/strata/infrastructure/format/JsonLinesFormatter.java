package ca.gc.cra.strata.infrastructure.format;

import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogRecord;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Renders each record as a single-line JSON object.
 *
 * <p>Fields: {@code timestamp}, {@code level}, {@code levelValue}, {@code layer}, {@code logger},
 * {@code message}, optional {@code caller}, and {@code context}/{@code extra} objects when non-empty.
 * Map values that are not strings, numbers or booleans are written with {@link String#valueOf(Object)}.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesFormatter implements LogFormatter {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public String format(LogRecord record) {
    StringWriter out = new StringWriter(128 + record.message().length());
    try (JsonGenerator json = factory.createGenerator(out)) {
      json.writeStartObject();
      json.writeStringField("timestamp", record.timestamp().toString());
      json.writeStringField("level", record.levelName());
      json.writeNumberField("levelValue", record.levelValue());
      json.writeStringField("layer", record.layer());
      json.writeStringField("logger", record.loggerName());
      json.writeStringField("message", record.message());
      CallerContext caller = record.caller();
      if (caller != null) {
        json.writeObjectFieldStart("caller");
        json.writeStringField("file", caller.file());
        json.writeStringField("function", caller.function());
        json.writeNumberField("line", caller.line());
        json.writeEndObject();
      }
      writeMap(json, "context", record.context());
      writeMap(json, "extra", record.extra());
      json.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render record as JSON", ex);
    }
    return out.toString();
  }

  private static void writeMap(JsonGenerator json, String field, Map<String, Object> values) throws IOException {
    if (values.isEmpty()) {
      return;
    }
    json.writeObjectFieldStart(field);
    for (Map.Entry<String, Object> entry : values.entrySet()) {
      json.writeFieldName(entry.getKey());
      writeValue(json, entry.getValue());
    }
    json.writeEndObject();
  }

  private static void writeValue(JsonGenerator json, Object value) throws IOException {
    if (value == null) {
      json.writeNull();
    } else if (value instanceof Boolean bool) {
      json.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      json.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      json.writeNumber(number.doubleValue());
    } else {
      json.writeString(String.valueOf(value));
    }
  }
}
