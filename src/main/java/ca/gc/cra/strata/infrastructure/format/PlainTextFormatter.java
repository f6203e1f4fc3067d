package ca.gc.cra.strata.infrastructure.format;

import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Renders {@code <ISO-8601 timestamp> <LEVEL> [<layer>] <logger> - <message>} followed by
 * {@code key=value} pairs for context and extras, and {@code (file:line in function)} when a caller is known.
 *
 * @since 0.1.0
 */
public final class PlainTextFormatter implements LogFormatter {
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_INSTANT;

  @Override
  public String format(LogRecord record) {
    StringBuilder line = new StringBuilder(96 + record.message().length());
    line.append(TIMESTAMP.format(record.timestamp()))
        .append(' ')
        .append(String.format("%-8s", record.levelName()))
        .append(' ')
        .append('[').append(record.layer()).append("] ");
    if (!record.loggerName().isEmpty()) {
      line.append(record.loggerName()).append(" - ");
    }
    line.append(record.message());
    appendPairs(line, record.context());
    appendPairs(line, record.extra());
    CallerContext caller = record.caller();
    if (caller != null) {
      line.append(" (").append(caller.file()).append(':').append(caller.line())
          .append(" in ").append(caller.function()).append(')');
    }
    return line.toString();
  }

  private static void appendPairs(StringBuilder line, Map<String, Object> pairs) {
    for (Map.Entry<String, Object> entry : pairs.entrySet()) {
      line.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
    }
  }
}
