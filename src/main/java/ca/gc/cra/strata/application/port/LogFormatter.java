package ca.gc.cra.strata.application.port;

import ca.gc.cra.strata.domain.log.LogRecord;

/**
 * <strong>What:</strong> Port rendering a {@link LogRecord} into one output line.
 * <p><strong>Role:</strong> Collaborator owned by a sink; invoked on the thread performing the flush.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be stateless. A sink never calls its formatter
 * concurrently, but one formatter instance may be shared by several sinks.</p>
 * <p><strong>Failure:</strong> Any runtime exception is treated as an opaque per-record failure by the sink.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogFormatter {
  /**
   * Formats a record.
   *
   * @param record record to render; never {@code null}
   * @return rendered line without a trailing newline
   */
  String format(LogRecord record);

  /**
   * Formatter that emits only the message text.
   */
  LogFormatter MESSAGE_ONLY = LogRecord::message;

  /**
   * Formatter emitting {@code LEVEL [layer] message}, used when nothing richer is configured.
   */
  LogFormatter SIMPLE = record -> record.levelName() + " [" + record.layer() + "] " + record.message();
}
