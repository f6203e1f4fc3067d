package ca.gc.cra.strata.infrastructure.writer;

import ca.gc.cra.strata.application.port.LogWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Writes batches to a {@link PrintStream}, normally standard output or standard error.
 *
 * <p>The stream is flushed after each batch and never closed, since the JVM owns it.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleLogWriter implements LogWriter {
  private final PrintStream out;

  /**
   * Creates a writer for a stream.
   *
   * @param out destination stream
   */
  public ConsoleLogWriter(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public static ConsoleLogWriter stdout() {
    return new ConsoleLogWriter(System.out);
  }

  public static ConsoleLogWriter stderr() {
    return new ConsoleLogWriter(System.err);
  }

  @Override
  public void write(List<String> batch) throws IOException {
    StringBuilder payload = new StringBuilder();
    for (String line : batch) {
      payload.append(line).append(System.lineSeparator());
    }
    out.print(payload);
    out.flush();
    if (out.checkError()) {
      throw new IOException("Console stream reported an error");
    }
  }

  @Override
  public void close() {
    out.flush();
  }
}
