package ca.gc.cra.strata.infrastructure.writer;

import ca.gc.cra.strata.application.port.LogWriter;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

/**
 * Discards every batch while counting the lines it was given.
 *
 * @since 0.1.0
 */
public final class NullLogWriter implements LogWriter {
  private final LongAdder lines = new LongAdder();

  @Override
  public void write(List<String> batch) {
    lines.add(batch.size());
  }

  /**
   * Returns how many lines were discarded.
   *
   * @return discarded line count
   */
  public long discardedLines() {
    return lines.sum();
  }

  @Override
  public void close() {}
}
