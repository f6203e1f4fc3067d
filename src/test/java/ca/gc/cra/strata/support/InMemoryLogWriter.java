package ca.gc.cra.strata.support;

import ca.gc.cra.strata.application.port.LogWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writer that keeps every batch in memory and can be told to fail.
 */
public final class InMemoryLogWriter implements LogWriter {
  private final List<List<String>> batches = new ArrayList<>();
  private final AtomicInteger closeCount = new AtomicInteger();
  private volatile boolean failing;

  @Override
  public synchronized void write(List<String> batch) throws IOException {
    if (failing) {
      throw new IOException("simulated write failure");
    }
    batches.add(List.copyOf(batch));
  }

  @Override
  public void close() {
    closeCount.incrementAndGet();
  }

  public void failWrites(boolean enabled) {
    this.failing = enabled;
  }

  public synchronized List<List<String>> batches() {
    return List.copyOf(batches);
  }

  public synchronized List<String> lines() {
    List<String> all = new ArrayList<>();
    batches.forEach(all::addAll);
    return all;
  }

  public int closeCount() {
    return closeCount.get();
  }
}
