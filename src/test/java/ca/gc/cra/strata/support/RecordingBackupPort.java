package ca.gc.cra.strata.support;

import ca.gc.cra.strata.application.port.BackupPort;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Backup double remembering each batch by source.
 */
public final class RecordingBackupPort implements BackupPort {
  private final List<String> sources = new ArrayList<>();
  private final List<List<String>> batches = new ArrayList<>();
  private volatile boolean failing;

  @Override
  public synchronized void backup(String source, List<String> batch) throws IOException {
    if (failing) {
      throw new IOException("simulated backup failure");
    }
    sources.add(source);
    batches.add(List.copyOf(batch));
  }

  @Override
  public synchronized List<List<String>> restore(String source) {
    List<List<String>> matching = new ArrayList<>();
    for (int i = 0; i < sources.size(); i++) {
      if (sources.get(i).equals(source)) {
        matching.add(batches.get(i));
      }
    }
    return matching;
  }

  public void failBackups(boolean enabled) {
    this.failing = enabled;
  }

  public synchronized List<String> sources() {
    return List.copyOf(sources);
  }

  public synchronized List<List<String>> batches() {
    return List.copyOf(batches);
  }
}
