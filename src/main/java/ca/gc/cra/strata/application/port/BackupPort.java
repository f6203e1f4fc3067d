package ca.gc.cra.strata.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Data-loss protection port persisting batches that could not be delivered.
 * <p><strong>Why:</strong> Sink write failures and forced-shutdown drops would otherwise lose records silently.</p>
 * <p><strong>Role:</strong> Invoked only off the happy path: after a failed {@link LogWriter#write(List)} or for
 * records still queued when a drain deadline expires.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from several sinks.</p>
 *
 * @since 0.1.0
 */
public interface BackupPort {
  /**
   * Persists an undeliverable batch.
   *
   * @param source logical origin of the batch (sink or dispatcher name); used to group batches for replay
   * @param batch formatted lines in original order
   * @throws IOException when the batch cannot be persisted
   */
  void backup(String source, List<String> batch) throws IOException;

  /**
   * Returns and removes every batch previously backed up for {@code source}, oldest first.
   *
   * @param source logical origin passed to {@link #backup(String, List)}
   * @return batches in backup order; empty when none exist
   * @throws IOException when stored batches cannot be read
   */
  List<List<String>> restore(String source) throws IOException;

  /** Backup port that discards every batch. */
  BackupPort NONE = new BackupPort() {
    @Override
    public void backup(String source, List<String> batch) {}

    @Override
    public List<List<String>> restore(String source) {
      return List.of();
    }
  };
}
