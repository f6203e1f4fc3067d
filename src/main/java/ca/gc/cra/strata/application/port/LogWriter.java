package ca.gc.cra.strata.application.port;

import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Port persisting batches of formatted lines to one destination.
 * <p><strong>Role:</strong> Exclusive resource of a single sink; no two sinks share a writer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist each batch in order, or fail the whole call with an {@link IOException}.</li>
 *   <li>Release the underlying handle on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called by its owning sink under the sink lock; implementations need no
 * synchronization of their own.</p>
 * <p><strong>Retry:</strong> The engine never retries a failed batch; it is handed to the backup port instead.</p>
 *
 * @since 0.1.0
 */
public interface LogWriter extends AutoCloseable {
  /**
   * Writes an ordered batch of already formatted lines.
   *
   * @param batch lines in submission order; never {@code null} or empty
   * @throws IOException when the destination rejects the batch
   */
  void write(List<String> batch) throws IOException;

  /**
   * Releases the destination handle.
   *
   * @throws IOException when the handle cannot be closed cleanly
   */
  @Override
  void close() throws IOException;
}
