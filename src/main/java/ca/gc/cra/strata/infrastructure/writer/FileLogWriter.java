package ca.gc.cra.strata.infrastructure.writer;

import ca.gc.cra.strata.application.port.LogWriter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends batches to a UTF-8 file, one line per record.
 *
 * <p>The file and its parent directories are created lazily on the first batch so a writer built for an
 * unused layer leaves no file behind. Each batch ends with a flush of the underlying stream.</p>
 *
 * @since 0.1.0
 */
public final class FileLogWriter implements LogWriter {
  private static final Logger log = LoggerFactory.getLogger(FileLogWriter.class);

  private final Path path;
  private BufferedWriter writer;
  private boolean closed;

  /**
   * Creates a writer for a file path.
   *
   * @param path target file; parent directories are created on demand
   */
  public FileLogWriter(Path path) {
    this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
  }

  /**
   * Returns the target file.
   *
   * @return absolute path
   */
  public Path path() {
    return path;
  }

  @Override
  public void write(List<String> batch) throws IOException {
    if (closed) {
      throw new IOException("File writer for " + path + " is closed");
    }
    BufferedWriter out = open();
    for (String line : batch) {
      out.write(line);
      out.newLine();
    }
    out.flush();
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (writer != null) {
      try {
        writer.close();
      } finally {
        writer = null;
        log.debug("Closed log file {}", path);
      }
    }
  }

  private BufferedWriter open() throws IOException {
    if (writer == null) {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      writer = Files.newBufferedWriter(
          path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
      log.debug("Opened log file {}", path);
    }
    return writer;
  }
}
