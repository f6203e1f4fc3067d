package ca.gc.cra.strata.infrastructure.backup;

import ca.gc.cra.strata.application.port.BackupPort;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackupPort} storing each undeliverable batch as one JSON file.
 *
 * <p>Files are named {@code <source>_<epochMillis>_<sequence>.json} with fixed-width numbers, so lexical
 * order is backup order. Each file is written to a temporary name and then moved into place, so a crash
 * never leaves a half-written batch visible to {@link #restore(String)}. Restored files are deleted;
 * unreadable files are renamed with a {@code .corrupt} suffix and skipped.</p>
 *
 * <p>Document shape: {@code {"source":"...","createdAt":123,"lines":["...", ...]}}.</p>
 *
 * @since 0.1.0
 */
public final class FileBackupAdapter implements BackupPort {
  private static final Logger log = LoggerFactory.getLogger(FileBackupAdapter.class);
  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

  private final Path directory;
  private final JsonFactory factory = new JsonFactory();
  private final AtomicLong sequence = new AtomicLong();
  private final LongAdder backedUp = new LongAdder();
  private final LongAdder restored = new LongAdder();
  private final LongAdder failures = new LongAdder();

  /**
   * Creates an adapter rooted at {@code directory}; the directory is created on first backup.
   *
   * @param directory backup directory
   */
  public FileBackupAdapter(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
  }

  @Override
  public void backup(String source, List<String> batch) throws IOException {
    Objects.requireNonNull(batch, "batch");
    String safeSource = safe(source);
    try {
      Files.createDirectories(directory);
      String fileName = String.format("%s_%013d_%010d.json",
          safeSource, System.currentTimeMillis(), sequence.getAndIncrement());
      Path target = directory.resolve(fileName);
      Path temp = Files.createTempFile(directory, safeSource + "_", ".tmp");
      try {
        try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
            JsonGenerator json = factory.createGenerator(out)) {
          json.writeStartObject();
          json.writeStringField("source", source);
          json.writeNumberField("createdAt", System.currentTimeMillis());
          json.writeArrayFieldStart("lines");
          for (String line : batch) {
            json.writeString(line);
          }
          json.writeEndArray();
          json.writeEndObject();
        }
        move(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
      backedUp.increment();
      log.debug("Backed up {} lines from {} to {}", batch.size(), source, target);
    } catch (IOException ex) {
      failures.increment();
      throw ex;
    }
  }

  @Override
  public List<List<String>> restore(String source) throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    Pattern pattern = Pattern.compile(Pattern.quote(safe(source)) + "_\\d{13}_\\d{10}\\.json");
    List<Path> files;
    try (Stream<Path> listing = Files.list(directory)) {
      files = listing
          .filter(path -> pattern.matcher(path.getFileName().toString()).matches())
          .sorted()
          .toList();
    }
    List<List<String>> batches = new ArrayList<>(files.size());
    for (Path file : files) {
      try {
        batches.add(read(file));
        Files.delete(file);
        restored.increment();
      } catch (IOException | IllegalArgumentException ex) {
        failures.increment();
        log.warn("Skipping unreadable backup file {}", file, ex);
        Files.move(file, file.resolveSibling(file.getFileName() + ".corrupt"), StandardCopyOption.REPLACE_EXISTING);
      }
    }
    return List.copyOf(batches);
  }

  /**
   * Returns the backup directory.
   *
   * @return absolute directory
   */
  public Path directory() {
    return directory;
  }

  public long backedUpBatches() {
    return backedUp.sum();
  }

  public long restoredBatches() {
    return restored.sum();
  }

  public long failures() {
    return failures.sum();
  }

  private List<String> read(Path file) throws IOException {
    List<String> lines = new ArrayList<>();
    try (JsonParser parser = factory.createParser(file.toFile())) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Backup file is not a JSON object");
      }
      boolean sawLines = false;
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("lines".equals(field)) {
          if (value != JsonToken.START_ARRAY) {
            throw new IllegalArgumentException("Backup 'lines' must be an array");
          }
          while (parser.nextToken() == JsonToken.VALUE_STRING) {
            lines.add(parser.getText());
          }
          if (parser.currentToken() != JsonToken.END_ARRAY) {
            throw new IllegalArgumentException("Backup 'lines' must contain only strings");
          }
          sawLines = true;
        } else {
          parser.skipChildren();
        }
      }
      if (!sawLines) {
        throw new IllegalArgumentException("Backup file has no 'lines' array");
      }
    }
    return List.copyOf(lines);
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String safe(String source) {
    String raw = (source == null || source.isBlank()) ? "unknown" : source.trim();
    return UNSAFE_CHARS.matcher(raw).replaceAll("_");
  }
}
