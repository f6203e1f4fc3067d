package ca.gc.cra.strata.config;

import ca.gc.cra.strata.application.sink.SinkSettings;
import ca.gc.cra.strata.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * One destination of a layer, turned into one sink by the {@link CompositionRoot}.
 *
 * @param type {@code console}, {@code stderr}, {@code file} or {@code null}
 * @param format {@code plain} or {@code json}
 * @param path file path; required for {@code file}, ignored otherwise
 * @param level sink threshold; {@link LogLevel#NOTSET} accepts everything the layer passes
 * @param sink buffer tuning
 * @since 0.1.0
 */
public record DestinationSettings(String type, String format, Path path, LogLevel level, SinkSettings sink) {
  public static final String CONSOLE = "console";
  public static final String STDERR = "stderr";
  public static final String FILE = "file";
  public static final String NULL = "null";
  public static final Set<String> TYPES = Set.of(CONSOLE, STDERR, FILE, NULL);

  public static final String PLAIN = "plain";
  public static final String JSON = "json";
  public static final Set<String> FORMATS = Set.of(PLAIN, JSON);

  /**
   * Requires a known type and format, and a path for file destinations.
   */
  public DestinationSettings {
    Objects.requireNonNull(type, "type");
    if (!TYPES.contains(type)) {
      throw new IllegalArgumentException("Unknown destination type: " + type);
    }
    format = Objects.requireNonNullElse(format, PLAIN);
    if (!FORMATS.contains(format)) {
      throw new IllegalArgumentException("Unknown destination format: " + format);
    }
    if (FILE.equals(type) && path == null) {
      throw new IllegalArgumentException("file destination requires a path");
    }
    level = Objects.requireNonNullElse(level, LogLevel.NOTSET);
    sink = Objects.requireNonNullElse(sink, defaultSinkSettings(type));
  }

  /**
   * Returns the buffer tuning used when a destination does not set one.
   *
   * @param type destination type
   * @return file tuning for files, console tuning otherwise
   */
  public static SinkSettings defaultSinkSettings(String type) {
    return FILE.equals(type) ? SinkSettings.file() : SinkSettings.console();
  }

  public static DestinationSettings console(String format) {
    return new DestinationSettings(CONSOLE, format, null, LogLevel.NOTSET, null);
  }

  public static DestinationSettings file(Path path, String format, LogLevel level) {
    return new DestinationSettings(FILE, format, path, level, null);
  }

  public static DestinationSettings discard() {
    return new DestinationSettings(NULL, PLAIN, null, LogLevel.NOTSET, null);
  }

  /**
   * Copy with its file relocated into {@code directory}, keeping the file name.
   *
   * @param directory new parent directory
   * @return relocated copy, or this instance when not a file destination
   */
  public DestinationSettings relocatedTo(Path directory) {
    if (!FILE.equals(type)) {
      return this;
    }
    return new DestinationSettings(type, format, directory.resolve(path.getFileName()), level, sink);
  }
}
