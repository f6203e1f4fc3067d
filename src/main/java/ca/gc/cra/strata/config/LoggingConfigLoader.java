package ca.gc.cra.strata.config;

import ca.gc.cra.strata.application.dispatch.DispatcherSettings;
import ca.gc.cra.strata.application.sink.SinkSettings;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.validation.Numbers;
import ca.gc.cra.strata.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link LoggingSettings} from the {@code strata} section of a YAML document.
 *
 * <p>Every value is validated here; a configuration that loads is safe to hand to the
 * {@link CompositionRoot}. Problems are reported as {@link IllegalArgumentException}s naming the key.</p>
 */
public final class LoggingConfigLoader {
  private static final String ROOT = "strata";
  private static final long MAX_BUFFER_SIZE = 10_000_000L;
  private static final long MAX_MILLIS = Duration.ofHours(1).toMillis();

  private LoggingConfigLoader() {}

  /**
   * Loads settings from {@code path}.
   *
   * @param path YAML file
   * @return settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or a value is invalid
   */
  public static Optional<LoggingSettings> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses settings from YAML text.
   *
   * @param yaml YAML document
   * @return settings
   * @throws IllegalArgumentException when the YAML is malformed or a value is invalid
   */
  public static LoggingSettings parse(String yaml) {
    return parse(new StringReader(Objects.requireNonNull(yaml, "yaml")), "<inline>");
  }

  static LoggingSettings parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return LoggingSettings.defaults();
    }
    Map<String, Object> root = asMap(document, "root");
    Object section = root.get(ROOT);
    if (section == null) {
      return LoggingSettings.defaults();
    }
    return toSettings(asMap(section, ROOT));
  }

  private static LoggingSettings toSettings(Map<String, Object> node) {
    String modeName = Strings.requireOneOf(ROOT + ".mode", string(node, "mode", "sync"), Set.of("sync", "async"));
    LogLevel defaultLevel = level(node, "defaultLevel", ROOT + ".defaultLevel", LogLevel.INFO);
    boolean verbose = bool(node, "verbose", false);
    boolean captureCaller = bool(node, "captureCaller", false);
    Duration flushInterval = Duration.ofMillis(
        Numbers.requireRange(ROOT + ".flushIntervalMillis", number(node, "flushIntervalMillis", 250), 1, MAX_MILLIS));
    String metrics = Strings.requireOneOf(ROOT + ".metrics", string(node, "metrics", LoggingSettings.METRICS_NONE),
        Set.of(LoggingSettings.METRICS_NONE, LoggingSettings.METRICS_OTEL));
    String backup = string(node, "backupDirectory", null);
    Path backupDirectory = backup == null ? null : Path.of(Strings.requireNonBlank(ROOT + ".backupDirectory", backup));

    AsyncSettings async = node.containsKey("async")
        ? toAsync(asMap(node.get("async"), ROOT + ".async"))
        : AsyncSettings.defaults();

    List<LayerSettings> layers;
    if (node.containsKey("layers")) {
      layers = toLayers(asMap(node.get("layers"), ROOT + ".layers"), defaultLevel);
    } else {
      layers = LoggingSettings.defaults().layers().stream().map(l -> l.withLevel(defaultLevel)).toList();
    }

    return new LoggingSettings(
        LoggingSettings.Mode.valueOf(modeName.toUpperCase(Locale.ROOT)),
        defaultLevel,
        verbose,
        captureCaller,
        flushInterval,
        metrics,
        backupDirectory,
        async,
        layers);
  }

  private static AsyncSettings toAsync(Map<String, Object> node) {
    String prefix = ROOT + ".async.";
    long primary = Numbers.requireRange(prefix + "primaryCapacity",
        number(node, "primaryCapacity", DispatcherSettings.UNBOUNDED), 1, Integer.MAX_VALUE);
    long overflow = Numbers.requireRange(prefix + "overflowCapacity",
        number(node, "overflowCapacity", 100_000), 1, Integer.MAX_VALUE);
    String policy = Strings.requireOneOf(prefix + "concurrency",
        string(node, "concurrency", AsyncSettings.FIXED), AsyncSettings.POLICIES);
    long workers = Numbers.requireRange(prefix + "workers", number(node, "workers", 2), 1, 256);
    long permits = Numbers.requireRange(prefix + "permits", number(node, "permits", 100), 1, 100_000);
    long grace = Numbers.requireRange(prefix + "drainGraceMillis", number(node, "drainGraceMillis", 5_000), 0, MAX_MILLIS);
    return new AsyncSettings((int) primary, (int) overflow, policy, (int) workers, (int) permits, Duration.ofMillis(grace));
  }

  private static List<LayerSettings> toLayers(Map<String, Object> node, LogLevel defaultLevel) {
    List<LayerSettings> layers = new ArrayList<>(node.size());
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      String name = Strings.requireNonBlank(ROOT + ".layers", entry.getKey());
      String prefix = ROOT + ".layers." + name;
      Map<String, Object> layer = entry.getValue() == null ? Map.of() : asMap(entry.getValue(), prefix);
      LogLevel level = level(layer, "level", prefix + ".level", defaultLevel);
      boolean enabled = bool(layer, "enabled", true);
      List<DestinationSettings> destinations = new ArrayList<>();
      Object rawDestinations = layer.get("destinations");
      if (rawDestinations != null) {
        if (!(rawDestinations instanceof List<?> list)) {
          throw new IllegalArgumentException(prefix + ".destinations must be a list");
        }
        for (int i = 0; i < list.size(); i++) {
          String itemPrefix = prefix + ".destinations[" + i + "]";
          destinations.add(toDestination(asMap(list.get(i), itemPrefix), itemPrefix));
        }
      }
      layers.add(new LayerSettings(name, level, enabled, destinations));
    }
    return layers;
  }

  private static DestinationSettings toDestination(Map<String, Object> node, String prefix) {
    // YAML reads an unquoted "null" as a missing value
    String rawType = node.containsKey("type") && node.get("type") == null
        ? DestinationSettings.NULL
        : string(node, "type", "");
    String type = Strings.requireOneOf(prefix + ".type", rawType, DestinationSettings.TYPES);
    String format = Strings.requireOneOf(prefix + ".format",
        string(node, "format", DestinationSettings.PLAIN), DestinationSettings.FORMATS);
    String rawPath = string(node, "path", null);
    if (DestinationSettings.FILE.equals(type) && (rawPath == null || rawPath.isBlank())) {
      throw new IllegalArgumentException(prefix + ".path is required for file destinations");
    }
    Path path = rawPath == null ? null : Path.of(rawPath.trim());
    LogLevel level = level(node, "level", prefix + ".level", LogLevel.NOTSET);
    SinkSettings defaults = DestinationSettings.defaultSinkSettings(type);
    long size = Numbers.requireRange(prefix + ".bufferSize",
        number(node, "bufferSize", defaults.maxBufferSize()), 1, MAX_BUFFER_SIZE);
    long age = Numbers.requireRange(prefix + ".flushAgeMillis",
        number(node, "flushAgeMillis", defaults.maxBufferAge().toMillis()), 0, MAX_MILLIS);
    return new DestinationSettings(type, format, path, level, new SinkSettings((int) size, Duration.ofMillis(age)));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String string(Map<String, Object> node, String key, String fallback) {
    Object value = node.get(key);
    return value == null ? fallback : value.toString();
  }

  private static long number(Map<String, Object> node, String key, long fallback) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }

  private static boolean bool(Map<String, Object> node, String key, boolean fallback) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was " + value + ")");
    };
  }

  private static LogLevel level(Map<String, Object> node, String key, String label, LogLevel fallback) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return LogLevel.fromValue(number.intValue());
    }
    try {
      return LogLevel.fromName(value.toString());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(label + ": " + ex.getMessage(), ex);
    }
  }
}
