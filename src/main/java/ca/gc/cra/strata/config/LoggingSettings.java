package ca.gc.cra.strata.config;

import ca.gc.cra.strata.domain.log.LogLevel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated configuration for one logger, produced by {@link LoggingConfigLoader} or
 * {@link EnvironmentProfiles} and consumed by {@link CompositionRoot}.
 *
 * @param mode synchronous or asynchronous delivery
 * @param defaultLevel threshold for layers that do not set one
 * @param verbose raise STRATA's own diagnostics to DEBUG
 * @param captureCaller fill caller context by walking the stack
 * @param flushInterval period of the timed sink flush
 * @param metrics {@code none} or {@code otel}
 * @param backupDirectory directory for undeliverable batches; {@code null} disables backup
 * @param async dispatcher settings; used in async mode
 * @param layers layers in insertion order
 * @since 0.1.0
 */
public record LoggingSettings(
    Mode mode,
    LogLevel defaultLevel,
    boolean verbose,
    boolean captureCaller,
    Duration flushInterval,
    String metrics,
    Path backupDirectory,
    AsyncSettings async,
    List<LayerSettings> layers) {

  public static final String METRICS_NONE = "none";
  public static final String METRICS_OTEL = "otel";

  /** Delivery mode. */
  public enum Mode {
    SYNC,
    ASYNC
  }

  /**
   * Defaults missing values and copies the layer list.
   */
  public LoggingSettings {
    mode = Objects.requireNonNullElse(mode, Mode.SYNC);
    defaultLevel = Objects.requireNonNullElse(defaultLevel, LogLevel.INFO);
    flushInterval = Objects.requireNonNullElse(flushInterval, Duration.ofMillis(250));
    metrics = Objects.requireNonNullElse(metrics, METRICS_NONE);
    async = Objects.requireNonNullElse(async, AsyncSettings.defaults());
    layers = List.copyOf(Objects.requireNonNullElse(layers, List.of()));
  }

  /**
   * Synchronous logging at INFO to a single plain console destination on the {@code default} layer.
   *
   * @return default settings
   */
  public static LoggingSettings defaults() {
    LayerSettings layer = new LayerSettings(
        "default", LogLevel.INFO, true, List.of(DestinationSettings.console(DestinationSettings.PLAIN)));
    return new LoggingSettings(
        Mode.SYNC, LogLevel.INFO, false, false, null, METRICS_NONE, null, AsyncSettings.defaults(), List.of(layer));
  }

  /**
   * Finds a layer by name.
   *
   * @param name layer name
   * @return layer settings, if configured
   */
  public Optional<LayerSettings> layer(String name) {
    return layers.stream().filter(layer -> layer.name().equals(name)).findFirst();
  }

  public LoggingSettings withMode(Mode replacement) {
    return new LoggingSettings(
        replacement, defaultLevel, verbose, captureCaller, flushInterval, metrics, backupDirectory, async, layers);
  }

  public LoggingSettings withLayers(List<LayerSettings> replacement) {
    return new LoggingSettings(
        mode, defaultLevel, verbose, captureCaller, flushInterval, metrics, backupDirectory, async, replacement);
  }

  public LoggingSettings withBackupDirectory(Path replacement) {
    return new LoggingSettings(
        mode, defaultLevel, verbose, captureCaller, flushInterval, metrics, replacement, async, layers);
  }

  public LoggingSettings withAsync(AsyncSettings replacement) {
    return new LoggingSettings(
        mode, defaultLevel, verbose, captureCaller, flushInterval, metrics, backupDirectory, replacement, layers);
  }
}
