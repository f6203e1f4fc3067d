package ca.gc.cra.strata.config;

import ca.gc.cra.strata.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Derives {@link LoggingSettings} from environment variables.
 *
 * <p>A pure function of its input map: it reads nothing else and is meant to be evaluated once at startup
 * with {@code System.getenv()}.</p>
 * <ul>
 *   <li>{@code STRATA_ENV}: {@code production} (async; console at WARNING plus JSON file {@code logs/app.log}),
 *       {@code development} (sync; console at DEBUG), {@code test} (sync; output discarded);
 *       anything else yields {@link LoggingSettings#defaults()}.</li>
 *   <li>{@code STRATA_LEVEL}: threshold for the {@code default} layer.</li>
 *   <li>{@code STRATA_LOG_DIR}: directory for file destinations.</li>
 * </ul>
 */
public final class EnvironmentProfiles {
  public static final String ENV_PROFILE = "STRATA_ENV";
  public static final String ENV_LEVEL = "STRATA_LEVEL";
  public static final String ENV_LOG_DIR = "STRATA_LOG_DIR";

  private static final String DEFAULT_LAYER = "default";
  private static final Path DEFAULT_LOG_FILE = Path.of("logs", "app.log");

  private EnvironmentProfiles() {}

  /**
   * Builds settings for the given environment.
   *
   * @param env environment variables
   * @return settings for the selected profile with overrides applied
   * @throws IllegalArgumentException when {@code STRATA_LEVEL} is not a level name
   */
  public static LoggingSettings fromEnvironment(Map<String, String> env) {
    Objects.requireNonNull(env, "env");
    String profile = value(env, ENV_PROFILE);
    LoggingSettings settings = switch (profile == null ? "" : profile.toLowerCase(Locale.ROOT)) {
      case "production", "prod" -> production();
      case "development", "dev" -> development();
      case "test" -> test();
      default -> LoggingSettings.defaults();
    };

    String level = value(env, ENV_LEVEL);
    if (level != null) {
      LogLevel override = LogLevel.fromName(level);
      settings = settings.withLayers(settings.layers().stream()
          .map(layer -> layer.name().equals(DEFAULT_LAYER) ? layer.withLevel(override) : layer)
          .toList());
    }

    String logDir = value(env, ENV_LOG_DIR);
    if (logDir != null) {
      Path directory = Path.of(logDir);
      settings = settings.withLayers(settings.layers().stream()
          .map(layer -> new LayerSettings(layer.name(), layer.level(), layer.enabled(),
              layer.destinations().stream().map(d -> d.relocatedTo(directory)).toList()))
          .toList());
    }
    return settings;
  }

  private static LoggingSettings production() {
    LayerSettings layer = new LayerSettings(DEFAULT_LAYER, LogLevel.INFO, true, List.of(
        new DestinationSettings(DestinationSettings.CONSOLE, DestinationSettings.PLAIN, null, LogLevel.WARNING, null),
        DestinationSettings.file(DEFAULT_LOG_FILE, DestinationSettings.JSON, LogLevel.INFO)));
    return LoggingSettings.defaults()
        .withMode(LoggingSettings.Mode.ASYNC)
        .withLayers(List.of(layer));
  }

  private static LoggingSettings development() {
    LayerSettings layer = new LayerSettings(DEFAULT_LAYER, LogLevel.DEBUG, true,
        List.of(DestinationSettings.console(DestinationSettings.PLAIN)));
    return LoggingSettings.defaults().withLayers(List.of(layer));
  }

  private static LoggingSettings test() {
    LayerSettings layer = new LayerSettings(DEFAULT_LAYER, LogLevel.DEBUG, true, List.of(DestinationSettings.discard()));
    return LoggingSettings.defaults().withLayers(List.of(layer));
  }

  private static String value(Map<String, String> env, String key) {
    String raw = env.get(key);
    return raw == null || raw.isBlank() ? null : raw.trim();
  }
}
