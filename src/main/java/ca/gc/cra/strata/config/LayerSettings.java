package ca.gc.cra.strata.config;

import ca.gc.cra.strata.domain.log.LogLevel;
import java.util.List;
import java.util.Objects;

/**
 * Configured layer before it is turned into sinks.
 *
 * @param name layer name
 * @param level layer threshold
 * @param enabled disabled layers are left out of the routing configuration entirely
 * @param destinations destinations in delivery order
 * @since 0.1.0
 */
public record LayerSettings(String name, LogLevel level, boolean enabled, List<DestinationSettings> destinations) {
  /**
   * Requires a name and copies the destination list.
   */
  public LayerSettings {
    Objects.requireNonNull(name, "name");
    level = Objects.requireNonNullElse(level, LogLevel.INFO);
    destinations = List.copyOf(Objects.requireNonNullElse(destinations, List.of()));
  }

  /**
   * Copy with a different threshold.
   *
   * @param replacement new threshold
   * @return new settings
   */
  public LayerSettings withLevel(LogLevel replacement) {
    return new LayerSettings(name, replacement, enabled, destinations);
  }
}
