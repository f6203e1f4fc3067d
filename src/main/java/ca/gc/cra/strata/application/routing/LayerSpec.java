package ca.gc.cra.strata.application.routing;

import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.domain.log.LogLevel;
import java.util.List;
import java.util.Objects;

/**
 * One configured layer: its level threshold and the sinks records are delivered to, in order.
 *
 * @param name layer name
 * @param threshold minimum level routed through this layer
 * @param sinks destination sinks in delivery order; may be empty
 * @since 0.1.0
 */
public record LayerSpec(String name, LogLevel threshold, List<Sink> sinks) {
  /**
   * Validates the name and copies the sink list.
   */
  public LayerSpec {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("layer name must not be blank");
    }
    threshold = Objects.requireNonNullElse(threshold, LogLevel.NOTSET);
    sinks = List.copyOf(Objects.requireNonNullElse(sinks, List.of()));
  }
}
