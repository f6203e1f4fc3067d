package ca.gc.cra.strata.application.routing;

import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.domain.log.LogLevel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, insertion-ordered mapping from layer names to {@link LayerSpec}s.
 *
 * <p>A configuration is never mutated after {@link Builder#build()}; reloading replaces it wholesale
 * through {@link LayerRouter#reload(LayerConfiguration)}.</p>
 *
 * @since 0.1.0
 */
public final class LayerConfiguration {
  /** Name of the layer used when a requested layer is not configured. */
  public static final String DEFAULT_LAYER = "default";

  private static final LayerConfiguration EMPTY = new LayerConfiguration(Map.of());

  private final Map<String, LayerSpec> layers;

  private LayerConfiguration(Map<String, LayerSpec> layers) {
    this.layers = layers;
  }

  /**
   * Returns a configuration with no layers; every resolution yields no sinks.
   *
   * @return empty configuration
   */
  public static LayerConfiguration empty() {
    return EMPTY;
  }

  /**
   * Starts a new configuration.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Looks up a layer by exact name.
   *
   * @param name layer name
   * @return configured layer, if any
   */
  public Optional<LayerSpec> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(layers.get(name));
  }

  /**
   * Returns the first layer in insertion order.
   *
   * @return first layer, or empty when no layers exist
   */
  public Optional<LayerSpec> first() {
    return layers.values().stream().findFirst();
  }

  /**
   * Returns all layers in insertion order.
   *
   * @return unmodifiable layer list
   */
  public List<LayerSpec> layers() {
    return List.copyOf(layers.values());
  }

  /**
   * Returns the configured layer names in insertion order.
   *
   * @return unmodifiable name list
   */
  public List<String> layerNames() {
    return List.copyOf(layers.keySet());
  }

  /**
   * Whether no layers are configured.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return layers.isEmpty();
  }

  /**
   * Returns every sink referenced by any layer, each once, in first-seen order.
   *
   * @return distinct sinks by identity
   */
  public List<Sink> distinctSinks() {
    Set<Sink> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<Sink> result = new ArrayList<>();
    for (LayerSpec layer : layers.values()) {
      for (Sink sink : layer.sinks()) {
        if (seen.add(sink)) {
          result.add(sink);
        }
      }
    }
    return List.copyOf(result);
  }

  @Override
  public String toString() {
    return "LayerConfiguration" + layers.keySet();
  }

  /** Collects layers in insertion order. */
  public static final class Builder {
    private final Map<String, LayerSpec> layers = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Adds or replaces a layer.
     *
     * @param spec layer to add
     * @return this builder
     */
    public Builder layer(LayerSpec spec) {
      layers.put(spec.name(), spec);
      return this;
    }

    /**
     * Adds or replaces a layer.
     *
     * @param name layer name
     * @param threshold minimum routed level
     * @param sinks destination sinks in order
     * @return this builder
     */
    public Builder layer(String name, LogLevel threshold, List<Sink> sinks) {
      return layer(new LayerSpec(name, threshold, sinks));
    }

    /**
     * Freezes the collected layers.
     *
     * @return immutable configuration
     */
    public LayerConfiguration build() {
      if (layers.isEmpty()) {
        return EMPTY;
      }
      return new LayerConfiguration(Collections.unmodifiableMap(new LinkedHashMap<>(layers)));
    }
  }
}
