package ca.gc.cra.strata.application.routing;

import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.domain.log.LogRecord;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves layer names to ordered sink lists and delivers records to them.
 * <p><strong>Fallback chain:</strong> the requested layer, then {@value LayerConfiguration#DEFAULT_LAYER}, then
 * the first layer in insertion order, then no sinks. Resolution never fails.</p>
 * <p><strong>Caching:</strong> resolutions are cached per layer name inside an immutable snapshot; a
 * {@link #reload(LayerConfiguration)} swaps the snapshot, discarding the cache with it, and returns only once
 * every {@link #route(LogRecord)} that started on the previous snapshot has finished.</p>
 * <p><strong>Ordering:</strong> {@link #orderingKey(LogRecord)} names the group of layers a record can reach;
 * layers sharing a sink share a key, so concurrent deliverers can serialize per sink.</p>
 * <p><strong>Failure isolation:</strong> a sink throwing from {@link Sink#accept(LogRecord)} is logged and
 * skipped; sibling sinks still receive the record.</p>
 * <p><strong>Thread-safety:</strong> all operations are safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class LayerRouter {
  private static final Logger log = LoggerFactory.getLogger(LayerRouter.class);
  private static final int MAX_CACHED_LAYERS = 4_096;
  private static final int FAILURE_LOG_THRESHOLD = 1_000;

  private final AtomicReference<Snapshot> snapshot;
  private final ReadWriteLock routeLock = new ReentrantReadWriteLock();
  private final MetricsPort metrics;
  private final AtomicInteger failureLogLimiter = new AtomicInteger();

  /**
   * Creates a router without metrics.
   *
   * @param configuration initial layers
   */
  public LayerRouter(LayerConfiguration configuration) {
    this(configuration, MetricsPort.NO_OP);
  }

  /**
   * Creates a router.
   *
   * @param configuration initial layers
   * @param metrics metrics sink for routing failures
   */
  public LayerRouter(LayerConfiguration configuration, MetricsPort metrics) {
    this.snapshot = new AtomicReference<>(new Snapshot(Objects.requireNonNull(configuration, "configuration")));
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Resolves the sinks for a layer through the fallback chain.
   *
   * @param layerName requested layer; {@code null} is treated as an unconfigured name
   * @return ordered sinks; empty when no layers are configured
   */
  public List<Sink> resolve(String layerName) {
    return snapshot.get().resolve(layerName).sinks();
  }

  /**
   * Returns the layer a name resolves to after fallback.
   *
   * @param layerName requested layer
   * @return resolved layer, or empty when no layers are configured
   */
  public Optional<LayerSpec> resolveLayer(String layerName) {
    return Optional.ofNullable(snapshot.get().resolve(layerName).layer());
  }

  /**
   * Fast-reject check made before a record is built.
   *
   * @param layerName requested layer
   * @param level candidate level
   * @return {@code false} when the resolved layer has no sinks or its threshold exceeds {@code level}
   */
  public boolean isEnabled(String layerName, LogLevel level) {
    Resolution resolution = snapshot.get().resolve(layerName);
    return !resolution.sinks().isEmpty() && level.isAtLeast(resolution.threshold());
  }

  /**
   * Delivers a record to every sink of its resolved layer, in order.
   *
   * @param record record to deliver
   * @return number of sinks that buffered the record
   */
  public int route(LogRecord record) {
    routeLock.readLock().lock();
    try {
      Resolution resolution = snapshot.get().resolve(record.layer());
      if (!record.level().isAtLeast(resolution.threshold())) {
        return 0;
      }
      int delivered = 0;
      for (Sink sink : resolution.sinks()) {
        try {
          if (sink.accept(record)) {
            delivered++;
          }
        } catch (RuntimeException ex) {
          metrics.increment("router.sink.error");
          int count = failureLogLimiter.incrementAndGet();
          if (count == 1 || count % FAILURE_LOG_THRESHOLD == 0) {
            log.warn("Sink {} rejected record for layer {} (failure #{})", sink.name(), record.layer(), count, ex);
          }
        }
      }
      return delivered;
    } finally {
      routeLock.readLock().unlock();
    }
  }

  /**
   * Returns a key shared by every record that can reach the same sink under the active configuration.
   *
   * <p>The key is the first layer, in insertion order, of the group of layers connected through shared
   * sinks. Records resolving to no layer share the empty key.</p>
   *
   * @param record record about to be delivered
   * @return ordering key; never {@code null}
   */
  public String orderingKey(LogRecord record) {
    return snapshot.get().orderingKey(record.layer());
  }

  /**
   * Replaces the active configuration.
   *
   * <p>Blocks until routes running against the previous configuration return, so its sinks can be closed
   * as soon as this method does.</p>
   *
   * @param configuration new layers
   * @return the configuration that was active before the call; its sinks are not closed
   */
  public LayerConfiguration reload(LayerConfiguration configuration) {
    Snapshot next = new Snapshot(Objects.requireNonNull(configuration, "configuration"));
    LayerConfiguration previous;
    routeLock.writeLock().lock();
    try {
      previous = snapshot.getAndSet(next).configuration();
    } finally {
      routeLock.writeLock().unlock();
    }
    log.info("Layer configuration reloaded: {} -> {}", previous, configuration);
    return previous;
  }

  /**
   * Returns the active configuration.
   *
   * @return current layers
   */
  public LayerConfiguration configuration() {
    return snapshot.get().configuration();
  }

  /**
   * Returns every sink of the active configuration, each once.
   *
   * @return distinct sinks
   */
  public List<Sink> sinks() {
    return snapshot.get().configuration().distinctSinks();
  }

  /**
   * Closes every sink of the active configuration. Each sink performs its final flush.
   */
  public void closeSinks() {
    for (Sink sink : sinks()) {
      try {
        sink.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close sink {}", sink.name(), ex);
      }
    }
  }

  private record Resolution(LayerSpec layer) {
    private static final Resolution NONE = new Resolution(null);

    List<Sink> sinks() {
      return layer == null ? List.of() : layer.sinks();
    }

    LogLevel threshold() {
      return layer == null ? LogLevel.NOTSET : layer.threshold();
    }
  }

  private static final class Snapshot {
    private final LayerConfiguration configuration;
    private final Map<String, String> sinkGroups;
    private final ConcurrentMap<String, Resolution> cache = new ConcurrentHashMap<>();

    private Snapshot(LayerConfiguration configuration) {
      this.configuration = configuration;
      this.sinkGroups = groupLayersBySharedSinks(configuration);
    }

    String orderingKey(String layerName) {
      LayerSpec layer = resolve(layerName).layer();
      return layer == null ? "" : sinkGroups.getOrDefault(layer.name(), layer.name());
    }

    LayerConfiguration configuration() {
      return configuration;
    }

    Resolution resolve(String layerName) {
      if (layerName == null) {
        return compute(null);
      }
      Resolution cached = cache.get(layerName);
      if (cached != null) {
        return cached;
      }
      Resolution resolved = compute(layerName);
      if (cache.size() < MAX_CACHED_LAYERS) {
        cache.putIfAbsent(layerName, resolved);
      }
      return resolved;
    }

    private Resolution compute(String layerName) {
      return configuration.find(layerName)
          .or(() -> configuration.find(LayerConfiguration.DEFAULT_LAYER))
          .or(configuration::first)
          .map(Resolution::new)
          .orElse(Resolution.NONE);
    }

    // Union-find over layers; the root is always the earliest layer of its group.
    private static Map<String, String> groupLayersBySharedSinks(LayerConfiguration configuration) {
      Map<String, String> parent = new HashMap<>();
      Map<String, Integer> position = new HashMap<>();
      Map<Sink, String> owner = new IdentityHashMap<>();
      for (LayerSpec layer : configuration.layers()) {
        parent.putIfAbsent(layer.name(), layer.name());
        position.putIfAbsent(layer.name(), position.size());
        for (Sink sink : layer.sinks()) {
          String previous = owner.putIfAbsent(sink, layer.name());
          if (previous == null) {
            continue;
          }
          String a = root(parent, previous);
          String b = root(parent, layer.name());
          if (position.get(a) < position.get(b)) {
            parent.put(b, a);
          } else if (position.get(b) < position.get(a)) {
            parent.put(a, b);
          }
        }
      }
      Map<String, String> groups = new HashMap<>();
      for (String name : parent.keySet()) {
        groups.put(name, root(parent, name));
      }
      return Map.copyOf(groups);
    }

    private static String root(Map<String, String> parent, String name) {
      String current = name;
      while (!parent.get(current).equals(current)) {
        current = parent.get(current);
      }
      return current;
    }
  }
}
