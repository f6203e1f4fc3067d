package ca.gc.cra.strata.config;

import ca.gc.cra.strata.application.dispatch.AsyncDispatcher;
import ca.gc.cra.strata.application.dispatch.DispatcherSettings;
import ca.gc.cra.strata.application.logger.AbstractLayeredLogger;
import ca.gc.cra.strata.application.logger.AsyncLayeredLogger;
import ca.gc.cra.strata.application.logger.CompositeLayeredLogger;
import ca.gc.cra.strata.application.logger.LayeredLogger;
import ca.gc.cra.strata.application.logger.LoggerOptions;
import ca.gc.cra.strata.application.logger.LoggerRegistry;
import ca.gc.cra.strata.application.logger.SyncLayeredLogger;
import ca.gc.cra.strata.application.port.BackupPort;
import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.ConcurrencyPolicy;
import ca.gc.cra.strata.application.port.LogFormatter;
import ca.gc.cra.strata.application.port.LogWriter;
import ca.gc.cra.strata.application.port.MetricsPort;
import ca.gc.cra.strata.application.port.RedactionHook;
import ca.gc.cra.strata.application.routing.LayerConfiguration;
import ca.gc.cra.strata.application.routing.LayerRouter;
import ca.gc.cra.strata.application.sink.Sink;
import ca.gc.cra.strata.application.sink.SinkFlushScheduler;
import ca.gc.cra.strata.infrastructure.backup.FileBackupAdapter;
import ca.gc.cra.strata.infrastructure.concurrency.MemoryAwareConcurrencyPolicy;
import ca.gc.cra.strata.infrastructure.format.JsonLinesFormatter;
import ca.gc.cra.strata.infrastructure.format.PlainTextFormatter;
import ca.gc.cra.strata.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.strata.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.strata.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.strata.infrastructure.writer.ConsoleLogWriter;
import ca.gc.cra.strata.infrastructure.writer.FileLogWriter;
import ca.gc.cra.strata.infrastructure.writer.NullLogWriter;
import ca.gc.cra.strata.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns {@link LoggingSettings} into live loggers.
 * <p><strong>Role:</strong> The one place where formatters, writers, sinks, routers, dispatchers and
 * loggers are wired together. Applications create one root at startup and close it at shutdown.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build one sink per destination, grouped into a {@link LayerConfiguration}.</li>
 *   <li>Build synchronous or asynchronous loggers, initialized and ready for use.</li>
 *   <li>Own a {@link LoggerRegistry} giving get-or-create access by name.</li>
 *   <li>Swap a logger's layers on reload and close the sinks they replaced.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods may be called concurrently; {@link #logger(String)} creates
 * each name once.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final LoggingSettings settings;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final LoggerRegistry registry = new LoggerRegistry();
  private final OpenTelemetryMetricsAdapter ownedMetrics;

  /**
   * Creates a root using the metrics exporter named in {@code settings} and the system clock.
   *
   * @param settings default settings for {@link #logger(String)}
   */
  public CompositionRoot(LoggingSettings settings) {
    this(settings, createMetrics(settings), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit collaborators.
   *
   * @param settings default settings for {@link #logger(String)}
   * @param metrics metrics port shared by every component
   * @param clock time source shared by every component
   */
  public CompositionRoot(LoggingSettings settings, MetricsPort metrics, ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ownedMetrics = metrics instanceof OpenTelemetryMetricsAdapter otel ? otel : null;
    if (settings.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Creates a root from {@code STRATA_*} environment variables.
   *
   * @return new root
   */
  public static CompositionRoot fromEnvironment() {
    return new CompositionRoot(EnvironmentProfiles.fromEnvironment(System.getenv()));
  }

  /**
   * Creates a root from a YAML file, falling back to the environment profile when the file is absent.
   *
   * @param path YAML configuration
   * @return new root
   * @throws IOException when the file exists but cannot be read
   */
  public static CompositionRoot fromFile(Path path) throws IOException {
    LoggingSettings loaded = LoggingConfigLoader.load(path)
        .orElseGet(() -> {
          log.info("No logging configuration at {}; using environment profile", path);
          return EnvironmentProfiles.fromEnvironment(System.getenv());
        });
    return new CompositionRoot(loaded);
  }

  /**
   * Returns the registered logger for {@code name}, creating it from the root settings when absent.
   *
   * @param name logger name
   * @return initialized logger owned by the registry
   */
  public LayeredLogger logger(String name) {
    return registry.getOrCreate(name, n -> createLogger(n, settings));
  }

  /**
   * Returns the registry behind {@link #logger(String)}.
   *
   * @return registry
   */
  public LoggerRegistry registry() {
    return registry;
  }

  /**
   * Builds a new, initialized logger that the caller owns and must close.
   *
   * @param name logger name
   * @param loggerSettings settings for this logger
   * @return synchronous or asynchronous logger
   */
  public AbstractLayeredLogger createLogger(String name, LoggingSettings loggerSettings) {
    return createLogger(name, loggerSettings, RedactionHook.NONE);
  }

  /**
   * Builds a new, initialized logger with a redaction hook.
   *
   * @param name logger name
   * @param loggerSettings settings for this logger
   * @param redaction fail-open message hook
   * @return synchronous or asynchronous logger
   */
  public AbstractLayeredLogger createLogger(String name, LoggingSettings loggerSettings, RedactionHook redaction) {
    Objects.requireNonNull(loggerSettings, "loggerSettings");
    BackupPort backup = backupFor(loggerSettings);
    LayerRouter router = new LayerRouter(buildLayers(name, loggerSettings, backup), metrics);
    SinkFlushScheduler scheduler = new SinkFlushScheduler(router::sinks, loggerSettings.flushInterval());
    LoggerOptions options = new LoggerOptions(
        name, clock, metrics, redaction, loggerSettings.captureCaller(), Map.of());

    AbstractLayeredLogger logger;
    if (loggerSettings.mode() == LoggingSettings.Mode.ASYNC) {
      AsyncSettings async = loggerSettings.async();
      DispatcherSettings dispatcherSettings = new DispatcherSettings(
          async.primaryCapacity(), async.overflowCapacity(), policyFor(async), async.drainGrace());
      AsyncDispatcher dispatcher = new AsyncDispatcher(
          name + "-dispatch",
          router::route,
          router::orderingKey,
          router::closeSinks,
          dispatcherSettings,
          metrics,
          backup,
          new PlainTextFormatter());
      logger = new AsyncLayeredLogger(options, router, dispatcher, scheduler, async.drainGrace());
    } else {
      logger = new SyncLayeredLogger(options, router, scheduler);
    }
    logger.initialize();
    log.info("Created {} logger {} with layers {}", loggerSettings.mode(), name, router.configuration().layerNames());
    return logger;
  }

  /**
   * Builds a composite whose components are independently configured loggers.
   *
   * @param name composite name
   * @param components component name to settings, in fan-out order
   * @return open composite owning its components
   */
  public CompositeLayeredLogger createComposite(String name, Map<String, LoggingSettings> components) {
    List<LayeredLogger> built = new ArrayList<>(components.size());
    try {
      for (Map.Entry<String, LoggingSettings> entry : components.entrySet()) {
        built.add(createLogger(entry.getKey(), entry.getValue()));
      }
    } catch (RuntimeException ex) {
      built.forEach(LayeredLogger::close);
      throw ex;
    }
    return new CompositeLayeredLogger(name, built);
  }

  /**
   * Replaces a logger's layers and closes the sinks that were replaced.
   *
   * <p>{@link LayerRouter#reload} returns only after routes still using the old sinks finish, so closing
   * them here cannot refuse a record that was already on its way.</p>
   *
   * @param logger logger built by this root
   * @param updated new settings; only layer and backup settings take effect
   */
  public void reload(AbstractLayeredLogger logger, LoggingSettings updated) {
    LayerConfiguration next = buildLayers(logger.name(), updated, backupFor(updated));
    LayerConfiguration previous = logger.router().reload(next);
    List<Sink> retained = next.distinctSinks();
    for (Sink sink : previous.distinctSinks()) {
      if (retained.stream().noneMatch(s -> s == sink)) {
        sink.close();
      }
    }
  }

  /**
   * Builds sinks for every enabled layer.
   *
   * @param loggerName prefix for sink names
   * @param loggerSettings layer settings
   * @param backup receives batches that fail to write
   * @return immutable layer configuration
   */
  public LayerConfiguration buildLayers(String loggerName, LoggingSettings loggerSettings, BackupPort backup) {
    LayerConfiguration.Builder builder = LayerConfiguration.builder();
    for (LayerSettings layer : loggerSettings.layers()) {
      if (!layer.enabled()) {
        log.debug("Layer {} of logger {} is disabled", layer.name(), loggerName);
        continue;
      }
      List<Sink> sinks = new ArrayList<>(layer.destinations().size());
      for (int i = 0; i < layer.destinations().size(); i++) {
        DestinationSettings destination = layer.destinations().get(i);
        String sinkName = loggerName + "." + layer.name() + "." + i + "." + destination.type();
        sinks.add(new Sink(
            sinkName,
            destination.level(),
            formatterFor(destination),
            writerFor(destination),
            destination.sink(),
            clock,
            metrics,
            backup));
      }
      builder.layer(layer.name(), layer.level(), sinks);
    }
    return builder.build();
  }

  /**
   * Returns the metrics port shared by every component.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Closes every registered logger, then the metrics exporter this root created.
   */
  @Override
  public void close() {
    registry.close();
    if (ownedMetrics != null) {
      ownedMetrics.close();
    }
  }

  private static MetricsPort createMetrics(LoggingSettings settings) {
    if (LoggingSettings.METRICS_OTEL.equals(settings.metrics())) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }

  private static BackupPort backupFor(LoggingSettings settings) {
    Path directory = settings.backupDirectory();
    return directory == null ? BackupPort.NONE : new FileBackupAdapter(directory);
  }

  private static ConcurrencyPolicy policyFor(AsyncSettings async) {
    if (AsyncSettings.MEMORY.equals(async.concurrency())) {
      return new MemoryAwareConcurrencyPolicy(async.workers());
    }
    return ConcurrencyPolicy.fixed(async.workers(), async.permits());
  }

  private static LogFormatter formatterFor(DestinationSettings destination) {
    return DestinationSettings.JSON.equals(destination.format())
        ? new JsonLinesFormatter()
        : new PlainTextFormatter();
  }

  private static LogWriter writerFor(DestinationSettings destination) {
    return switch (destination.type()) {
      case DestinationSettings.CONSOLE -> ConsoleLogWriter.stdout();
      case DestinationSettings.STDERR -> ConsoleLogWriter.stderr();
      case DestinationSettings.FILE -> new FileLogWriter(destination.path());
      case DestinationSettings.NULL -> new NullLogWriter();
      default -> throw new IllegalArgumentException("Unknown destination type: " + destination.type());
    };
  }
}
