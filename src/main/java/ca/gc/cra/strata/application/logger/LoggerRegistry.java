package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.validation.Strings;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit, thread-safe registry of named loggers with get-or-create semantics.
 *
 * <p>The registry is an ordinary object owned by the application's composition root; there is no
 * process-wide instance. It owns the loggers it created: {@link #remove(String)} and {@link #close()} close
 * them.</p>
 *
 * @since 0.1.0
 */
public final class LoggerRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LoggerRegistry.class);

  private final ConcurrentMap<String, LayeredLogger> loggers = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Returns the logger registered under {@code name}, creating it with {@code factory} when absent.
   *
   * <p>The factory runs at most once per name and must not call back into this registry.</p>
   *
   * @param name logger name
   * @param factory builds a logger for the name
   * @return registered logger
   * @throws IllegalStateException when the registry is closed
   */
  public LayeredLogger getOrCreate(String name, Function<String, ? extends LayeredLogger> factory) {
    String key = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(factory, "factory");
    if (closed.get()) {
      throw new IllegalStateException("Logger registry is closed");
    }
    return loggers.computeIfAbsent(key, k -> Objects.requireNonNull(factory.apply(k), "factory result"));
  }

  /**
   * Looks up a logger without creating it.
   *
   * @param name logger name
   * @return registered logger, if any
   */
  public Optional<LayeredLogger> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(loggers.get(name));
  }

  /**
   * Whether a logger is registered under {@code name}.
   *
   * @param name logger name
   * @return {@code true} when registered
   */
  public boolean contains(String name) {
    return name != null && loggers.containsKey(name);
  }

  /**
   * Unregisters and closes a logger.
   *
   * @param name logger name
   * @return {@code true} when a logger was removed
   */
  public boolean remove(String name) {
    LayeredLogger removed = name == null ? null : loggers.remove(name);
    if (removed == null) {
      return false;
    }
    closeQuietly(removed);
    return true;
  }

  /**
   * Returns registered names in sorted order.
   *
   * @return logger names
   */
  public List<String> names() {
    return loggers.keySet().stream().sorted().toList();
  }

  /**
   * Returns the number of registered loggers.
   *
   * @return registry size
   */
  public int size() {
    return loggers.size();
  }

  /**
   * Closes and unregisters every logger but leaves the registry usable.
   */
  public void clear() {
    for (String name : List.copyOf(loggers.keySet())) {
      remove(name);
    }
  }

  /**
   * Closes every logger and refuses further registrations.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      clear();
    }
  }

  private static void closeQuietly(LayeredLogger logger) {
    try {
      logger.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close logger {}", logger.name(), ex);
    }
  }
}
