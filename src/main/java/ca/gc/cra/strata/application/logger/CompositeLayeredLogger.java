package ca.gc.cra.strata.application.logger;

import ca.gc.cra.strata.domain.log.CallerContext;
import ca.gc.cra.strata.domain.log.LogLevel;
import ca.gc.cra.strata.validation.Strings;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger fanning every call out to independently configured component loggers.
 *
 * <p>A component that throws is logged and skipped; the remaining components still receive the call.
 * Batches are forwarded through each component's {@link LayeredLogger#logBatch(List)} so asynchronous
 * components enqueue them in one pass.</p>
 *
 * <p>Components are owned by the composite: {@link #remove(String)} and {@link #close()} close them.</p>
 *
 * @since 0.1.0
 */
public final class CompositeLayeredLogger implements LayeredLogger {
  private static final Logger log = LoggerFactory.getLogger(CompositeLayeredLogger.class);
  private static final int FAILURE_LOG_THRESHOLD = 1_000;

  private final String name;
  private final List<LayeredLogger> components = new CopyOnWriteArrayList<>();
  private final AtomicReference<LoggerState> state = new AtomicReference<>(LoggerState.INITIALIZED);
  private final AtomicInteger failureLogLimiter = new AtomicInteger();
  private final LongAdder logged = new LongAdder();
  private final LongAdder componentFailures = new LongAdder();

  /**
   * Creates an open composite.
   *
   * @param name composite name
   * @param initial components in fan-out order
   */
  public CompositeLayeredLogger(String name, List<? extends LayeredLogger> initial) {
    this.name = Strings.requireNonBlank("name", name);
    for (LayeredLogger component : Objects.requireNonNullElse(initial, List.<LayeredLogger>of())) {
      add(component);
    }
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * Appends a component.
   *
   * @param component logger to fan out to
   * @throws IllegalStateException when the composite is closed
   * @throws IllegalArgumentException when a component with the same name exists
   */
  public synchronized void add(LayeredLogger component) {
    Objects.requireNonNull(component, "component");
    if (state.get() != LoggerState.INITIALIZED) {
      throw new IllegalStateException("Composite " + name + " is " + state.get());
    }
    if (component(component.name()).isPresent()) {
      throw new IllegalArgumentException("Composite " + name + " already has component " + component.name());
    }
    components.add(component);
  }

  /**
   * Removes and closes a component.
   *
   * @param componentName name of the component
   * @return {@code true} when a component was removed
   */
  public synchronized boolean remove(String componentName) {
    Optional<LayeredLogger> found = component(componentName);
    if (found.isEmpty()) {
      return false;
    }
    components.remove(found.get());
    closeQuietly(found.get());
    return true;
  }

  /**
   * Looks up a component by name.
   *
   * @param componentName name of the component
   * @return the component, if present
   */
  public Optional<LayeredLogger> component(String componentName) {
    return components.stream().filter(c -> c.name().equals(componentName)).findFirst();
  }

  /**
   * Returns the components in fan-out order.
   *
   * @return snapshot of components
   */
  public List<LayeredLogger> components() {
    return List.copyOf(components);
  }

  /**
   * Forwards the call to every component.
   *
   * @return {@code true} when at least one component accepted the record
   */
  @Override
  public boolean log(LogLevel level, String message, String layer, Map<String, Object> extra, CallerContext caller) {
    if (state.get() != LoggerState.INITIALIZED) {
      return false;
    }
    boolean accepted = false;
    for (LayeredLogger component : components) {
      try {
        accepted |= component.log(level, message, layer, extra, caller);
      } catch (RuntimeException ex) {
        recordFailure(component, ex);
      }
    }
    if (accepted) {
      logged.increment();
    }
    return accepted;
  }

  /**
   * Forwards the batch to every component.
   *
   * @return the largest number of entries any single component accepted
   */
  @Override
  public int logBatch(List<LogEntry> entries) {
    if (state.get() != LoggerState.INITIALIZED || entries.isEmpty()) {
      return 0;
    }
    List<LogEntry> batch = List.copyOf(entries);
    int best = 0;
    for (LayeredLogger component : components) {
      try {
        best = Math.max(best, component.logBatch(batch));
      } catch (RuntimeException ex) {
        recordFailure(component, ex);
      }
    }
    logged.add(best);
    return best;
  }

  @Override
  public LoggerState state() {
    return state.get();
  }

  @Override
  public LoggerHealth health() {
    List<LoggerHealth> healths = components.stream().map(LayeredLogger::health).toList();
    long rejected = healths.stream().mapToLong(LoggerHealth::rejected).sum();
    long dropped = healths.stream().mapToLong(LoggerHealth::dropped).sum();
    return new LoggerHealth(name, state.get(), logged.sum(), rejected, dropped, List.of(), null, healths);
  }

  /**
   * Returns how many component calls threw.
   *
   * @return failure count
   */
  public long componentFailures() {
    return componentFailures.sum();
  }

  @Override
  public void close() {
    if (!state.compareAndSet(LoggerState.INITIALIZED, LoggerState.CLOSING)) {
      return;
    }
    synchronized (this) {
      for (LayeredLogger component : components) {
        closeQuietly(component);
      }
    }
    state.set(LoggerState.CLOSED);
  }

  private void recordFailure(LayeredLogger component, RuntimeException ex) {
    componentFailures.increment();
    int count = failureLogLimiter.incrementAndGet();
    if (count == 1 || count % FAILURE_LOG_THRESHOLD == 0) {
      log.warn("Composite {} component {} failed (failure #{})", name, component.name(), count, ex);
    }
  }

  private void closeQuietly(LayeredLogger component) {
    try {
      component.close();
    } catch (RuntimeException ex) {
      log.warn("Composite {} failed to close component {}", name, component.name(), ex);
    }
  }
}
