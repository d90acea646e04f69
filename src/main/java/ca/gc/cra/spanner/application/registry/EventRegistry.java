package ca.gc.cra.spanner.application.registry;

import ca.gc.cra.spanner.application.bus.EventTarget;
import ca.gc.cra.spanner.application.port.EventIngestPort;
import ca.gc.cra.spanner.application.port.MetricsPort;
import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.domain.trace.Event;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Context object holding the single active {@link EventManager} for a process.
 * <p><strong>Why:</strong> Ingestion adapters and client code share one store without hidden static state;
 * the composition root creates one registry and passes it to both.</p>
 * <p><strong>Initialization:</strong> first writer wins. The first {@link #initialize(Integer)} installs a
 * manager; later calls return that same manager and leave its subscriptions intact.</p>
 * <p><strong>Not initialized:</strong> every operation degrades instead of failing: lookups return
 * {@link Optional#empty()}, counts return zero, {@link #emit(Event)} returns {@code false}.</p>
 * <p><strong>Thread-safety:</strong> the slot is an {@link AtomicReference}; reads are lock-free.</p>
 *
 * @since Spanner 0.1.0
 */
public final class EventRegistry implements EventIngestPort {
  private static final Logger log = LoggerFactory.getLogger(EventRegistry.class);
  private static final String NOT_INITIALIZED = "No events captured";

  private final AtomicReference<EventManager> active = new AtomicReference<>();
  private final MetricsPort metrics;

  /**
   * Creates an empty registry without metrics.
   */
  public EventRegistry() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an empty registry.
   *
   * @param metrics metrics adapter passed to the manager it creates; falls back to
   *     {@link MetricsPort#NO_OP} when {@code null}
   */
  public EventRegistry(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Installs a manager with the default capacity unless one is already active.
   *
   * @return the active manager
   */
  public EventManager initialize() {
    return initialize(null);
  }

  /**
   * Installs a manager unless one is already active.
   *
   * @param maxEvents capacity; {@code null} selects {@link EventManager#DEFAULT_MAX_EVENTS}
   * @return the active manager, which is the pre-existing one on every call after the first
   * @throws IllegalArgumentException when {@code maxEvents} is not positive
   */
  public EventManager initialize(Integer maxEvents) {
    EventManager current = active.get();
    if (current != null) {
      log.debug("Event manager already initialized (maxEvents={}); ignoring request for {}",
          current.maxEvents(), maxEvents);
      return current;
    }
    EventManager created = new EventManager(
        maxEvents == null ? EventManager.DEFAULT_MAX_EVENTS : maxEvents, metrics);
    if (active.compareAndSet(null, created)) {
      log.info("Event manager initialized with capacity {}", created.maxEvents());
      return created;
    }
    created.close();
    return active.get();
  }

  /**
   * Installs an externally built manager unless one is already active.
   *
   * @param manager manager to install
   * @return {@code true} when {@code manager} became the active one
   */
  public boolean install(EventManager manager) {
    Objects.requireNonNull(manager, "manager");
    boolean installed = active.compareAndSet(null, manager);
    if (!installed) {
      log.debug("Event manager already initialized; ignoring installation");
    }
    return installed;
  }

  public boolean isInitialized() {
    return active.get() != null;
  }

  public Optional<EventManager> manager() {
    return Optional.ofNullable(active.get());
  }

  /**
   * Returns the bus of the active manager.
   *
   * @return bus, or empty when not initialized
   */
  public Optional<EventTarget<Event>> events() {
    return manager().map(EventManager::events);
  }

  /**
   * Stores and publishes {@code event} through the active manager.
   *
   * @param event captured event
   * @return {@code false} when not initialized and the event was dropped
   */
  public boolean emit(Event event) {
    Objects.requireNonNull(event, "event");
    EventManager manager = active.get();
    if (manager == null) {
      metrics.increment("registry.dropped");
      return false;
    }
    manager.emit(event);
    return true;
  }

  @Override
  public void ingest(Event event) {
    emit(event);
  }

  /**
   * Returns every stored event, newest first.
   *
   * @return snapshot, empty when not initialized
   */
  public List<Event> globalEvents() {
    return manager().map(EventManager::all).orElse(List.of());
  }

  public int eventCount() {
    return manager().map(EventManager::size).orElse(0);
  }

  /**
   * Empties the active store; no-op when not initialized.
   *
   * @return {@code true} when a store was cleared
   */
  public boolean clear() {
    EventManager manager = active.get();
    if (manager == null) {
      return false;
    }
    manager.clear();
    return true;
  }

  /**
   * Renders per-level counts of the active store.
   *
   * @return summary text, or {@code "No events captured"} when not initialized
   */
  public String summary() {
    return manager().map(EventManager::summary).orElse(NOT_INITIALIZED);
  }
}
