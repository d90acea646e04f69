package ca.gc.cra.spanner.application.bus;

import ca.gc.cra.spanner.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Thread-safe publish/subscribe primitive delivering every emitted value to every
 * registered handler and open {@link EventStream}.
 * <p><strong>Why:</strong> Live consumers observe captured events as they arrive without polling the store.</p>
 * <p><strong>Delivery:</strong> {@link #emit(Object)} runs handlers synchronously on the caller's thread.
 * The listener set is read under a read lock and copied; handlers run outside the lock, so a handler may
 * itself emit or subscribe without deadlocking. Handlers registered from within a handler receive values
 * from the next emit onwards.</p>
 * <p><strong>Thread-safety:</strong> {@code emit} calls proceed in parallel under the read lock;
 * {@code subscribe}/{@code unsubscribe} take the write lock only for the map mutation.</p>
 * <p><strong>Failure isolation:</strong> a handler throwing a {@link RuntimeException} is logged and counted
 * as {@code bus.handler.failures}; the remaining handlers still run.</p>
 * <p><strong>Performance:</strong> handlers add directly to publisher latency and must stay short; long work
 * belongs behind {@link #asStream()} or a handler-owned queue.</p>
 *
 * @param <T> delivered value type
 * @since Spanner 0.1.0
 */
public final class EventTarget<T> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventTarget.class);

  private final String name;
  private final MetricsPort metrics;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<UUID, Subscription<T>> listeners = new LinkedHashMap<>();
  private final Set<EventStream<T>> streams = new LinkedHashSet<>();
  private boolean closed;

  /**
   * Creates an unnamed bus without metrics.
   */
  public EventTarget() {
    this("events", MetricsPort.NO_OP);
  }

  /**
   * Creates a bus.
   *
   * @param name label used in logs and metric names (e.g., {@code events})
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public EventTarget(String name, MetricsPort metrics) {
    this.name = name == null || name.isBlank() ? "events" : name.trim();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Delivers {@code value} to every handler registered when the call starts.
   *
   * @param value value to publish; never {@code null}
   */
  public void emit(T value) {
    Objects.requireNonNull(value, "value");
    List<Subscription<T>> snapshot;
    lock.readLock().lock();
    try {
      if (closed) {
        log.debug("Dropping value emitted on closed bus {}", name);
        return;
      }
      snapshot = new ArrayList<>(listeners.values());
    } finally {
      lock.readLock().unlock();
    }
    for (Subscription<T> subscription : snapshot) {
      if (!subscription.isActive()) {
        continue;
      }
      try {
        subscription.deliver(value);
      } catch (RuntimeException ex) {
        metrics.increment(name + ".bus.handler.failures");
        log.warn("Handler {} on bus {} failed; continuing delivery", subscription, name, ex);
      }
    }
    metrics.increment(name + ".bus.emitted");
  }

  /**
   * Registers {@code handler} for every value emitted after this call returns.
   *
   * @param handler callback; must be short and non-blocking
   * @return handle owning the registration
   * @throws IllegalStateException when the bus has been closed
   */
  public Subscription<T> subscribe(Consumer<? super T> handler) {
    Subscription<T> subscription = new Subscription<>(this, handler);
    lock.writeLock().lock();
    try {
      if (closed) {
        throw new IllegalStateException("bus " + name + " is closed");
      }
      listeners.put(subscription.id(), subscription);
    } finally {
      lock.writeLock().unlock();
    }
    return subscription;
  }

  /**
   * Removes the registration owned by {@code subscription}. No-op when already removed.
   *
   * @param subscription handle returned by {@link #subscribe(Consumer)}
   */
  public void unsubscribe(Subscription<T> subscription) {
    if (subscription == null || !subscription.deactivate()) {
      return;
    }
    lock.writeLock().lock();
    try {
      listeners.remove(subscription.id());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Opens an independent, unbounded pull-style view of every value emitted from now on.
   *
   * <p>Each stream owns its own queue, so a stalled consumer never blocks the publisher or other
   * subscribers; it grows its own queue instead.</p>
   *
   * @return new stream; close it to release its subscription
   * @throws IllegalStateException when the bus has been closed
   */
  public EventStream<T> asStream() {
    EventStream<T> stream = new EventStream<>(this);
    lock.writeLock().lock();
    try {
      if (closed) {
        throw new IllegalStateException("bus " + name + " is closed");
      }
      streams.add(stream);
    } finally {
      lock.writeLock().unlock();
    }
    stream.attach(subscribe(stream::offer));
    return stream;
  }

  void forget(EventStream<T> stream) {
    lock.writeLock().lock();
    try {
      streams.remove(stream);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns the number of registered handlers, streams included.
   *
   * @return current listener count
   */
  public int listenerCount() {
    lock.readLock().lock();
    try {
      return listeners.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isClosed() {
    lock.readLock().lock();
    try {
      return closed;
    } finally {
      lock.readLock().unlock();
    }
  }

  public String name() {
    return name;
  }

  /**
   * Disposes the bus: removes every handler and ends every open stream once it has drained the values
   * it already holds. Later emits are dropped. Idempotent.
   */
  @Override
  public void close() {
    List<Subscription<T>> removed;
    List<EventStream<T>> ending;
    lock.writeLock().lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      removed = new ArrayList<>(listeners.values());
      ending = new ArrayList<>(streams);
      listeners.clear();
      streams.clear();
    } finally {
      lock.writeLock().unlock();
    }
    removed.forEach(Subscription::deactivate);
    ending.forEach(EventStream::finish);
    log.debug("Closed bus {} ({} listeners, {} streams)", name, removed.size(), ending.size());
  }
}
