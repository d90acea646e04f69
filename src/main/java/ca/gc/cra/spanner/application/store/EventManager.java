package ca.gc.cra.spanner.application.store;

import ca.gc.cra.spanner.application.bus.EventTarget;
import ca.gc.cra.spanner.application.port.MetricsPort;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventQuery;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.validation.Numbers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Bounded, newest-first history of captured events plus the bus they are published on.
 * <p><strong>Why:</strong> Keeps recent diagnostics queryable in memory while capping memory use regardless
 * of the emission rate.</p>
 * <p><strong>Eviction:</strong> {@link #push(Event)} prepends and, once the size exceeds {@link #maxEvents()},
 * drops exactly one event from the back (the oldest). Order is strictly newest-first.</p>
 * <p><strong>Thread-safety:</strong> the buffer is guarded by an exclusive lock; queries copy matching
 * events under the lock and return immutable lists, so later pushes or {@link #clear()} never affect a
 * result already returned.</p>
 * <p><strong>Performance:</strong> push is O(1); queries are O(n) in the current size.</p>
 * <p><strong>Observability:</strong> counts {@code store.pushed} and {@code store.evicted}.</p>
 *
 * @since Spanner 0.1.0
 */
public final class EventManager implements AutoCloseable {
  /** Capacity used when none is configured. */
  public static final int DEFAULT_MAX_EVENTS = 12_000;

  private final int maxEvents;
  private final MetricsPort metrics;
  private final EventTarget<Event> events;
  private final Deque<Event> buffer = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates a store with the default capacity.
   */
  public EventManager() {
    this(DEFAULT_MAX_EVENTS);
  }

  /**
   * Creates a store holding at most {@code maxEvents} events.
   *
   * @param maxEvents capacity; must be positive
   * @throws IllegalArgumentException when {@code maxEvents} is not positive
   */
  public EventManager(int maxEvents) {
    this(maxEvents, MetricsPort.NO_OP);
  }

  /**
   * Creates a store holding at most {@code maxEvents} events and reporting to {@code metrics}.
   *
   * @param maxEvents capacity; must be positive
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @throws IllegalArgumentException when {@code maxEvents} is not positive
   */
  public EventManager(int maxEvents, MetricsPort metrics) {
    this.maxEvents = (int) Numbers.requireRange("maxEvents", maxEvents, 1, Integer.MAX_VALUE);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.events = new EventTarget<>("events", this.metrics);
  }

  /**
   * Adds {@code event} to the front of the history without publishing it.
   *
   * @param event captured event; never {@code null}
   */
  public void push(Event event) {
    Objects.requireNonNull(event, "event");
    boolean evicted = false;
    lock.lock();
    try {
      buffer.addFirst(event);
      if (buffer.size() > maxEvents) {
        buffer.removeLast();
        evicted = true;
      }
    } finally {
      lock.unlock();
    }
    metrics.increment("store.pushed");
    if (evicted) {
      metrics.increment("store.evicted");
    }
  }

  /**
   * Stores {@code event} and publishes it to every live subscriber.
   *
   * @param event captured event; never {@code null}
   */
  public void emit(Event event) {
    push(event);
    events.emit(event);
  }

  /**
   * Returns the bus events are published on.
   *
   * @return owned event target
   */
  public EventTarget<Event> events() {
    return events;
  }

  public List<Event> byLevel(Level level) {
    Objects.requireNonNull(level, "level");
    return select(event -> event.level() == level);
  }

  public List<Event> byTarget(String targetContains) {
    Objects.requireNonNull(targetContains, "targetContains");
    return select(event -> event.target().contains(targetContains));
  }

  public List<Event> bySpan(String spanNameContains) {
    Objects.requireNonNull(spanNameContains, "spanNameContains");
    return select(event -> event.hasSpanNamed(spanNameContains));
  }

  public List<Event> byThread(String threadId) {
    Objects.requireNonNull(threadId, "threadId");
    return select(event -> event.threadId().filter(threadId::equals).isPresent());
  }

  public List<Event> byCorrelationId(String correlationId) {
    Objects.requireNonNull(correlationId, "correlationId");
    return select(event -> event.correlationId().filter(correlationId::equals).isPresent());
  }

  /**
   * Returns events satisfying every criterion of {@code query}, newest first.
   *
   * @param query filter; {@link EventQuery#any()} returns every stored event
   * @return immutable snapshot
   */
  public List<Event> search(EventQuery query) {
    Objects.requireNonNull(query, "query");
    return query.isUnconstrained() ? all() : select(query);
  }

  /**
   * Returns the {@code count} most recent events.
   *
   * @param count maximum number of events; negative values are treated as zero
   * @return immutable snapshot, newest first
   */
  public List<Event> recent(int count) {
    if (count <= 0) {
      return List.of();
    }
    lock.lock();
    try {
      List<Event> result = new ArrayList<>(Math.min(count, buffer.size()));
      for (Event event : buffer) {
        if (result.size() == count) {
          break;
        }
        result.add(event);
      }
      return List.copyOf(result);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns every stored event, newest first.
   *
   * @return immutable snapshot
   */
  public List<Event> all() {
    lock.lock();
    try {
      return List.copyOf(buffer);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Counts stored events per level, including levels with no events.
   *
   * @return counts keyed by level in severity order
   */
  public Map<Level, Integer> levelCounts() {
    Map<Level, Integer> counts = new EnumMap<>(Level.class);
    for (Level level : Level.values()) {
      counts.put(level, 0);
    }
    lock.lock();
    try {
      for (Event event : buffer) {
        counts.merge(event.level(), 1, Integer::sum);
      }
    } finally {
      lock.unlock();
    }
    return counts;
  }

  /**
   * Renders the total and per-level counts, omitting levels with no events.
   *
   * @return multi-line summary
   */
  public String summary() {
    Map<Level, Integer> counts = levelCounts();
    int total = counts.values().stream().mapToInt(Integer::intValue).sum();
    StringBuilder out = new StringBuilder("Event Summary: ").append(total).append(" total events\n");
    counts.forEach((level, count) -> {
      if (count > 0) {
        out.append("  ").append(level.label()).append(": ").append(count).append('\n');
      }
    });
    return out.toString();
  }

  public int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int maxEvents() {
    return maxEvents;
  }

  /**
   * Empties the history. Subscriptions and previously returned snapshots are unaffected.
   */
  public void clear() {
    lock.lock();
    try {
      buffer.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the bus, ending open streams. The history remains queryable.
   */
  @Override
  public void close() {
    events.close();
  }

  private List<Event> select(Predicate<Event> filter) {
    lock.lock();
    try {
      List<Event> result = new ArrayList<>();
      for (Event event : buffer) {
        if (filter.test(event)) {
          result.add(event);
        }
      }
      return List.copyOf(result);
    } finally {
      lock.unlock();
    }
  }
}
