package ca.gc.cra.spanner.application.bus;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-style view over an {@link EventTarget}, backed by its own subscription and unbounded queue.
 *
 * <p>The sequence is infinite while the bus is open. It ends after the bus is closed, or after
 * {@link #close()}, once the values already queued have been consumed. There is no backpressure: a
 * consumer that stops reading grows this stream's queue without bound.</p>
 * <p><strong>Thread-safety:</strong> producers may deliver from any thread; reading is intended for a
 * single consumer thread. An interrupt while blocked in {@link #hasNext()} ends the iteration and
 * re-asserts the thread's interrupt flag.</p>
 *
 * @param <T> delivered value type
 * @since Spanner 0.1.0
 */
public final class EventStream<T> implements Iterator<T>, AutoCloseable {
  private final EventTarget<T> source;
  private final BlockingQueue<Item<T>> queue = new LinkedBlockingQueue<>();
  /** End-of-stream marker; the only item without a value since emitted values are non-null. */
  private final Item<T> end = new Item<>(null);
  private volatile Subscription<T> subscription;
  private Item<T> head;
  private boolean finished;

  EventStream(EventTarget<T> source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  void attach(Subscription<T> owned) {
    this.subscription = owned;
  }

  void offer(T value) {
    queue.add(new Item<>(value));
  }

  void finish() {
    queue.add(end);
  }

  /**
   * Blocks until a value is available or the stream has ended.
   *
   * @return {@code true} when {@link #next()} will return a value without blocking
   */
  @Override
  public boolean hasNext() {
    if (finished) {
      return false;
    }
    if (head == null) {
      try {
        head = queue.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return accept();
  }

  /**
   * Returns the next value, blocking until one is emitted.
   *
   * @return next value
   * @throws NoSuchElementException when the stream has ended
   */
  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException("stream ended");
    }
    return take();
  }

  /**
   * Waits up to {@code timeout} for the next value.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return the value, or empty on timeout or when the stream has ended
   * @throws InterruptedException when interrupted while waiting
   */
  public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
    if (finished) {
      return Optional.empty();
    }
    if (head == null) {
      head = queue.poll(timeout, unit);
    }
    return head != null && accept() ? Optional.of(take()) : Optional.empty();
  }

  /**
   * Returns the next value if one is already queued.
   *
   * @return queued value, or empty
   */
  public Optional<T> tryNext() {
    if (finished) {
      return Optional.empty();
    }
    if (head == null) {
      head = queue.poll();
    }
    return head != null && accept() ? Optional.of(take()) : Optional.empty();
  }

  /**
   * Returns a lazy sequential {@link Stream} view; terminal operations block like {@link #next()}.
   *
   * @return stream over the remaining values
   */
  public Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
  }

  /**
   * Returns the number of queued, unread values.
   *
   * @return queue depth
   */
  public int pending() {
    int size = queue.size() + (head != null && head != end ? 1 : 0);
    return queue.contains(end) ? size - 1 : size;
  }

  /**
   * Returns {@code true} once the end of the stream has been reached by the reader.
   *
   * @return whether no further values will be returned
   */
  public boolean isFinished() {
    return finished;
  }

  /**
   * Unsubscribes from the bus. Values already queued remain readable, then the stream ends.
   */
  @Override
  public void close() {
    Subscription<T> owned = subscription;
    if (owned != null && owned.isActive()) {
      owned.unsubscribe();
      source.forget(this);
      finish();
    }
  }

  private boolean accept() {
    if (head == end) {
      finished = true;
      head = null;
      return false;
    }
    return true;
  }

  private T take() {
    T value = head.value();
    head = null;
    return value;
  }

  private record Item<T>(T value) {}
}
