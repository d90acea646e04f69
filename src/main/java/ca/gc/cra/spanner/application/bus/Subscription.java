package ca.gc.cra.spanner.application.bus;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Handle owning one handler registration on an {@link EventTarget}.
 *
 * <p>{@link #close()} (or {@link #unsubscribe()}) removes the registration exactly once; further calls
 * are no-ops. Use in try-with-resources to scope a listener to a block.</p>
 * <p>An emit that already copied the listener set before removal may still deliver one more value to
 * the handler.</p>
 *
 * @param <T> delivered value type
 * @since Spanner 0.1.0
 */
public final class Subscription<T> implements AutoCloseable {
  private final UUID id = UUID.randomUUID();
  private final EventTarget<T> owner;
  private final Consumer<? super T> handler;
  private final AtomicBoolean active = new AtomicBoolean(true);

  Subscription(EventTarget<T> owner, Consumer<? super T> handler) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  UUID id() {
    return id;
  }

  void deliver(T value) {
    handler.accept(value);
  }

  /**
   * Marks the handle inactive.
   *
   * @return {@code true} for the single call that performed the transition
   */
  boolean deactivate() {
    return active.compareAndSet(true, false);
  }

  /**
   * Returns {@code true} until the registration has been removed.
   *
   * @return whether the handler still receives new values
   */
  public boolean isActive() {
    return active.get();
  }

  /**
   * Removes the registration from its target; idempotent.
   */
  public void unsubscribe() {
    owner.unsubscribe(this);
  }

  @Override
  public void close() {
    unsubscribe();
  }

  @Override
  public String toString() {
    return "Subscription{" + id + ", active=" + active.get() + '}';
  }
}
