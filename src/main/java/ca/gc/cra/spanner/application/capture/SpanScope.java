package ca.gc.cra.spanner.application.capture;

import ca.gc.cra.spanner.domain.trace.SpanInfo;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a span entered through {@link SpanTracker#enter}. Closing it exits the span; closing twice is a
 * no-op. Only the thread that entered the span can close it; intended for try-with-resources.
 *
 * @since Spanner 0.1.0
 */
public final class SpanScope implements AutoCloseable {
  private final SpanTracker tracker;
  private final SpanInfo span;
  private final AtomicBoolean closed = new AtomicBoolean();

  SpanScope(SpanTracker tracker, SpanInfo span) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.span = Objects.requireNonNull(span, "span");
  }

  /**
   * Records a field on the span.
   *
   * @param key field name
   * @param value value, stringified with {@link String#valueOf(Object)}
   * @return this scope
   * @throws IllegalStateException when the scope is closed
   */
  public SpanScope record(String key, Object value) {
    if (closed.get()) {
      throw new IllegalStateException("span " + span.name() + " already closed");
    }
    span.addField(key, String.valueOf(value));
    return this;
  }

  public long id() {
    return span.id();
  }

  public String name() {
    return span.name();
  }

  /**
   * @return frozen copy of the span as it stands now
   */
  public SpanInfo span() {
    return span.snapshot();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Exits the span. A close from a thread that did not enter the span is logged and leaves the scope open.
   */
  @Override
  public void close() {
    if (!closed.get() && tracker.exit(span)) {
      closed.set(true);
    }
  }
}
