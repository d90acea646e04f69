package ca.gc.cra.spanner.domain.trace;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable captured event: the {@link EventData} payload plus the span and thread context active when
 * it fired.
 *
 * <p><strong>Ownership:</strong> one instance is shared by the store slot holding it, every subscriber
 * it was delivered to, and any snapshot taken from the store. Nothing mutates it after
 * {@link Builder#build()}.</p>
 * <p><strong>Parent chain:</strong> {@link #parent()} can only reference an event that was already
 * built, so the chain is acyclic by construction and terminates.</p>
 *
 * @since Spanner 0.1.0
 */
public final class Event {
  private final EventData data;
  private final List<SpanInfo> spanStack;
  private final SpanInfo currentSpan;
  private final String threadId;
  private final String threadName;
  private final Long processId;
  private final String correlationId;
  private final Map<String, String> customMetadata;
  private final Event parent;
  private final int hash;

  private Event(Builder builder) {
    this.data = builder.data.seal();
    List<SpanInfo> stack = new ArrayList<>(builder.spanStack.size());
    for (SpanInfo span : builder.spanStack) {
      stack.add(span.snapshot());
    }
    this.spanStack = List.copyOf(stack);
    this.currentSpan = builder.currentSpan == null ? null : builder.currentSpan.snapshot();
    this.threadId = builder.threadId;
    this.threadName = builder.threadName;
    this.processId = builder.processId;
    this.correlationId = builder.correlationId;
    this.customMetadata = Map.copyOf(builder.customMetadata);
    this.parent = builder.parent;
    this.hash = Objects.hash(data, spanStack, currentSpan, threadId, threadName, processId, correlationId,
        customMetadata, parent == null ? 0 : parent.hash);
  }

  /**
   * Starts building an event around the supplied payload.
   *
   * @param data event payload; sealed when the event is built
   * @return new builder
   */
  public static Builder builder(EventData data) {
    return new Builder(data);
  }

  /**
   * Creates an event with no span or thread context.
   *
   * @param data event payload
   * @return built event
   */
  public static Event of(EventData data) {
    return builder(data).build();
  }

  public EventData data() {
    return data;
  }

  public Level level() {
    return data.level();
  }

  public String message() {
    return data.message();
  }

  public String target() {
    return data.target();
  }

  /**
   * Returns the spans active when the event fired, outermost first.
   *
   * @return immutable span stack
   */
  public List<SpanInfo> spanStack() {
    return spanStack;
  }

  public Optional<SpanInfo> currentSpan() {
    return Optional.ofNullable(currentSpan);
  }

  public Optional<String> threadId() {
    return Optional.ofNullable(threadId);
  }

  public Optional<String> threadName() {
    return Optional.ofNullable(threadName);
  }

  public Optional<Long> processId() {
    return Optional.ofNullable(processId);
  }

  public Optional<String> correlationId() {
    return Optional.ofNullable(correlationId);
  }

  public Map<String, String> customMetadata() {
    return customMetadata;
  }

  public Optional<Event> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Evaluates every criterion of {@code query} against this event.
   *
   * @param query filter; {@code null} criteria are vacuously true
   * @return whether the event satisfies all supplied criteria
   */
  public boolean matches(EventQuery query) {
    Objects.requireNonNull(query, "query");
    if (query.level() != null && data.level() != query.level()) {
      return false;
    }
    if (query.targetContains() != null && !data.target().contains(query.targetContains())) {
      return false;
    }
    if (query.messageContains() != null && !data.message().contains(query.messageContains())) {
      return false;
    }
    return query.spanNameContains() == null || hasSpanNamed(query.spanNameContains());
  }

  /**
   * Returns {@code true} when a span in the stack, or the current span, has a name containing
   * {@code fragment}.
   *
   * @param fragment substring to look for
   * @return whether any such span exists
   */
  public boolean hasSpanNamed(String fragment) {
    for (SpanInfo span : spanStack) {
      if (span.name().contains(fragment)) {
        return true;
      }
    }
    return currentSpan != null && currentSpan.name().contains(fragment);
  }

  /**
   * Renders the current span and span stack as an indented tree.
   *
   * @return diagnostic text; empty when the event has no span context
   */
  public String spanTree() {
    return EventFormatter.spanTree(this);
  }

  /**
   * Renders every piece of context carried by this event followed by its parent chain.
   *
   * @return diagnostic text
   */
  public String fullContext() {
    return EventFormatter.fullContext(this);
  }

  /**
   * Compares this event and its parent chain link by link. The walk stops early at a shared ancestor.
   */
  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Event)) {
      return false;
    }
    Event left = this;
    Event right = (Event) o;
    while (left != right) {
      if (left == null || right == null || left.hash != right.hash || !left.sameOwnContext(right)) {
        return false;
      }
      left = left.parent;
      right = right.parent;
    }
    return true;
  }

  private boolean sameOwnContext(Event other) {
    return data.equals(other.data)
        && spanStack.equals(other.spanStack)
        && Objects.equals(currentSpan, other.currentSpan)
        && Objects.equals(threadId, other.threadId)
        && Objects.equals(threadName, other.threadName)
        && Objects.equals(processId, other.processId)
        && Objects.equals(correlationId, other.correlationId)
        && customMetadata.equals(other.customMetadata);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "Event{level=" + data.level() + ", target=" + data.target() + ", message=" + data.message()
        + ", correlationId=" + correlationId + '}';
  }

  /**
   * Assembles an {@link Event}. Not thread-safe; intended for a single adapter thread.
   */
  public static final class Builder {
    private final EventData data;
    private final List<SpanInfo> spanStack = new ArrayList<>();
    private final Map<String, String> customMetadata = new HashMap<>();
    private SpanInfo currentSpan;
    private String threadId;
    private String threadName;
    private Long processId;
    private String correlationId;
    private Event parent;

    private Builder(EventData data) {
      this.data = Objects.requireNonNull(data, "data");
    }

    public Builder spanStack(List<SpanInfo> spans) {
      spanStack.clear();
      spanStack.addAll(Objects.requireNonNull(spans, "spans"));
      return this;
    }

    public Builder currentSpan(SpanInfo span) {
      this.currentSpan = span;
      return this;
    }

    public Builder thread(String id, String name) {
      this.threadId = id;
      this.threadName = name;
      return this;
    }

    public Builder processId(Long pid) {
      this.processId = pid;
      return this;
    }

    public Builder correlationId(String id) {
      this.correlationId = id;
      return this;
    }

    public Builder metadata(String key, String value) {
      customMetadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder metadata(Map<String, String> entries) {
      entries.forEach(this::metadata);
      return this;
    }

    /**
     * Links the event being built to an earlier one.
     *
     * @param earlier already built event; {@code null} clears the link
     * @return this builder
     */
    public Builder parent(Event earlier) {
      this.parent = earlier;
      return this;
    }

    public Event build() {
      return new Event(this);
    }
  }
}
