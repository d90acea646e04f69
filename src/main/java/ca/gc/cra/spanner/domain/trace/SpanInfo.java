package ca.gc.cra.spanner.domain.trace;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One named interval of execution together with the tree of spans entered beneath it.
 *
 * <p><strong>Lifecycle:</strong> a span is created on entry, mutated only through
 * {@link #addField(String, String)} and {@link #addChild(SpanInfo)} while active, and finalized exactly
 * once by {@link #exit()}. {@link #snapshot()} produces a frozen deep copy; events only ever hold
 * frozen copies so no capture is mutated after the fact.</p>
 * <p><strong>Invariant:</strong> {@link #duration()} is present iff {@link #exitedAt()} is present and
 * equals {@code exitedAt - enteredAt}.</p>
 * <p><strong>Thread-safety:</strong> active spans are confined to the thread that entered them; frozen
 * spans are immutable and safe to share.</p>
 *
 * @since Spanner 0.1.0
 */
public final class SpanInfo {
  private final long id;
  private final String name;
  private final String target;
  private final Level level;
  private final SourceLocation location;
  private final Map<String, String> fields;
  private final Instant enteredAt;
  private final List<SpanInfo> children;
  private final boolean frozen;
  private Instant exitedAt;
  private Duration duration;

  private SpanInfo(
      long id,
      String name,
      String target,
      Level level,
      SourceLocation location,
      Map<String, String> fields,
      Instant enteredAt,
      Instant exitedAt,
      List<SpanInfo> children,
      boolean frozen) {
    this.id = id;
    this.name = Objects.requireNonNull(name, "name");
    this.target = Objects.requireNonNull(target, "target");
    this.level = Objects.requireNonNull(level, "level");
    this.location = location == null ? SourceLocation.unknown() : location;
    this.enteredAt = Objects.requireNonNull(enteredAt, "enteredAt");
    this.exitedAt = exitedAt;
    this.duration = exitedAt == null ? null : Duration.between(enteredAt, exitedAt);
    this.frozen = frozen;
    this.fields = frozen ? Map.copyOf(fields) : new HashMap<>(fields);
    this.children = frozen ? List.copyOf(children) : new ArrayList<>(children);
  }

  /**
   * Creates an active span entered at {@code enteredAt}.
   *
   * @param id process-unique span identifier
   * @param name span name; never {@code null}
   * @param target logical source/module name; never {@code null}
   * @param level span level; never {@code null}
   * @param location source position; {@code null} means unknown
   * @param enteredAt entry timestamp; never {@code null}
   * @return new active span
   */
  public static SpanInfo enter(
      long id, String name, String target, Level level, SourceLocation location, Instant enteredAt) {
    return new SpanInfo(id, name, target, level, location, Map.of(), enteredAt, null, List.of(), false);
  }

  /**
   * Creates an active span entered now.
   *
   * @param id process-unique span identifier
   * @param name span name
   * @param target logical source/module name
   * @param level span level
   * @return new active span
   */
  public static SpanInfo enter(long id, String name, String target, Level level) {
    return enter(id, name, target, level, SourceLocation.unknown(), Instant.now());
  }

  /**
   * Rebuilds a frozen span from previously captured values, e.g. when decoding a snapshot.
   *
   * <p>The duration is derived from the two timestamps.</p>
   *
   * @param id span identifier
   * @param name span name
   * @param target logical source/module name
   * @param level span level
   * @param location source position; may be {@code null}
   * @param fields span fields; never {@code null}
   * @param enteredAt entry timestamp
   * @param exitedAt exit timestamp; {@code null} for a span captured while active
   * @param children child spans in capture order; never {@code null}
   * @return frozen span
   */
  public static SpanInfo restore(
      long id,
      String name,
      String target,
      Level level,
      SourceLocation location,
      Map<String, String> fields,
      Instant enteredAt,
      Instant exitedAt,
      List<SpanInfo> children) {
    List<SpanInfo> frozenChildren = new ArrayList<>(children.size());
    for (SpanInfo child : children) {
      frozenChildren.add(child.snapshot());
    }
    return new SpanInfo(id, name, target, level, location, fields, enteredAt, exitedAt, frozenChildren, true);
  }

  /**
   * Records a field on an active span, replacing any previous value for the key.
   *
   * @param key field name
   * @param value stringified field value
   * @throws IllegalStateException when the span is frozen or has exited
   */
  public void addField(String key, String value) {
    requireActive("addField");
    fields.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Appends a child span below this one.
   *
   * @param child child span; a frozen copy is stored
   * @throws IllegalStateException when the span is frozen or has exited
   */
  public void addChild(SpanInfo child) {
    requireActive("addChild");
    children.add(Objects.requireNonNull(child, "child").snapshot());
  }

  /**
   * Finalizes the span now.
   *
   * @throws IllegalStateException when the span already exited or is frozen
   */
  public void exit() {
    exit(Instant.now());
  }

  /**
   * Finalizes the span at the supplied instant.
   *
   * @param when exit timestamp; never earlier than {@link #enteredAt()}
   * @throws IllegalStateException when the span already exited or is frozen
   * @throws IllegalArgumentException when {@code when} precedes the entry timestamp
   */
  public void exit(Instant when) {
    requireActive("exit");
    Objects.requireNonNull(when, "when");
    if (when.isBefore(enteredAt)) {
      throw new IllegalArgumentException("exit time precedes entry time for span " + name);
    }
    this.exitedAt = when;
    this.duration = Duration.between(enteredAt, when);
  }

  /**
   * Returns a frozen deep copy of this span and its children.
   *
   * @return this instance when already frozen; otherwise an immutable copy
   */
  public SpanInfo snapshot() {
    if (frozen) {
      return this;
    }
    List<SpanInfo> copies = new ArrayList<>(children.size());
    for (SpanInfo child : children) {
      copies.add(child.snapshot());
    }
    return new SpanInfo(id, name, target, level, location, fields, enteredAt, exitedAt, copies, true);
  }

  private void requireActive(String operation) {
    if (frozen) {
      throw new IllegalStateException(operation + " on frozen span " + name);
    }
    if (exitedAt != null) {
      throw new IllegalStateException(operation + " on exited span " + name);
    }
  }

  public long id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String target() {
    return target;
  }

  public Level level() {
    return level;
  }

  public SourceLocation location() {
    return location;
  }

  /**
   * Returns the span fields.
   *
   * @return read-only view of the fields
   */
  public Map<String, String> fields() {
    return frozen ? fields : Collections.unmodifiableMap(fields);
  }

  public Instant enteredAt() {
    return enteredAt;
  }

  public Optional<Instant> exitedAt() {
    return Optional.ofNullable(exitedAt);
  }

  public Optional<Duration> duration() {
    return Optional.ofNullable(duration);
  }

  /**
   * Returns the child spans in the order they were attached.
   *
   * @return read-only view of the children
   */
  public List<SpanInfo> children() {
    return frozen ? children : Collections.unmodifiableList(children);
  }

  public boolean isActive() {
    return exitedAt == null;
  }

  public boolean isFrozen() {
    return frozen;
  }

  /**
   * Returns the final duration, or the time elapsed since entry while the span is active.
   *
   * @return non-negative duration
   */
  public Duration elapsed() {
    if (duration != null) {
      return duration;
    }
    Duration running = Duration.between(enteredAt, Instant.now());
    return running.isNegative() ? Duration.ZERO : running;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SpanInfo other)) {
      return false;
    }
    return id == other.id
        && name.equals(other.name)
        && target.equals(other.target)
        && level == other.level
        && location.equals(other.location)
        && fields.equals(other.fields)
        && enteredAt.equals(other.enteredAt)
        && Objects.equals(exitedAt, other.exitedAt)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, target, level, location, fields, enteredAt, exitedAt, children);
  }

  @Override
  public String toString() {
    return "SpanInfo{id=" + id + ", name=" + name + ", level=" + level
        + ", active=" + isActive() + ", children=" + children.size() + '}';
  }
}
