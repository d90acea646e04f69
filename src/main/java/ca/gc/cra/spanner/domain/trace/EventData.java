package ca.gc.cra.spanner.domain.trace;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of a captured event: message, level, target, source location, fields and capture time.
 *
 * <p>Fields may be added while an adapter assembles the event; {@link #seal()} produces the frozen
 * copy held by a published {@link Event}.</p>
 *
 * @since Spanner 0.1.0
 */
public final class EventData {
  private final String message;
  private final Level level;
  private final String target;
  private final SourceLocation location;
  private final Map<String, String> fields;
  private final Instant timestamp;
  private final boolean sealed;

  /**
   * Creates event data captured now with no location and no fields.
   *
   * @param message rendered message; never {@code null}
   * @param level event level; never {@code null}
   * @param target logical source/module name; never {@code null}
   */
  public EventData(String message, Level level, String target) {
    this(message, level, target, SourceLocation.unknown(), Map.of(), Instant.now());
  }

  /**
   * Creates event data with every component supplied.
   *
   * @param message rendered message; never {@code null}
   * @param level event level; never {@code null}
   * @param target logical source/module name; never {@code null}
   * @param location source position; {@code null} means unknown
   * @param fields event fields; {@code null} means none
   * @param timestamp capture timestamp; never {@code null}
   */
  public EventData(
      String message,
      Level level,
      String target,
      SourceLocation location,
      Map<String, String> fields,
      Instant timestamp) {
    this(message, level, target, location, fields, timestamp, false);
  }

  private EventData(
      String message,
      Level level,
      String target,
      SourceLocation location,
      Map<String, String> fields,
      Instant timestamp,
      boolean sealed) {
    this.message = Objects.requireNonNull(message, "message");
    this.level = Objects.requireNonNull(level, "level");
    this.target = Objects.requireNonNull(target, "target");
    this.location = location == null ? SourceLocation.unknown() : location;
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    Map<String, String> source = fields == null ? Map.of() : fields;
    this.fields = sealed ? Map.copyOf(source) : new HashMap<>(source);
    this.sealed = sealed;
  }

  /**
   * Adds a field during assembly.
   *
   * @param key field name
   * @param value stringified value
   * @throws IllegalStateException once the data has been sealed into an event
   */
  public void addField(String key, String value) {
    if (sealed) {
      throw new IllegalStateException("event data is sealed");
    }
    fields.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  /**
   * Returns an immutable copy of this data.
   *
   * @return this instance when already sealed; otherwise a sealed copy
   */
  public EventData seal() {
    if (sealed) {
      return this;
    }
    return new EventData(message, level, target, location, fields, timestamp, true);
  }

  public String message() {
    return message;
  }

  public Level level() {
    return level;
  }

  public String target() {
    return target;
  }

  public SourceLocation location() {
    return location;
  }

  public Map<String, String> fields() {
    return sealed ? fields : Collections.unmodifiableMap(fields);
  }

  public Instant timestamp() {
    return timestamp;
  }

  public boolean isSealed() {
    return sealed;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EventData other)) {
      return false;
    }
    return message.equals(other.message)
        && level == other.level
        && target.equals(other.target)
        && location.equals(other.location)
        && fields.equals(other.fields)
        && timestamp.equals(other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(message, level, target, location, fields, timestamp);
  }

  @Override
  public String toString() {
    return "EventData{level=" + level + ", target=" + target + ", message=" + message + '}';
  }
}
