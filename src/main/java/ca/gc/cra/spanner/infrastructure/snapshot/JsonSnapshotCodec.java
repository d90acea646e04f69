package ca.gc.cra.spanner.infrastructure.snapshot;

import ca.gc.cra.spanner.application.port.SnapshotCodec;
import ca.gc.cra.spanner.application.snapshot.ExportData;
import ca.gc.cra.spanner.application.snapshot.ExportMetadata;
import ca.gc.cra.spanner.application.snapshot.SnapshotFormatException;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import ca.gc.cra.spanner.domain.trace.SpanInfo;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> {@link SnapshotCodec} writing snapshots as a single JSON document with Jackson's
 * streaming API.
 * <p><strong>Layout:</strong> {@code {"metadata": {...}, "events": [...]}} with snake_case keys. Timestamps
 * are ISO-8601 instants at full precision and optional values are omitted when absent. Span trees nest
 * recursively. Parent events are written once each into a flat {@code parents} table, oldest first, and
 * linked by {@code parent_ref} indexes, so a parent always precedes the entries that refer to it.</p>
 * <p><strong>Compatibility:</strong> documents with the same major format version are accepted; unknown
 * keys are ignored. A missing or malformed required field, or a {@code total_events} value that disagrees
 * with the number of events, fails the decode.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 *
 * @since Spanner 0.1.0
 */
public final class JsonSnapshotCodec implements SnapshotCodec {
  /** Format version written into every snapshot. */
  public static final String FORMAT_VERSION = "1.0";

  private final JsonFactory jsonFactory = new JsonFactory();
  private final JsonTree tree = new JsonTree(jsonFactory);

  @Override
  public String formatVersion() {
    return FORMAT_VERSION;
  }

  @Override
  public byte[] encode(ExportData data) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(4_096);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      writeMetadata(gen, data.metadata());
      Map<Event, Integer> parentIndex = new IdentityHashMap<>();
      List<Event> parents = parentTable(data.events(), parentIndex);
      if (!parents.isEmpty()) {
        gen.writeArrayFieldStart("parents");
        for (Event parent : parents) {
          writeEvent(gen, parent, parentIndex);
        }
        gen.writeEndArray();
      }
      gen.writeArrayFieldStart("events");
      for (Event event : data.events()) {
        writeEvent(gen, event, parentIndex);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode snapshot in memory", ex);
    }
    return out.toByteArray();
  }

  private void writeMetadata(JsonGenerator gen, ExportMetadata metadata) throws IOException {
    gen.writeObjectFieldStart("metadata");
    gen.writeStringField("format_version", metadata.formatVersion());
    gen.writeStringField("export_timestamp", metadata.exportTimestamp().toString());
    gen.writeNumberField("total_events", metadata.totalEvents());
    gen.writeObjectFieldStart("level_counts");
    for (Map.Entry<String, Integer> entry : metadata.levelCounts().entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    if (metadata.description() != null) {
      gen.writeStringField("description", metadata.description());
    }
    gen.writeEndObject();
  }

  /**
   * Collects every distinct ancestor of {@code events}, oldest first, assigning each its table index.
   * Ancestors are matched by identity, so a chain shared by many events is written once.
   */
  private static List<Event> parentTable(List<Event> events, Map<Event, Integer> index) {
    List<Event> table = new ArrayList<>();
    Deque<Event> pending = new ArrayDeque<>();
    for (Event event : events) {
      Event ancestor = event.parent().orElse(null);
      while (ancestor != null && !index.containsKey(ancestor)) {
        pending.push(ancestor);
        ancestor = ancestor.parent().orElse(null);
      }
      while (!pending.isEmpty()) {
        Event next = pending.pop();
        index.put(next, table.size());
        table.add(next);
      }
    }
    return table;
  }

  private void writeEvent(JsonGenerator gen, Event event, Map<Event, Integer> parentIndex) throws IOException {
    gen.writeStartObject();
    writeEventData(gen, event.data());
    gen.writeArrayFieldStart("span_stack");
    for (SpanInfo span : event.spanStack()) {
      writeSpan(gen, span);
    }
    gen.writeEndArray();
    if (event.currentSpan().isPresent()) {
      gen.writeFieldName("current_span");
      writeSpan(gen, event.currentSpan().get());
    }
    writeOptional(gen, "thread_id", event.threadId().orElse(null));
    writeOptional(gen, "thread_name", event.threadName().orElse(null));
    if (event.processId().isPresent()) {
      gen.writeNumberField("process_id", event.processId().get());
    }
    writeOptional(gen, "correlation_id", event.correlationId().orElse(null));
    writeStringMap(gen, "custom_metadata", event.customMetadata());
    if (event.parent().isPresent()) {
      gen.writeNumberField("parent_ref", parentIndex.get(event.parent().get()));
    }
    gen.writeEndObject();
  }

  private void writeEventData(JsonGenerator gen, EventData data) throws IOException {
    gen.writeObjectFieldStart("event_data");
    gen.writeStringField("message", data.message());
    gen.writeStringField("level", data.level().label());
    gen.writeStringField("target", data.target());
    writeLocation(gen, data.location());
    writeStringMap(gen, "fields", data.fields());
    gen.writeStringField("timestamp", data.timestamp().toString());
    gen.writeEndObject();
  }

  private void writeSpan(JsonGenerator gen, SpanInfo span) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("id", span.id());
    gen.writeStringField("name", span.name());
    gen.writeStringField("target", span.target());
    gen.writeStringField("level", span.level().label());
    writeLocation(gen, span.location());
    writeStringMap(gen, "fields", span.fields());
    gen.writeStringField("entered_at", span.enteredAt().toString());
    if (span.exitedAt().isPresent()) {
      gen.writeStringField("exited_at", span.exitedAt().get().toString());
    }
    if (span.duration().isPresent()) {
      gen.writeNumberField("duration_nanos", span.duration().get().toNanos());
    }
    gen.writeArrayFieldStart("children");
    for (SpanInfo child : span.children()) {
      writeSpan(gen, child);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private void writeLocation(JsonGenerator gen, SourceLocation location) throws IOException {
    writeOptional(gen, "file", location.file());
    if (location.line() != null) {
      gen.writeNumberField("line", location.line());
    }
    writeOptional(gen, "module_path", location.modulePath());
  }

  private void writeStringMap(JsonGenerator gen, String name, Map<String, String> values) throws IOException {
    gen.writeObjectFieldStart(name);
    for (Map.Entry<String, String> entry : new TreeMap<>(values).entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private void writeOptional(JsonGenerator gen, String name, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(name, value);
    }
  }

  @Override
  public ExportData decode(byte[] document) throws SnapshotFormatException {
    Map<String, Object> root = object(tree.parse(document), "snapshot");
    ExportMetadata metadata = readMetadata(object(required(root, "metadata", "snapshot"), "metadata"));
    List<Object> rawParents = root.get("parents") == null ? List.of() : array(root.get("parents"), "parents");
    List<Event> parents = new ArrayList<>(rawParents.size());
    for (int i = 0; i < rawParents.size(); i++) {
      String path = "parents[" + i + "]";
      parents.add(readEvent(object(rawParents.get(i), path), path, parents));
    }
    List<Object> rawEvents = array(required(root, "events", "snapshot"), "events");
    List<Event> events = new ArrayList<>(rawEvents.size());
    for (int i = 0; i < rawEvents.size(); i++) {
      String path = "events[" + i + "]";
      events.add(readEvent(object(rawEvents.get(i), path), path, parents));
    }
    if (metadata.totalEvents() != events.size()) {
      throw new SnapshotFormatException("metadata.total_events is " + metadata.totalEvents()
          + " but the snapshot holds " + events.size() + " events");
    }
    return new ExportData(metadata, events);
  }

  private ExportMetadata readMetadata(Map<String, Object> node) throws SnapshotFormatException {
    String version = string(node, "format_version", "metadata");
    if (!majorVersion(version).equals(majorVersion(FORMAT_VERSION))) {
      throw new SnapshotFormatException("Unsupported snapshot format version " + version
          + " (expected " + FORMAT_VERSION + ")");
    }
    Instant exported = instant(node, "export_timestamp", "metadata");
    long total = integer(node, "total_events", "metadata");
    if (total < 0 || total > Integer.MAX_VALUE) {
      throw new SnapshotFormatException("metadata.total_events is out of range: " + total);
    }
    Map<String, Object> rawCounts = object(required(node, "level_counts", "metadata"), "metadata.level_counts");
    SortedMap<String, Integer> counts = new TreeMap<>();
    for (Map.Entry<String, Object> entry : rawCounts.entrySet()) {
      counts.put(entry.getKey(), (int) integer(rawCounts, entry.getKey(), "metadata.level_counts"));
    }
    String description = optionalString(node, "description", "metadata");
    return new ExportMetadata(version, exported, (int) total, counts, description);
  }

  /**
   * Rebuilds one event.
   *
   * @param resolved parents decoded so far; a {@code parent_ref} may only point into this list
   */
  private Event readEvent(Map<String, Object> node, String path, List<Event> resolved)
      throws SnapshotFormatException {
    EventData data = readEventData(object(required(node, "event_data", path), path + ".event_data"),
        path + ".event_data");
    Event.Builder builder = Event.builder(data);
    List<Object> rawStack = array(required(node, "span_stack", path), path + ".span_stack");
    List<SpanInfo> stack = new ArrayList<>(rawStack.size());
    for (int i = 0; i < rawStack.size(); i++) {
      String spanPath = path + ".span_stack[" + i + "]";
      stack.add(readSpan(object(rawStack.get(i), spanPath), spanPath));
    }
    builder.spanStack(stack);
    Object current = node.get("current_span");
    if (current != null) {
      builder.currentSpan(readSpan(object(current, path + ".current_span"), path + ".current_span"));
    }
    builder.thread(optionalString(node, "thread_id", path), optionalString(node, "thread_name", path));
    if (node.get("process_id") != null) {
      builder.processId(integer(node, "process_id", path));
    }
    builder.correlationId(optionalString(node, "correlation_id", path));
    builder.metadata(stringMap(node, "custom_metadata", path));
    if (node.get("parent_ref") != null) {
      long ref = integer(node, "parent_ref", path);
      if (ref < 0 || ref >= resolved.size()) {
        throw new SnapshotFormatException(path + ".parent_ref " + ref + " does not name an earlier parent");
      }
      builder.parent(resolved.get((int) ref));
    }
    return builder.build();
  }

  private EventData readEventData(Map<String, Object> node, String path) throws SnapshotFormatException {
    return new EventData(
        string(node, "message", path),
        level(node, path),
        string(node, "target", path),
        readLocation(node, path),
        stringMap(node, "fields", path),
        instant(node, "timestamp", path));
  }

  private SpanInfo readSpan(Map<String, Object> node, String path) throws SnapshotFormatException {
    Instant entered = instant(node, "entered_at", path);
    Instant exited = node.get("exited_at") == null ? null : instant(node, "exited_at", path);
    if (exited != null && exited.isBefore(entered)) {
      throw new SnapshotFormatException(path + ".exited_at precedes entered_at");
    }
    List<Object> rawChildren = array(required(node, "children", path), path + ".children");
    List<SpanInfo> children = new ArrayList<>(rawChildren.size());
    for (int i = 0; i < rawChildren.size(); i++) {
      String childPath = path + ".children[" + i + "]";
      children.add(readSpan(object(rawChildren.get(i), childPath), childPath));
    }
    return SpanInfo.restore(
        integer(node, "id", path),
        string(node, "name", path),
        string(node, "target", path),
        level(node, path),
        readLocation(node, path),
        stringMap(node, "fields", path),
        entered,
        exited,
        children);
  }

  private SourceLocation readLocation(Map<String, Object> node, String path) throws SnapshotFormatException {
    String file = optionalString(node, "file", path);
    Integer line = node.get("line") == null ? null : (int) integer(node, "line", path);
    String module = optionalString(node, "module_path", path);
    if (file == null && line == null && module == null) {
      return SourceLocation.unknown();
    }
    return new SourceLocation(file, line, module);
  }

  private static Object required(Map<String, Object> node, String key, String path) throws SnapshotFormatException {
    Object value = node.get(key);
    if (value == null) {
      throw new SnapshotFormatException("Missing required field " + path + "." + key);
    }
    return value;
  }

  private static Map<String, Object> object(Object value, String path) throws SnapshotFormatException {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new SnapshotFormatException(path + " must be an object");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return map;
  }

  private static List<Object> array(Object value, String path) throws SnapshotFormatException {
    if (!(value instanceof List<?> raw)) {
      throw new SnapshotFormatException(path + " must be an array");
    }
    return new ArrayList<>(raw);
  }

  private static String string(Map<String, Object> node, String key, String path) throws SnapshotFormatException {
    Object value = required(node, key, path);
    if (!(value instanceof String text)) {
      throw new SnapshotFormatException(path + "." + key + " must be a string");
    }
    return text;
  }

  private static String optionalString(Map<String, Object> node, String key, String path)
      throws SnapshotFormatException {
    return node.get(key) == null ? null : string(node, key, path);
  }

  private static long integer(Map<String, Object> node, String key, String path) throws SnapshotFormatException {
    Object value = required(node, key, path);
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number) {
      throw new SnapshotFormatException(path + "." + key + " must be a 64-bit integer");
    }
    throw new SnapshotFormatException(path + "." + key + " must be a number");
  }

  private static Instant instant(Map<String, Object> node, String key, String path) throws SnapshotFormatException {
    String raw = string(node, key, path);
    try {
      return Instant.parse(raw);
    } catch (DateTimeParseException ex) {
      throw new SnapshotFormatException(path + "." + key + " is not an ISO-8601 instant: " + raw, ex);
    }
  }

  private static Level level(Map<String, Object> node, String path) throws SnapshotFormatException {
    String raw = string(node, "level", path);
    try {
      return Level.parse(raw);
    } catch (IllegalArgumentException ex) {
      throw new SnapshotFormatException(path + ".level is not a known level: " + raw, ex);
    }
  }

  private static Map<String, String> stringMap(Map<String, Object> node, String key, String path)
      throws SnapshotFormatException {
    Map<String, Object> raw = object(required(node, key, path), path + "." + key);
    Map<String, String> result = new TreeMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      if (!(entry.getValue() instanceof String text)) {
        throw new SnapshotFormatException(path + "." + key + "." + entry.getKey() + " must be a string");
      }
      result.put(entry.getKey(), text);
    }
    return result;
  }

  private static String majorVersion(String version) {
    int dot = version.indexOf('.');
    return dot < 0 ? version.trim() : version.substring(0, dot).trim();
  }
}
