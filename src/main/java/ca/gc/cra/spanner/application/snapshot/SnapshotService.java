package ca.gc.cra.spanner.application.snapshot;

import ca.gc.cra.spanner.application.port.ClockPort;
import ca.gc.cra.spanner.application.port.MetricsPort;
import ca.gc.cra.spanner.application.port.SnapshotCodec;
import ca.gc.cra.spanner.application.port.SnapshotStoragePort;
import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventQuery;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Use case exporting a store's events to a snapshot and rebuilding stores from one.
 * <p><strong>Ordering:</strong> snapshots keep the order they are given, which for store exports is
 * newest-first. Imports replay the document from its last event to its first through
 * {@link EventManager#push(Event)}, so the rebuilt store reads in the same order as the exported one and,
 * when the document holds more events than the store's capacity, the oldest ones are evicted.</p>
 * <p><strong>Delivery:</strong> imported events are history, not live data; they are never published to
 * subscribers.</p>
 * <p><strong>Failure:</strong> unreadable or unwritable files surface as {@link IOException}; readable files
 * that are not valid snapshots surface as {@link SnapshotFormatException}.</p>
 * <p><strong>Observability:</strong> counts {@code snapshot.exported} and {@code snapshot.imported} per
 * snapshot and observes the event count of each under {@code *.events}.</p>
 *
 * @since Spanner 0.1.0
 */
public final class SnapshotService {
  private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

  private final SnapshotCodec codec;
  private final SnapshotStoragePort storage;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final String defaultDescription;

  /**
   * Creates the service with no default description.
   *
   * @param codec document codec; never {@code null}
   * @param storage file storage; never {@code null}
   * @param clock clock stamping export metadata; falls back to {@link ClockPort#SYSTEM} when {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public SnapshotService(
      SnapshotCodec codec, SnapshotStoragePort storage, ClockPort clock, MetricsPort metrics) {
    this(codec, storage, clock, metrics, null);
  }

  /**
   * Creates the service.
   *
   * @param codec document codec; never {@code null}
   * @param storage file storage; never {@code null}
   * @param clock clock stamping export metadata; falls back to {@link ClockPort#SYSTEM} when {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param defaultDescription description written when an export supplies none; blank means none
   */
  public SnapshotService(
      SnapshotCodec codec,
      SnapshotStoragePort storage,
      ClockPort clock,
      MetricsPort metrics,
      String defaultDescription) {
    this.defaultDescription = Strings.blankToNull(defaultDescription);
    this.codec = Objects.requireNonNull(codec, "codec");
    this.storage = Objects.requireNonNull(storage, "storage");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Pairs {@code events} with freshly computed metadata.
   *
   * @param events events in the order they should be written
   * @param description optional description; when blank or {@code null} the service's default description,
   *     if any, is used
   * @return snapshot contents
   */
  public ExportData createExportData(List<Event> events, String description) {
    Objects.requireNonNull(events, "events");
    Map<Level, Integer> counts = new EnumMap<>(Level.class);
    for (Event event : events) {
      counts.merge(event.level(), 1, Integer::sum);
    }
    SortedMap<String, Integer> labelled = new TreeMap<>();
    counts.forEach((level, count) -> labelled.put(level.label(), count));
    ExportMetadata metadata = new ExportMetadata(
        codec.formatVersion(), clock.now(), events.size(), labelled, describe(description));
    return new ExportData(metadata, events);
  }

  /**
   * Encodes every event currently held by {@code source}.
   *
   * @param source store to export
   * @return encoded snapshot
   */
  public byte[] exportToBytes(EventManager source) {
    Objects.requireNonNull(source, "source");
    List<Event> events = source.all();
    byte[] document = codec.encode(createExportData(events, null));
    record("snapshot.exported", events.size());
    return document;
  }

  /**
   * Writes every event currently held by {@code source} to {@code path}.
   *
   * @param source store to export
   * @param path destination file
   * @return number of exported events
   * @throws IOException when the file cannot be written
   */
  public int exportToFile(EventManager source, Path path) throws IOException {
    return exportFilteredToFile(source, path, EventQuery.any(), null);
  }

  /**
   * Writes the events of {@code source} matching {@code query} to {@code path}.
   *
   * @param source store to export
   * @param path destination file
   * @param query filter applied before snapshotting
   * @param description optional description stored in the metadata
   * @return number of exported events
   * @throws IOException when the file cannot be written
   */
  public int exportFilteredToFile(EventManager source, Path path, EventQuery query, String description)
      throws IOException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(query, "query");
    List<Event> events = source.search(query);
    byte[] document = codec.encode(createExportData(events, description));
    storage.write(path, document);
    record("snapshot.exported", events.size());
    log.info("Exported {} events ({} bytes) to {}", events.size(), document.length, path);
    return events.size();
  }

  private String describe(String description) {
    String supplied = Strings.blankToNull(description);
    return supplied == null ? defaultDescription : supplied;
  }

  /**
   * Decodes a snapshot held in memory.
   *
   * @param document encoded snapshot
   * @return decoded contents
   * @throws SnapshotFormatException when the document is not a valid snapshot
   */
  public ExportData decode(byte[] document) throws SnapshotFormatException {
    return codec.decode(Objects.requireNonNull(document, "document"));
  }

  /**
   * Reads and decodes the snapshot at {@code path}.
   *
   * @param path source file
   * @return decoded contents
   * @throws IOException when the file cannot be read
   * @throws SnapshotFormatException when the file is not a valid snapshot
   */
  public ExportData read(Path path) throws IOException, SnapshotFormatException {
    Objects.requireNonNull(path, "path");
    byte[] document = storage.read(path);
    try {
      return codec.decode(document);
    } catch (SnapshotFormatException ex) {
      log.warn("File {} is not a valid snapshot: {}", path, ex.getMessage());
      throw ex;
    }
  }

  /**
   * Builds a new default-capacity store from the snapshot at {@code path}.
   *
   * @param path source file
   * @return store holding the imported events
   * @throws IOException when the file cannot be read
   * @throws SnapshotFormatException when the file is not a valid snapshot
   */
  public EventManager importFromFile(Path path) throws IOException, SnapshotFormatException {
    return importFromFile(path, EventManager.DEFAULT_MAX_EVENTS);
  }

  /**
   * Builds a new store with the given capacity from the snapshot at {@code path}.
   *
   * @param path source file
   * @param maxEvents capacity of the new store
   * @return store holding the imported events
   * @throws IOException when the file cannot be read
   * @throws SnapshotFormatException when the file is not a valid snapshot
   */
  public EventManager importFromFile(Path path, int maxEvents) throws IOException, SnapshotFormatException {
    ExportData data = read(path);
    EventManager manager = new EventManager(maxEvents, metrics);
    int imported = replay(data.events(), manager);
    log.info("Imported {} events from {} into a new store", imported, path);
    return manager;
  }

  /**
   * Replays the snapshot at {@code path} into {@code target} without publishing to its subscribers.
   *
   * @param path source file
   * @param target live store receiving the events
   * @return decoded snapshot and number of events pushed
   * @throws IOException when the file cannot be read
   * @throws SnapshotFormatException when the file is not a valid snapshot
   */
  public MergeResult importAndMerge(Path path, EventManager target) throws IOException, SnapshotFormatException {
    Objects.requireNonNull(target, "target");
    ExportData data = read(path);
    int imported = replay(data.events(), target);
    log.info("Merged {} events from {} into the live store", imported, path);
    return new MergeResult(data, imported);
  }

  private int replay(List<Event> events, EventManager target) {
    for (int i = events.size() - 1; i >= 0; i--) {
      target.push(events.get(i));
    }
    record("snapshot.imported", events.size());
    return events.size();
  }

  private void record(String key, int events) {
    metrics.increment(key);
    metrics.observe(key + ".events", events);
  }
}
