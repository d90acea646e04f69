package ca.gc.cra.spanner.application.snapshot;

import static ca.gc.cra.spanner.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventQuery;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.infrastructure.snapshot.FileSnapshotStorage;
import ca.gc.cra.spanner.infrastructure.snapshot.JsonSnapshotCodec;
import ca.gc.cra.spanner.testing.MutableClock;
import ca.gc.cra.spanner.testing.RecordingMetricsPort;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotServiceTest {
  private static final Instant EXPORTED_AT = Instant.parse("2024-03-02T08:30:00Z");

  @TempDir Path tempDir;

  private RecordingMetricsPort metrics;
  private SnapshotService service;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    service = new SnapshotService(
        new JsonSnapshotCodec(), new FileSnapshotStorage(), new MutableClock(EXPORTED_AT), metrics);
  }

  private static EventManager storeOf(Event... events) {
    EventManager manager = new EventManager(100);
    for (Event e : events) {
      manager.push(e);
    }
    return manager;
  }

  @Test
  void createExportDataCountsLevels() {
    List<Event> events = List.of(
        event("1", Level.INFO), event("2", Level.ERROR), event("3", Level.INFO), event("4", Level.WARN));

    ExportData data = service.createExportData(events, "nightly");

    ExportMetadata metadata = data.metadata();
    assertEquals(4, metadata.totalEvents());
    assertEquals(Map.of("ERROR", 1, "INFO", 2, "WARN", 1), metadata.levelCounts());
    assertEquals("nightly", metadata.description());
    assertEquals(EXPORTED_AT, metadata.exportTimestamp());
    assertEquals(JsonSnapshotCodec.FORMAT_VERSION, metadata.formatVersion());
  }

  @Test
  void blankDescriptionIsAbsent() {
    assertNull(service.createExportData(List.of(), "  ").metadata().description());
  }

  @Test
  void defaultDescriptionFillsInWhenNoneSupplied() throws Exception {
    SnapshotService described = new SnapshotService(new JsonSnapshotCodec(), new FileSnapshotStorage(),
        new MutableClock(EXPORTED_AT), metrics, "nightly");
    Path file = tempDir.resolve("described.json");

    described.exportToFile(storeOf(event("A", Level.INFO)), file);

    assertEquals("nightly", described.read(file).metadata().description());
    assertEquals("adhoc", described.createExportData(List.of(), "adhoc").metadata().description());
  }

  @Test
  void storeOfCausallyChainedEventsExportsAndImports() throws Exception {
    EventManager source = new EventManager(1_500);
    Event previous = null;
    for (int i = 0; i < 1_200; i++) {
      previous = Event.builder(event("step " + i, Level.INFO).data()).parent(previous).build();
      source.emit(previous);
    }

    ExportData decoded = service.decode(service.exportToBytes(source));

    assertEquals(1_200, decoded.events().size());
    assertEquals(source.all(), decoded.events());
    assertEquals("step 1198", decoded.events().get(0).parent().orElseThrow().message());
  }

  @Test
  void exportThenImportPreservesOrderAndContent() throws Exception {
    EventManager source = storeOf(event("A", Level.INFO), event("B", Level.WARN), event("C", Level.ERROR));
    Path file = tempDir.resolve("events.json");

    int exported = service.exportToFile(source, file);
    EventManager restored = service.importFromFile(file);

    assertEquals(3, exported);
    assertEquals(source.all(), restored.all());
    assertEquals(1, metrics.count("snapshot.exported"));
    assertEquals(1, metrics.count("snapshot.imported"));
    assertEquals(List.of(3L), metrics.observed("snapshot.imported.events"));
  }

  @Test
  void importIntoSmallerStoreKeepsNewest() throws Exception {
    EventManager source = storeOf(event("A", Level.INFO), event("B", Level.INFO), event("C", Level.INFO));
    Path file = tempDir.resolve("events.json");
    service.exportToFile(source, file);

    EventManager restored = service.importFromFile(file, 2);

    assertEquals(List.of("C", "B"), restored.all().stream().map(Event::message).toList());
  }

  @Test
  void filteredExportWritesOnlyMatchesWithDescription() throws Exception {
    EventManager source = storeOf(
        event("ok", Level.INFO), event("bad", Level.ERROR), event("worse", Level.ERROR));
    Path file = tempDir.resolve("errors.json");

    int exported = service.exportFilteredToFile(source, file, EventQuery.level(Level.ERROR), "nightly");
    ExportData data = service.read(file);

    assertEquals(2, exported);
    assertEquals(2, data.metadata().totalEvents());
    assertEquals("nightly", data.metadata().description());
    assertEquals(List.of("worse", "bad"), data.events().stream().map(Event::message).toList());
  }

  @Test
  void mergeDoesNotRedeliverToSubscribers() throws Exception {
    Path file = tempDir.resolve("history.json");
    service.exportToFile(storeOf(event("old-1", Level.INFO), event("old-2", Level.INFO)), file);
    EventManager live = storeOf(event("live", Level.INFO));
    List<Event> delivered = new ArrayList<>();
    live.events().subscribe(delivered::add);

    MergeResult result = service.importAndMerge(file, live);

    assertEquals(2, result.imported());
    assertEquals(3, live.size());
    assertEquals("old-2", live.all().get(0).message());
    assertTrue(delivered.isEmpty());
  }

  @Test
  void exportToBytesDecodesBack() throws Exception {
    EventManager source = storeOf(event("only", Level.DEBUG));

    ExportData data = service.decode(service.exportToBytes(source));

    assertEquals(source.all(), data.events());
  }

  @Test
  void missingFileSurfacesAsIoException() {
    assertThrows(NoSuchFileException.class, () -> service.importFromFile(tempDir.resolve("absent.json")));
  }

  @Test
  void malformedFileSurfacesAsFormatException() throws IOException {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "{\"metadata\": {}", StandardCharsets.UTF_8);

    assertThrows(SnapshotFormatException.class, () -> service.importFromFile(file));
    assertFalse(metrics.count("snapshot.imported") > 0);
  }
}
