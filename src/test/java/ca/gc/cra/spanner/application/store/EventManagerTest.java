package ca.gc.cra.spanner.application.store;

import static ca.gc.cra.spanner.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.EventQuery;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SpanInfo;
import ca.gc.cra.spanner.testing.Events;
import ca.gc.cra.spanner.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventManagerTest {

  @Test
  void evictsOldestWhenCapacityExceeded() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    EventManager manager = new EventManager(2, metrics);
    Event a = event("A", Level.INFO);
    Event b = event("B", Level.INFO);
    Event c = event("C", Level.INFO);

    manager.emit(a);
    manager.emit(b);
    manager.emit(c);

    assertEquals(List.of(c, b), manager.all());
    assertEquals(3, metrics.count("store.pushed"));
    assertEquals(1, metrics.count("store.evicted"));
  }

  @Test
  void sizeNeverExceedsCapacityAndKeepsNewest() {
    int capacity = 7;
    EventManager manager = new EventManager(capacity);
    List<Event> pushed = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      Event e = event("m" + i, Level.values()[i % Level.values().length]);
      pushed.add(e);
      manager.push(e);
      assertTrue(manager.size() <= capacity);
    }

    List<Event> expected = new ArrayList<>(pushed.subList(pushed.size() - capacity, pushed.size()));
    Collections.reverse(expected);
    assertEquals(expected, manager.all());
  }

  @Test
  void levelCountsAndSummary() {
    EventManager manager = new EventManager(10);
    manager.emit(event("1", Level.INFO));
    manager.emit(event("2", Level.ERROR));
    manager.emit(event("3", Level.INFO));
    manager.emit(event("4", Level.WARN));

    Map<Level, Integer> counts = manager.levelCounts();
    assertEquals(2, counts.get(Level.INFO));
    assertEquals(1, counts.get(Level.ERROR));
    assertEquals(1, counts.get(Level.WARN));
    assertEquals(0, counts.get(Level.DEBUG));
    assertEquals(List.of("2"), manager.byLevel(Level.ERROR).stream().map(Event::message).toList());
    assertEquals(List.of("3", "1"), manager.byLevel(Level.INFO).stream().map(Event::message).toList());
    for (Level level : Level.values()) {
      assertEquals(manager.byLevel(level), manager.search(EventQuery.level(level)), level.label());
    }
    assertEquals("Event Summary: 4 total events\n  ERROR: 1\n  WARN: 1\n  INFO: 2\n", manager.summary());
  }

  @Test
  void emitPublishesToSubscribersAfterStoring() {
    EventManager manager = new EventManager(5);
    List<Integer> sizesSeen = new ArrayList<>();
    manager.events().subscribe(e -> sizesSeen.add(manager.size()));

    manager.emit(event("x", Level.INFO));
    manager.push(event("silent", Level.INFO));

    assertEquals(List.of(1), sizesSeen);
    assertEquals(2, manager.size());
  }

  @Test
  void queriesFilterByTargetSpanThreadAndCorrelation() {
    EventManager manager = new EventManager(10);
    SpanInfo span = SpanInfo.enter(1L, "checkout_flow", "app::shop", Level.INFO, null, Events.T0);
    Event inSpan = Event.builder(new EventData("charged", Level.INFO, "app::payments"))
        .spanStack(List.of(span))
        .thread("7", "worker-7")
        .correlationId("corr-a")
        .build();
    Event other = Event.builder(new EventData("listed", Level.DEBUG, "app::catalog"))
        .thread("8", "worker-8")
        .correlationId("corr-b")
        .build();
    manager.push(inSpan);
    manager.push(other);

    assertEquals(List.of(inSpan), manager.byTarget("payments"));
    assertEquals(List.of(inSpan), manager.bySpan("checkout"));
    assertEquals(List.of(other), manager.byThread("8"));
    assertEquals(List.of(other), manager.byCorrelationId("corr-b"));
    assertEquals(List.of(inSpan), manager.search(new EventQuery(Level.INFO, "app", "charged", "flow")));
    assertEquals(List.of(other, inSpan), manager.search(EventQuery.any()));
  }

  @Test
  void recentReturnsNewestFirst() {
    EventManager manager = new EventManager(10);
    Event first = event("first", Level.INFO);
    Event second = event("second", Level.INFO);
    Event third = event("third", Level.INFO);
    manager.push(first);
    manager.push(second);
    manager.push(third);

    assertEquals(List.of(third, second), manager.recent(2));
    assertEquals(3, manager.recent(100).size());
    assertTrue(manager.recent(0).isEmpty());
  }

  @Test
  void sameInstanceIsSharedWithSubscribers() {
    EventManager manager = new EventManager(3);
    List<Event> delivered = new ArrayList<>();
    manager.events().subscribe(delivered::add);
    Event e = event("shared", Level.INFO);

    manager.emit(e);

    assertSame(manager.all().get(0), delivered.get(0));
  }

  @Test
  void clearEmptiesStore() {
    EventManager manager = new EventManager(3);
    manager.push(event("x", Level.INFO));

    manager.clear();

    assertTrue(manager.isEmpty());
    assertEquals("Event Summary: 0 total events\n", manager.summary());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new EventManager(0));
    assertEquals(EventManager.DEFAULT_MAX_EVENTS, new EventManager().maxEvents());
  }
}
