package ca.gc.cra.spanner.application.registry;

import static ca.gc.cra.spanner.testing.Events.event;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class EventRegistryTest {

  @Test
  void uninitializedRegistryDegradesQuietly() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    EventRegistry registry = new EventRegistry(metrics);

    assertFalse(registry.isInitialized());
    assertTrue(registry.manager().isEmpty());
    assertTrue(registry.events().isEmpty());
    assertFalse(registry.emit(event("lost", Level.INFO)));
    assertTrue(registry.globalEvents().isEmpty());
    assertEquals(0, registry.eventCount());
    assertFalse(registry.clear());
    assertEquals("No events captured", registry.summary());
    assertEquals(1, metrics.count("registry.dropped"));
  }

  @Test
  void firstInitializationWins() {
    EventRegistry registry = new EventRegistry();

    EventManager first = registry.initialize(5);
    EventManager second = registry.initialize(500);

    assertSame(first, second);
    assertEquals(5, second.maxEvents());
    assertFalse(registry.install(new EventManager(10)));
  }

  @Test
  void reinitializationKeepsSubscriptions() {
    EventRegistry registry = new EventRegistry();
    List<Event> seen = new ArrayList<>();
    registry.initialize().events().subscribe(seen::add);

    registry.initialize(3);
    registry.emit(event("kept", Level.INFO));

    assertEquals(1, seen.size());
  }

  @Test
  void emitStoresAndPublishes() {
    EventRegistry registry = new EventRegistry();
    registry.initialize(10);
    List<Event> seen = new ArrayList<>();
    registry.events().orElseThrow().subscribe(seen::add);

    assertTrue(registry.emit(event("one", Level.WARN)));
    registry.ingest(event("two", Level.INFO));

    assertEquals(2, registry.eventCount());
    assertEquals(2, seen.size());
    assertEquals("two", registry.globalEvents().get(0).message());
    assertEquals("Event Summary: 2 total events\n  WARN: 1\n  INFO: 1\n", registry.summary());
    assertTrue(registry.clear());
    assertEquals(0, registry.eventCount());
  }

  @Test
  void installAcceptsPrebuiltManagerOnce() {
    EventRegistry registry = new EventRegistry();
    EventManager manager = new EventManager(4);

    assertTrue(registry.install(manager));
    assertSame(manager, registry.initialize());
  }

  @Test
  void racingInitializersAgreeOnOneManager() throws Exception {
    EventRegistry registry = new EventRegistry();
    Set<EventManager> winners = ConcurrentHashMap.newKeySet();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int i = 0; i < 8; i++) {
        int capacity = 10 + i;
        pool.execute(() -> {
          try {
            start.await();
            winners.add(registry.initialize(capacity));
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
    }
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(1, winners.size());
    assertSame(winners.iterator().next(), registry.manager().orElseThrow());
  }
}
