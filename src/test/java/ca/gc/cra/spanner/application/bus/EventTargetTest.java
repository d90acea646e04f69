package ca.gc.cra.spanner.application.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class EventTargetTest {

  @Test
  void handlersRunInSubscriptionOrder() {
    EventTarget<String> bus = new EventTarget<>();
    List<String> calls = new ArrayList<>();
    bus.subscribe(value -> calls.add("first:" + value));
    bus.subscribe(value -> calls.add("second:" + value));

    bus.emit("a");
    bus.emit("b");

    assertEquals(List.of("first:a", "second:a", "first:b", "second:b"), calls);
  }

  @Test
  void unsubscribedHandlerReceivesNothingFurther() {
    EventTarget<Integer> bus = new EventTarget<>();
    List<Integer> seen = new ArrayList<>();
    Subscription<Integer> subscription = bus.subscribe(seen::add);

    bus.emit(1);
    subscription.unsubscribe();
    bus.emit(2);

    assertEquals(List.of(1), seen);
    assertFalse(subscription.isActive());
    assertEquals(0, bus.listenerCount());
  }

  @Test
  void unsubscribeIsIdempotent() {
    EventTarget<Integer> bus = new EventTarget<>();
    Subscription<Integer> subscription = bus.subscribe(value -> {});

    bus.unsubscribe(subscription);
    subscription.close();
    bus.unsubscribe(null);

    assertEquals(0, bus.listenerCount());
  }

  @Test
  void failingHandlerDoesNotStopDelivery() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    EventTarget<String> bus = new EventTarget<>("orders", metrics);
    List<String> seen = new ArrayList<>();
    bus.subscribe(value -> {
      throw new IllegalStateException("boom");
    });
    bus.subscribe(seen::add);

    bus.emit("order-1");

    assertEquals(List.of("order-1"), seen);
    assertEquals(1, metrics.count("orders.bus.handler.failures"));
    assertEquals(1, metrics.count("orders.bus.emitted"));
  }

  @Test
  void handlerMaySubscribeAndEmitReentrantly() {
    EventTarget<String> bus = new EventTarget<>();
    List<String> late = new ArrayList<>();
    AtomicReference<Subscription<String>> self = new AtomicReference<>();
    self.set(bus.subscribe(value -> {
      if (value.equals("first")) {
        bus.subscribe(late::add);
        self.get().unsubscribe();
        bus.emit("nested");
      }
    }));

    bus.emit("first");
    bus.emit("second");

    assertEquals(List.of("nested", "second"), late);
  }

  @Test
  void closeDeactivatesSubscribersAndRejectsNewOnes() {
    EventTarget<String> bus = new EventTarget<>();
    List<String> seen = new ArrayList<>();
    Subscription<String> subscription = bus.subscribe(seen::add);

    bus.close();
    bus.emit("dropped");

    assertTrue(bus.isClosed());
    assertFalse(subscription.isActive());
    assertTrue(seen.isEmpty());
    assertThrows(IllegalStateException.class, () -> bus.subscribe(seen::add));
    assertThrows(IllegalStateException.class, bus::asStream);
  }

  @Test
  void concurrentEmittersDeliverEveryValue() throws Exception {
    EventTarget<Integer> bus = new EventTarget<>();
    List<Integer> seen = new CopyOnWriteArrayList<>();
    bus.subscribe(seen::add);
    int threads = 4;
    int perThread = 250;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        int base = t * perThread;
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return;
          }
          for (int i = 0; i < perThread; i++) {
            bus.emit(base + i);
          }
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
    }
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(threads * perThread, seen.size());
    assertEquals(threads * perThread, seen.stream().distinct().count());
  }
}
