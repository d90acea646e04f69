package ca.gc.cra.spanner.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventTest {
  private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

  private static EventData data(String message, Level level, String target) {
    return new EventData(message, level, target, SourceLocation.unknown(), Map.of(), T0);
  }

  @Test
  void buildSealsDataAndSnapshotsSpans() {
    EventData data = data("db timeout", Level.ERROR, "app::db");
    data.addField("retries", "3");
    SpanInfo active = SpanInfo.enter(1L, "request", "app::http", Level.INFO, null, T0);
    List<SpanInfo> stack = new ArrayList<>(List.of(active));

    Event event = Event.builder(data).spanStack(stack).currentSpan(active).build();
    active.addField("late", "value");
    stack.clear();

    assertTrue(event.data().isSealed());
    assertEquals(Map.of("retries", "3"), event.data().fields());
    assertThrows(IllegalStateException.class, () -> event.data().addField("x", "y"));
    assertEquals(1, event.spanStack().size());
    assertTrue(event.spanStack().get(0).fields().isEmpty());
    assertTrue(event.currentSpan().orElseThrow().isFrozen());
  }

  @Test
  void matchesRequiresEveryPresentCriterion() {
    SpanInfo span = SpanInfo.enter(1L, "checkout_flow", "app::shop", Level.INFO, null, T0);
    Event event = Event.builder(data("payment declined", Level.WARN, "app::payments"))
        .spanStack(List.of(span))
        .build();

    assertTrue(event.matches(EventQuery.any()));
    assertTrue(event.matches(new EventQuery(Level.WARN, "payments", "declined", "checkout")));
    assertFalse(event.matches(EventQuery.level(Level.ERROR)));
    assertFalse(event.matches(new EventQuery(Level.WARN, "payments", "approved", null)));
    assertFalse(event.matches(EventQuery.span("refund")));
  }

  @Test
  void spanFilterAlsoConsidersCurrentSpan() {
    SpanInfo current = SpanInfo.enter(4L, "render_page", "app::web", Level.DEBUG, null, T0);
    Event event = Event.builder(data("rendered", Level.INFO, "app::web")).currentSpan(current).build();

    assertTrue(event.hasSpanNamed("render"));
    assertTrue(EventQuery.span("page").test(event));
  }

  @Test
  void spanTreeIndentsStackByDepth() {
    SpanInfo outer = SpanInfo.enter(1L, "request", "app::http", Level.INFO, null, T0);
    outer.addField("path", "/orders");
    SpanInfo inner = SpanInfo.enter(2L, "query", "app::db", Level.DEBUG, null, T0);
    inner.exit(T0.plusMillis(12));
    Event event = Event.builder(data("done", Level.INFO, "app::http"))
        .spanStack(List.of(outer, inner))
        .currentSpan(inner)
        .build();

    String tree = event.spanTree();

    assertTrue(tree.startsWith("Current Span: query (DEBUG)\nSpan Stack:\n"), tree);
    assertTrue(tree.contains("├─ request (INFO) [active] { path=/orders }\n"), tree);
    assertTrue(tree.contains("\n  ├─ query (DEBUG) [12.00ms]\n"), tree);
  }

  @Test
  void spanTreeIsEmptyWithoutSpans() {
    assertEquals("", Event.of(data("plain", Level.INFO, "app")).spanTree());
  }

  @Test
  void fullContextWalksParentChain() {
    Event root = Event.builder(data("connection opened", Level.INFO, "app::net"))
        .correlationId("corr-1")
        .build();
    Event child = Event.builder(data("connection reset", Level.ERROR, "app::net"))
        .thread("17", "worker-1")
        .processId(4242L)
        .metadata("tenant", "acme")
        .parent(root)
        .build();

    String context = child.fullContext();

    assertTrue(context.startsWith("Event: connection reset (ERROR)\n"), context);
    assertTrue(context.contains("Thread: 17 (worker-1)\n"));
    assertTrue(context.contains("Process ID: 4242\n"));
    assertTrue(context.contains("Metadata:\n  tenant: acme\n"));
    int separator = context.indexOf("--- Parent Event ---");
    assertTrue(separator > 0);
    assertTrue(context.indexOf("Event: connection opened (INFO)") > separator);
    assertTrue(context.contains("Correlation ID: corr-1\n"));
  }

  @Test
  void equalityCoversContextAndParent() {
    Event parent = Event.of(data("a", Level.INFO, "t"));
    Event first = Event.builder(data("b", Level.INFO, "t")).correlationId("c").parent(parent).build();
    Event second = Event.builder(data("b", Level.INFO, "t")).correlationId("c").parent(parent).build();
    Event orphan = Event.builder(data("b", Level.INFO, "t")).correlationId("c").build();

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertFalse(first.equals(orphan));
  }

  @Test
  void equalityOfLongChainsComparesEveryLink() {
    Event left = null;
    Event right = null;
    for (int i = 0; i < 50_000; i++) {
      left = Event.builder(data("step " + i, Level.DEBUG, "t")).parent(left).build();
      right = Event.builder(data("step " + i, Level.DEBUG, "t")).parent(right).build();
    }
    Event divergentRoot = Event.of(data("other", Level.DEBUG, "t"));
    Event divergent = divergentRoot;
    for (int i = 1; i < 50_000; i++) {
      divergent = Event.builder(data("step " + i, Level.DEBUG, "t")).parent(divergent).build();
    }

    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());
    assertFalse(left.equals(divergent));
  }

  @Test
  void formatDurationPicksUnit() {
    assertEquals("999ns", EventFormatter.formatDuration(Duration.ofNanos(999)));
    assertEquals("1.50µs", EventFormatter.formatDuration(Duration.ofNanos(1_500)));
    assertEquals("2.00ms", EventFormatter.formatDuration(Duration.ofMillis(2)));
    assertEquals("3.25s", EventFormatter.formatDuration(Duration.ofMillis(3_250)));
  }
}
