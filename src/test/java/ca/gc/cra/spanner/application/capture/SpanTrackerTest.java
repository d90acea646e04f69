package ca.gc.cra.spanner.application.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import ca.gc.cra.spanner.domain.trace.SpanInfo;
import ca.gc.cra.spanner.testing.Events;
import ca.gc.cra.spanner.testing.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SpanTrackerTest {
  private final MutableClock clock = new MutableClock(Events.T0);
  private final SpanTracker tracker = new SpanTracker(clock);

  @Test
  void stackListsOutermostFirst() {
    try (SpanScope outer = tracker.enter("request", "app::http");
        SpanScope inner = tracker.enter("query", "app::db", Level.DEBUG, SourceLocation.unknown())) {
      List<SpanInfo> stack = tracker.stack();

      assertEquals(List.of("request", "query"), stack.stream().map(SpanInfo::name).toList());
      assertEquals("query", tracker.current().orElseThrow().name());
      assertTrue(stack.get(0).isFrozen());
      assertNotEquals(outer.id(), inner.id());
    }
    assertEquals(0, tracker.depth());
    assertTrue(tracker.current().isEmpty());
  }

  @Test
  void closingChildAttachesItToParentWithDuration() {
    try (SpanScope outer = tracker.enter("request", "app::http")) {
      try (SpanScope inner = tracker.enter("query", "app::db")) {
        inner.record("rows", 3);
        clock.advance(Duration.ofMillis(40));
      }

      SpanInfo parent = outer.span();
      assertEquals(1, parent.children().size());
      SpanInfo child = parent.children().get(0);
      assertEquals("query", child.name());
      assertEquals("3", child.fields().get("rows"));
      assertEquals(Duration.ofMillis(40), child.duration().orElseThrow());
    }
  }

  @Test
  void closeIsIdempotentAndRecordAfterCloseFails() {
    SpanScope scope = tracker.enter("once", "app");
    scope.close();
    scope.close();

    assertTrue(scope.isClosed());
    assertThrows(IllegalStateException.class, () -> scope.record("k", "v"));
    assertEquals(0, tracker.depth());
  }

  @Test
  void outOfOrderCloseRemovesOnlyThatSpan() {
    SpanScope outer = tracker.enter("outer", "app");
    SpanScope inner = tracker.enter("inner", "app");

    outer.close();

    assertEquals(List.of("inner"), tracker.stack().stream().map(SpanInfo::name).toList());
    inner.close();
    assertEquals(0, tracker.depth());
  }

  @Test
  void stacksAreThreadConfined() throws Exception {
    try (SpanScope ignored = tracker.enter("main-only", "app")) {
      int otherDepth = CompletableFuture.supplyAsync(tracker::depth).get(5, TimeUnit.SECONDS);

      assertEquals(0, otherDepth);
      assertEquals(1, tracker.depth());
    }
  }

  @Test
  void closeFromAnotherThreadLeavesSpanOpen() throws Exception {
    SpanScope outer = tracker.enter("outer", "app");

    CompletableFuture.runAsync(outer::close).get(5, TimeUnit.SECONDS);

    assertFalse(outer.isClosed());
    assertEquals(1, tracker.depth());
    assertTrue(tracker.current().orElseThrow().isActive());
    try (SpanScope inner = tracker.enter("inner", "app")) {
      inner.record("step", 1);
    }
    assertEquals(List.of("inner"), outer.span().children().stream().map(SpanInfo::name).toList());
    outer.close();
    assertTrue(outer.isClosed());
    assertEquals(0, tracker.depth());
  }

  @Test
  void blankNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> tracker.enter(" ", "app"));
    assertThrows(NullPointerException.class, () -> tracker.enter(null, "app"));
    assertEquals(0, tracker.depth());
  }
}
