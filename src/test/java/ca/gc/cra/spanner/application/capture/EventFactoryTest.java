package ca.gc.cra.spanner.application.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import ca.gc.cra.spanner.domain.trace.SpanInfo;
import ca.gc.cra.spanner.testing.Events;
import ca.gc.cra.spanner.testing.MutableClock;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventFactoryTest {
  private final MutableClock clock = new MutableClock(Events.T0);
  private final SpanTracker spans = new SpanTracker(clock);
  private final EventFactory factory = new EventFactory(clock, spans);

  @Test
  void fromTraceStampsFactoryClock() {
    EventData data = factory.fromTrace("started", Level.INFO, "app::main",
        new SourceLocation("Main.java", 10, "app::main"), Map.of("port", "8080"));

    assertEquals(Events.T0, data.timestamp());
    assertEquals("8080", data.fields().get("port"));
    assertEquals(10, data.location().line());
  }

  @Test
  void captureAddsThreadProcessCorrelationAndSpans() {
    Event event;
    try (SpanScope outer = spans.enter("request", "app::http");
        SpanScope inner = spans.enter("render", "app::web")) {
      event = factory.capture(factory.fromTrace("rendered", Level.DEBUG, "app::web", null, null));
    }

    Thread current = Thread.currentThread();
    assertEquals(String.valueOf(current.getId()), event.threadId().orElseThrow());
    assertEquals(current.getName(), event.threadName().orElseThrow());
    assertEquals(ProcessHandle.current().pid(), event.processId().orElseThrow());
    assertTrue(event.correlationId().orElseThrow().startsWith("corr-"));
    assertEquals(2, event.spanStack().size());
    SpanInfo currentSpan = event.currentSpan().orElseThrow();
    assertEquals("render", currentSpan.name());
    assertTrue(currentSpan.isActive(), "captured span stays active in the snapshot");
  }

  @Test
  void correlationIdsAreUniqueForSameInstant() {
    assertNotEquals(factory.nextCorrelationId(), factory.nextCorrelationId());
  }

  @Test
  void contextBuilderAcceptsParentLink() {
    Event parent = factory.capture(factory.fromTrace("first", Level.INFO, "app", null, null));

    Event child = factory.contextBuilder(factory.fromTrace("second", Level.INFO, "app", null, null))
        .parent(parent)
        .build();

    assertEquals(parent, child.parent().orElseThrow());
  }
}
