package ca.gc.cra.spanner.testing;

import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import java.time.Instant;
import java.util.Map;

/**
 * Event fixtures.
 */
public final class Events {
  public static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

  private Events() {}

  public static Event event(String message, Level level, String target) {
    return Event.of(new EventData(message, level, target, SourceLocation.unknown(), Map.of(), T0));
  }

  public static Event event(String message, Level level) {
    return event(message, level, "app::test");
  }
}
