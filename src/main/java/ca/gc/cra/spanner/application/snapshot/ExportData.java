package ca.gc.cra.spanner.application.snapshot;

import ca.gc.cra.spanner.domain.trace.Event;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot contents: metadata plus the exported events in the order they were given.
 *
 * @param metadata summary metadata; never {@code null}
 * @param events exported events; never {@code null}
 * @since Spanner 0.1.0
 */
public record ExportData(ExportMetadata metadata, List<Event> events) {
  /**
   * Validates invariants and copies the event list.
   */
  public ExportData {
    metadata = Objects.requireNonNull(metadata, "metadata");
    events = List.copyOf(Objects.requireNonNull(events, "events"));
  }
}
