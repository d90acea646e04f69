package ca.gc.cra.spanner.application.port;

import ca.gc.cra.spanner.domain.trace.Event;

/**
 * <strong>What:</strong> Inbound port through which instrumentation adapters hand captured events to the
 * core.
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls from every instrumented
 * thread.</p>
 * <p><strong>Performance:</strong> Called on the instrumented code's hot path; must not block on I/O.</p>
 *
 * @since Spanner 0.1.0
 */
public interface EventIngestPort {
  /**
   * Accepts one captured event.
   *
   * @param event event payload; never {@code null}
   */
  void ingest(Event event);

  /**
   * Port that discards every event, for disabled capture.
   */
  EventIngestPort NO_OP = event -> {};
}
