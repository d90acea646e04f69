package ca.gc.cra.spanner.application.capture;

import ca.gc.cra.spanner.application.port.ClockPort;
import ca.gc.cra.spanner.domain.trace.Event;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Builds {@link Event}s from raw trace data and the calling thread's context.
 * <p><strong>Context:</strong> {@link #capture(EventData)} stamps the thread id and name, the process id, a
 * fresh correlation id and the span stack tracked by {@link SpanTracker}.</p>
 * <p><strong>Correlation ids:</strong> {@code corr-<epoch seconds>-<nanos>-<sequence>}, all hexadecimal; the
 * sequence keeps ids unique when two events share a clock reading.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each thread sees its own span stack.</p>
 *
 * @since Spanner 0.1.0
 */
public final class EventFactory {
  private static final long PROCESS_ID = ProcessHandle.current().pid();

  private final ClockPort clock;
  private final SpanTracker spans;
  private final AtomicLong sequence = new AtomicLong();

  /**
   * @param clock clock stamping events; falls back to {@link ClockPort#SYSTEM} when {@code null}
   * @param spans span tracker supplying the active stack; never {@code null}
   */
  public EventFactory(ClockPort clock, SpanTracker spans) {
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.spans = Objects.requireNonNull(spans, "spans");
  }

  /**
   * Builds event data from a trace record, stamped with the factory clock.
   *
   * @param message rendered message
   * @param level event level
   * @param target logical module name
   * @param location source position; {@code null} means unknown
   * @param fields recorded fields; {@code null} means none
   * @return unsealed event data
   */
  public EventData fromTrace(
      String message, Level level, String target, SourceLocation location, Map<String, String> fields) {
    return new EventData(message, level, target, location, fields, clock.now());
  }

  /**
   * Wraps {@code data} with the calling thread's context.
   *
   * @param data payload
   * @return immutable event
   */
  public Event capture(EventData data) {
    return contextBuilder(data).build();
  }

  /**
   * Starts an event builder pre-populated with the calling thread's context, for callers that add a
   * parent link or custom metadata.
   *
   * @param data payload
   * @return builder with span, thread, process and correlation context set
   */
  public Event.Builder contextBuilder(EventData data) {
    Thread thread = Thread.currentThread();
    return Event.builder(Objects.requireNonNull(data, "data"))
        .spanStack(spans.stack())
        .currentSpan(spans.current().orElse(null))
        .thread(Long.toString(thread.getId()), thread.getName())
        .processId(PROCESS_ID)
        .correlationId(nextCorrelationId());
  }

  String nextCorrelationId() {
    Instant now = clock.now();
    return "corr-" + Long.toHexString(now.getEpochSecond())
        + '-' + Integer.toHexString(now.getNano())
        + '-' + Long.toHexString(sequence.incrementAndGet());
  }
}
