package ca.gc.cra.spanner.infrastructure.logback;

import ca.gc.cra.spanner.application.capture.EventFactory;
import ca.gc.cra.spanner.application.port.EventIngestPort;
import ca.gc.cra.spanner.domain.trace.EventData;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.event.KeyValuePair;

/**
 * <strong>What:</strong> Logback appender that turns logging events into captured {@code Event}s.
 * <p><strong>Mapping:</strong> the formatted message becomes the message, the logger name the target, MDC
 * entries and SLF4J key/value pairs the fields (key/value pairs win on collision). A throwable is recorded
 * under the {@code exception} field. When {@link #setIncludeCallerData(boolean)} is on, the first caller frame
 * becomes the source location.</p>
 * <p><strong>Re-entrancy:</strong> anything logged while an event is being ingested on the same thread, such
 * as a subscriber's own log output, is not captured again.</p>
 * <p><strong>Thread-safety:</strong> {@link AppenderBase} serializes {@link #append(ILoggingEvent)}.</p>
 *
 * @since Spanner 0.1.0
 */
public final class SpannerAppender extends AppenderBase<ILoggingEvent> {
  static final String EXCEPTION_FIELD = "exception";

  private final ThreadLocal<Boolean> ingesting = ThreadLocal.withInitial(() -> Boolean.FALSE);
  private final EventIngestPort sink;
  private final EventFactory factory;
  private boolean includeCallerData;

  /**
   * @param sink destination of captured events
   * @param factory factory adding span and thread context
   */
  public SpannerAppender(EventIngestPort sink, EventFactory factory) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.factory = Objects.requireNonNull(factory, "factory");
    setName("SPANNER");
  }

  public boolean isIncludeCallerData() {
    return includeCallerData;
  }

  public void setIncludeCallerData(boolean includeCallerData) {
    this.includeCallerData = includeCallerData;
  }

  @Override
  protected void append(ILoggingEvent logEvent) {
    if (ingesting.get()) {
      return;
    }
    ingesting.set(Boolean.TRUE);
    try {
      sink.ingest(factory.capture(toEventData(logEvent)));
    } catch (RuntimeException ex) {
      addError("Failed to capture logging event from " + logEvent.getLoggerName(), ex);
    } finally {
      ingesting.remove();
    }
  }

  EventData toEventData(ILoggingEvent logEvent) {
    Map<String, String> fields = new LinkedHashMap<>();
    Map<String, String> mdc = logEvent.getMDCPropertyMap();
    if (mdc != null) {
      mdc.forEach((key, value) -> {
        if (key != null && value != null) {
          fields.put(key, value);
        }
      });
    }
    List<KeyValuePair> pairs = logEvent.getKeyValuePairs();
    if (pairs != null) {
      for (KeyValuePair pair : pairs) {
        if (pair.key != null) {
          fields.put(pair.key, String.valueOf(pair.value));
        }
      }
    }
    IThrowableProxy throwable = logEvent.getThrowableProxy();
    if (throwable != null) {
      String detail = throwable.getMessage();
      fields.put(EXCEPTION_FIELD, detail == null
          ? throwable.getClassName()
          : throwable.getClassName() + ": " + detail);
    }
    String message = logEvent.getFormattedMessage();
    Instant timestamp = logEvent.getInstant();
    return new EventData(
        message == null ? "" : message,
        toLevel(logEvent.getLevel()),
        logEvent.getLoggerName(),
        location(logEvent),
        fields,
        timestamp == null ? Instant.ofEpochMilli(logEvent.getTimeStamp()) : timestamp);
  }

  private SourceLocation location(ILoggingEvent logEvent) {
    if (!includeCallerData) {
      return SourceLocation.unknown();
    }
    StackTraceElement[] callerData = logEvent.getCallerData();
    if (callerData == null || callerData.length == 0) {
      return SourceLocation.unknown();
    }
    StackTraceElement frame = callerData[0];
    Integer line = frame.getLineNumber() > 0 ? frame.getLineNumber() : null;
    return new SourceLocation(frame.getFileName(), line, frame.getClassName());
  }

  static Level toLevel(ch.qos.logback.classic.Level level) {
    if (level == null) {
      return Level.INFO;
    }
    return switch (level.toInt()) {
      case ch.qos.logback.classic.Level.ERROR_INT -> Level.ERROR;
      case ch.qos.logback.classic.Level.WARN_INT -> Level.WARN;
      case ch.qos.logback.classic.Level.DEBUG_INT -> Level.DEBUG;
      case ch.qos.logback.classic.Level.TRACE_INT, ch.qos.logback.classic.Level.ALL_INT -> Level.TRACE;
      default -> Level.INFO;
    };
  }
}
