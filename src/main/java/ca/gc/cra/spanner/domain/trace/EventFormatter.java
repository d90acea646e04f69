package ca.gc.cra.spanner.domain.trace;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders events and span trees as indented diagnostic text. Output is for humans; only the nesting
 * order and the recursive parent section are stable.
 */
final class EventFormatter {
  private static final String INDENT = "  ";

  private EventFormatter() {}

  static String spanTree(Event event) {
    StringBuilder out = new StringBuilder();
    event.currentSpan().ifPresent(current -> out.append("Current Span: ")
        .append(current.name())
        .append(" (")
        .append(current.level().label())
        .append(")\n"));
    if (!event.spanStack().isEmpty()) {
      out.append("Span Stack:\n");
      int depth = 0;
      for (SpanInfo span : event.spanStack()) {
        appendSpan(span, depth, out);
        depth++;
      }
    }
    return out.toString();
  }

  static String fullContext(Event event) {
    StringBuilder out = new StringBuilder();
    Event link = event;
    while (link != null) {
      if (link != event) {
        out.append("\n--- Parent Event ---\n");
      }
      appendContext(link, out);
      link = link.parent().orElse(null);
    }
    return out.toString();
  }

  private static void appendContext(Event event, StringBuilder out) {
    EventData data = event.data();
    out.append("Event: ").append(data.message()).append(" (").append(data.level().label()).append(")\n");
    out.append("Target: ").append(data.target()).append('\n');
    out.append("Timestamp: ").append(data.timestamp()).append('\n');
    SourceLocation location = data.location();
    if (location.file() != null) {
      out.append("Location: ").append(location.file()).append(':')
          .append(location.line() == null ? 0 : location.line()).append('\n');
    }
    if (location.modulePath() != null) {
      out.append("Module: ").append(location.modulePath()).append('\n');
    }
    event.threadId().ifPresent(id -> {
      out.append("Thread: ").append(id);
      event.threadName().ifPresent(name -> out.append(" (").append(name).append(')'));
      out.append('\n');
    });
    event.processId().ifPresent(pid -> out.append("Process ID: ").append(pid).append('\n'));
    event.correlationId().ifPresent(id -> out.append("Correlation ID: ").append(id).append('\n'));
    appendSection("Event Fields:", data.fields(), out);
    appendSection("Metadata:", event.customMetadata(), out);
    out.append('\n');
    out.append(spanTree(event));
  }

  private static void appendSection(String title, Map<String, String> entries, StringBuilder out) {
    if (entries.isEmpty()) {
      return;
    }
    out.append(title).append('\n');
    for (Map.Entry<String, String> entry : new TreeMap<>(entries).entrySet()) {
      out.append(INDENT).append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
    }
  }

  private static void appendSpan(SpanInfo span, int depth, StringBuilder out) {
    out.append(INDENT.repeat(depth))
        .append("├─ ")
        .append(span.name())
        .append(" (")
        .append(span.level().label())
        .append(')');
    if (span.isActive()) {
      out.append(" [active]");
    } else {
      out.append(" [").append(formatDuration(span.elapsed())).append(']');
    }
    if (!span.fields().isEmpty()) {
      out.append(" {");
      for (Map.Entry<String, String> field : new TreeMap<>(span.fields()).entrySet()) {
        out.append(' ').append(field.getKey()).append('=').append(field.getValue());
      }
      out.append(" }");
    }
    out.append('\n');
    for (SpanInfo child : span.children()) {
      appendSpan(child, depth + 1, out);
    }
  }

  static String formatDuration(Duration duration) {
    long nanos = duration.toNanos();
    if (nanos < 1_000L) {
      return nanos + "ns";
    }
    if (nanos < 1_000_000L) {
      return String.format(Locale.ROOT, "%.2fµs", nanos / 1_000.0);
    }
    if (nanos < 1_000_000_000L) {
      return String.format(Locale.ROOT, "%.2fms", nanos / 1_000_000.0);
    }
    return String.format(Locale.ROOT, "%.2fs", nanos / 1_000_000_000.0);
  }
}
