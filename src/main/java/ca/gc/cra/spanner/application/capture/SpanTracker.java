package ca.gc.cra.spanner.application.capture;

import ca.gc.cra.spanner.application.port.ClockPort;
import ca.gc.cra.spanner.domain.trace.Level;
import ca.gc.cra.spanner.domain.trace.SourceLocation;
import ca.gc.cra.spanner.domain.trace.SpanInfo;
import ca.gc.cra.spanner.validation.Strings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tracks the spans currently entered on each thread.
 * <p><strong>Why:</strong> Captured events carry the span stack active at the moment they fire; the tracker is
 * the source of that stack.</p>
 * <p><strong>Lifecycle:</strong> {@link #enter} pushes a new active span and returns a {@link SpanScope}.
 * Closing the scope exits the span, pops it and attaches a frozen copy as a child of the enclosing span.</p>
 * <p><strong>Thread-safety:</strong> Stacks are thread-confined via {@link ThreadLocal}; span ids come from a
 * shared {@link AtomicLong} and are unique per tracker.</p>
 *
 * @since Spanner 0.1.0
 */
public final class SpanTracker {
  private static final Logger log = LoggerFactory.getLogger(SpanTracker.class);

  private final ClockPort clock;
  private final AtomicLong ids = new AtomicLong();
  private final ThreadLocal<Deque<SpanInfo>> stacks = ThreadLocal.withInitial(ArrayDeque::new);

  public SpanTracker() {
    this(ClockPort.SYSTEM);
  }

  /**
   * @param clock clock stamping entry and exit; falls back to {@link ClockPort#SYSTEM} when {@code null}
   */
  public SpanTracker(ClockPort clock) {
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  /**
   * Enters a span at {@link Level#INFO} with no source location.
   *
   * @param name span name
   * @param target logical module name
   * @return scope that exits the span when closed
   */
  public SpanScope enter(String name, String target) {
    return enter(name, target, Level.INFO, SourceLocation.unknown());
  }

  /**
   * Enters a span on the calling thread.
   *
   * @param name span name; must not be blank
   * @param target logical module name; must not be blank
   * @param level span level
   * @param location source position; {@code null} means unknown
   * @return scope that exits the span when closed
   * @throws IllegalArgumentException when {@code name} or {@code target} is blank
   */
  public SpanScope enter(String name, String target, Level level, SourceLocation location) {
    SpanInfo span = SpanInfo.enter(
        ids.incrementAndGet(),
        Strings.requireNonBlank("name", name),
        Strings.requireNonBlank("target", target),
        Objects.requireNonNull(level, "level"),
        location,
        clock.now());
    stacks.get().push(span);
    return new SpanScope(this, span);
  }

  /**
   * Returns frozen copies of the calling thread's active spans, outermost first.
   *
   * @return span stack; empty when no span is entered
   */
  public List<SpanInfo> stack() {
    Deque<SpanInfo> stack = stacks.get();
    List<SpanInfo> copies = new ArrayList<>(stack.size());
    for (Iterator<SpanInfo> it = stack.descendingIterator(); it.hasNext(); ) {
      copies.add(it.next().snapshot());
    }
    return copies;
  }

  /**
   * Returns a frozen copy of the innermost active span of the calling thread.
   *
   * @return current span, or empty when none is entered
   */
  public Optional<SpanInfo> current() {
    SpanInfo top = stacks.get().peek();
    return top == null ? Optional.empty() : Optional.of(top.snapshot());
  }

  public int depth() {
    return stacks.get().size();
  }

  /**
   * Exits {@code span} if it is on the calling thread's stack.
   *
   * @return {@code false}, leaving the span untouched, when the calling thread never entered it
   */
  boolean exit(SpanInfo span) {
    Deque<SpanInfo> stack = stacks.get();
    boolean found = false;
    boolean innermost = true;
    SpanInfo enclosing = null;
    for (Iterator<SpanInfo> it = stack.iterator(); it.hasNext(); ) {
      SpanInfo candidate = it.next();
      if (found) {
        enclosing = candidate;
        break;
      }
      if (candidate == span) {
        it.remove();
        found = true;
      } else {
        innermost = false;
      }
    }
    if (stack.isEmpty()) {
      stacks.remove();
    }
    if (!found) {
      log.warn("Span {} closed on a thread that never entered it", span.name());
      return false;
    }
    span.exit(clock.now());
    if (!innermost) {
      log.debug("Span {} closed while inner spans were still open", span.name());
    }
    if (enclosing != null) {
      enclosing.addChild(span);
    }
    return true;
  }
}
