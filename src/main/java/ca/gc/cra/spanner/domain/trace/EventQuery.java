package ca.gc.cra.spanner.domain.trace;

import java.util.function.Predicate;

/**
 * Conjunctive filter over events. A {@code null} criterion matches every event.
 *
 * <p>All specific store lookups (by level, target or span) are special cases of this predicate.</p>
 *
 * @param level exact level to match; may be {@code null}
 * @param targetContains substring the event target must contain; may be {@code null}
 * @param messageContains substring the event message must contain; may be {@code null}
 * @param spanNameContains substring some span in the stack, or the current span, must contain in its
 *     name; may be {@code null}
 * @since Spanner 0.1.0
 */
public record EventQuery(
    Level level, String targetContains, String messageContains, String spanNameContains)
    implements Predicate<Event> {

  private static final EventQuery ANY = new EventQuery(null, null, null, null);

  /**
   * Returns the query with no criteria.
   *
   * @return query matching every event
   */
  public static EventQuery any() {
    return ANY;
  }

  public static EventQuery level(Level level) {
    return new EventQuery(level, null, null, null);
  }

  public static EventQuery target(String targetContains) {
    return new EventQuery(null, targetContains, null, null);
  }

  public static EventQuery message(String messageContains) {
    return new EventQuery(null, null, messageContains, null);
  }

  public static EventQuery span(String spanNameContains) {
    return new EventQuery(null, null, null, spanNameContains);
  }

  /**
   * Returns {@code true} when no criterion is set.
   *
   * @return whether the query is unconstrained
   */
  public boolean isUnconstrained() {
    return level == null && targetContains == null && messageContains == null && spanNameContains == null;
  }

  @Override
  public boolean test(Event event) {
    return event != null && event.matches(this);
  }
}
