package ca.gc.cra.spanner.domain.trace;

import java.util.Locale;

/**
 * Severity of a captured event or span, ordered from most to least severe.
 *
 * <p>Declaration order is significant: {@link #ERROR} is the most severe level and {@link #TRACE}
 * the least. {@link #label()} is the stable textual form used in snapshots and level counts.</p>
 *
 * @since Spanner 0.1.0
 */
public enum Level {
  ERROR,
  WARN,
  INFO,
  DEBUG,
  TRACE;

  /**
   * Returns the label written to snapshots and summaries.
   *
   * @return upper-case level name
   */
  public String label() {
    return name();
  }

  /**
   * Returns {@code true} when this level is at least as severe as {@code other}.
   *
   * @param other level to compare against; never {@code null}
   * @return whether this level is equally or more severe
   */
  public boolean isAtLeast(Level other) {
    return ordinal() <= other.ordinal();
  }

  /**
   * Parses a level label, ignoring case and surrounding whitespace.
   *
   * @param raw level label such as {@code "info"}
   * @return matching level
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static Level parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if ("WARNING".equals(normalized)) {
      return WARN;
    }
    try {
      return Level.valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown level: " + raw, ex);
    }
  }
}
