package ca.gc.cra.spanner.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing and store construction.
 * <p><strong>Why:</strong> Rejects nonsensical capacities (zero or negative store sizes) before any buffer
 * is allocated.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since Spanner 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value and validates its range.
   *
   * @param name logical parameter name included in diagnostics
   * @param raw textual value; blank falls back to {@code defaultValue}
   * @param defaultValue value used when {@code raw} is {@code null} or blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException when {@code raw} is not an integer or out of range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return (int) requireRange(name, defaultValue, min, max);
    }
    try {
      return (int) requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
  }
}
