package ca.gc.cra.spanner.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation helpers for span names, snapshot descriptions and configuration
 * values.
 * <p><strong>Thread-safety:</strong> Stateless and safe for concurrent use.</p>
 *
 * @since Spanner 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures the supplied value is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate string
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Normalizes optional text: {@code null} or blank becomes {@code null}, anything else is trimmed.
   *
   * @param value optional text
   * @return trimmed value or {@code null}
   */
  public static String blankToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
