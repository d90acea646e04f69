package ca.gc.cra.spanner.domain.trace;

/**
 * Source position an event or span was emitted from.
 *
 * @param file source file name; may be {@code null}
 * @param line one-based line number; may be {@code null}
 * @param modulePath logical module or class name; may be {@code null}
 * @since Spanner 0.1.0
 */
public record SourceLocation(String file, Integer line, String modulePath) {
  private static final SourceLocation UNKNOWN = new SourceLocation(null, null, null);

  /**
   * Returns a location with every component absent.
   *
   * @return shared empty location
   */
  public static SourceLocation unknown() {
    return UNKNOWN;
  }

  /**
   * Returns {@code true} when no component is present.
   *
   * @return whether the location carries no information
   */
  public boolean isUnknown() {
    return file == null && line == null && modulePath == null;
  }
}
