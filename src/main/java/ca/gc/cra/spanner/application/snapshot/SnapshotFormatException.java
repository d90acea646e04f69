package ca.gc.cra.spanner.application.snapshot;

/**
 * Checked exception raised when snapshot bytes were read but do not form a valid snapshot: malformed
 * JSON, a missing or malformed required field, or an incompatible format version.
 *
 * <p>Distinct from {@link java.io.IOException}, which signals that the bytes could not be read or
 * written at all.</p>
 *
 * @since Spanner 0.1.0
 */
public final class SnapshotFormatException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public SnapshotFormatException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause parser or conversion failure
   */
  public SnapshotFormatException(String msg, Throwable cause) { super(msg, cause); }
}
