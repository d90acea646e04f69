package ca.gc.cra.spanner.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for event capture and snapshot metadata.
 * <p><strong>Why:</strong> Lets tests pin capture and export times instead of racing the system clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on every
 * emitting thread.</p>
 *
 * @implNote The default implementation delegates to {@link Instant#now()}.
 * @since Spanner 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return wall-clock time; subject to system clock adjustments
   */
  Instant now();

  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  default long nowMillis() {
    return now().toEpochMilli();
  }

  /**
   * Default {@link ClockPort} backed by {@link Instant#now()}.
   */
  ClockPort SYSTEM = Instant::now;
}
