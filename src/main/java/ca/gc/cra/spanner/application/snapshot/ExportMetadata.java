package ca.gc.cra.spanner.application.snapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Summary written at the head of every snapshot.
 *
 * @param formatVersion snapshot format version (e.g., {@code 1.0}); never {@code null}
 * @param exportTimestamp time the snapshot was created; never {@code null}
 * @param totalEvents number of events in the snapshot
 * @param levelCounts level label to count, only for counts above zero, sorted by label
 * @param description optional free-text description; may be {@code null}
 * @since Spanner 0.1.0
 */
public record ExportMetadata(
    String formatVersion,
    Instant exportTimestamp,
    int totalEvents,
    SortedMap<String, Integer> levelCounts,
    String description) {

  /**
   * Validates invariants and copies the level counts into an immutable sorted map.
   */
  public ExportMetadata {
    formatVersion = Objects.requireNonNull(formatVersion, "formatVersion");
    exportTimestamp = Objects.requireNonNull(exportTimestamp, "exportTimestamp");
    if (totalEvents < 0) {
      throw new IllegalArgumentException("totalEvents must not be negative");
    }
    levelCounts = Collections.unmodifiableSortedMap(
        new TreeMap<>(levelCounts == null ? Collections.emptySortedMap() : levelCounts));
  }
}
