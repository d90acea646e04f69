package ca.gc.cra.spanner.application.snapshot;

import java.util.Objects;

/**
 * Outcome of merging a snapshot into a live store.
 *
 * @param data decoded snapshot
 * @param imported number of events pushed into the store
 * @since Spanner 0.1.0
 */
public record MergeResult(ExportData data, int imported) {
  /**
   * Validates invariants.
   */
  public MergeResult {
    data = Objects.requireNonNull(data, "data");
  }
}
