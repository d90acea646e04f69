/**
 * Export and import of whole event histories as portable snapshots.
 * <p><strong>Role:</strong> Use case layer; encoding and file access sit behind
 * {@code SnapshotCodec} and {@code SnapshotStoragePort}.</p>
 * <p><strong>Metrics:</strong> Publishes {@code snapshot.exported} and {@code snapshot.imported}.</p>
 */
package ca.gc.cra.spanner.application.snapshot;
