package ca.gc.cra.spanner.application.port;

import ca.gc.cra.spanner.application.snapshot.ExportData;
import ca.gc.cra.spanner.application.snapshot.SnapshotFormatException;

/**
 * <strong>What:</strong> Port converting {@link ExportData} to and from a self-describing document.
 * <p><strong>Contract:</strong> {@code decode(encode(data))} reproduces every field of every event,
 * nested span trees, optional values and parent chains included. Decoders accept unknown fields and
 * reject missing or malformed required fields with {@link SnapshotFormatException}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since Spanner 0.1.0
 */
public interface SnapshotCodec {
  /**
   * Format version written by {@link #encode(ExportData)}.
   *
   * @return version label
   */
  String formatVersion();

  /**
   * Encodes a snapshot.
   *
   * @param data snapshot contents
   * @return encoded document
   */
  byte[] encode(ExportData data);

  /**
   * Decodes a snapshot.
   *
   * @param document encoded document
   * @return decoded contents
   * @throws SnapshotFormatException when the document is not a valid snapshot
   */
  ExportData decode(byte[] document) throws SnapshotFormatException;
}
