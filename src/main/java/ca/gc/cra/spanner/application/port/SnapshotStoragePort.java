package ca.gc.cra.spanner.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port moving whole snapshot documents to and from storage.
 * <p><strong>Failure:</strong> every failure surfaces as {@link IOException}; nothing is retried.</p>
 *
 * @since Spanner 0.1.0
 */
public interface SnapshotStoragePort {
  /**
   * Writes {@code document} to {@code path}, replacing any existing file.
   *
   * @param path destination file
   * @param document encoded snapshot
   * @throws IOException when the file cannot be written
   */
  void write(Path path, byte[] document) throws IOException;

  /**
   * Reads the whole document at {@code path}.
   *
   * @param path source file
   * @return file contents
   * @throws IOException when the file cannot be read
   */
  byte[] read(Path path) throws IOException;
}
