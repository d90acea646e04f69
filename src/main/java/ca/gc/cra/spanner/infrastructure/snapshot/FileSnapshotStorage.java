package ca.gc.cra.spanner.infrastructure.snapshot;

import ca.gc.cra.spanner.application.port.SnapshotStoragePort;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local-filesystem {@link SnapshotStoragePort}.
 *
 * <p>Writes go to a temporary file next to the destination, which is then moved into place, atomically
 * where the filesystem supports it. A failed write leaves any previous snapshot untouched.</p>
 *
 * @since Spanner 0.1.0
 */
public final class FileSnapshotStorage implements SnapshotStoragePort {
  private static final Logger log = LoggerFactory.getLogger(FileSnapshotStorage.class);

  @Override
  public void write(Path path, byte[] document) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(document, "document");
    Path target = path.toAbsolutePath();
    Path directory = target.getParent();
    if (directory != null) {
      Files.createDirectories(directory);
    }
    Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, document);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; falling back to replace", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public byte[] read(Path path) throws IOException {
    return Files.readAllBytes(Objects.requireNonNull(path, "path"));
  }
}
