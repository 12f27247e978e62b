package ca.gc.cra.logvault.infrastructure.rotation;

import ca.gc.cra.logvault.domain.entry.Destination;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Point-in-time view of one destination's file set.
 *
 * @param destination destination described
 * @param currentFile path of the active file
 * @param currentSize bytes in the active file, including unflushed bytes
 * @param lastModified modification time of the active file; {@code null} when it does not exist
 * @param rotatedFiles numbered files awaiting compression
 * @param compressedFiles numbered archives
 * @param rotationCount rotations performed by this writer since start
 * @since 0.1.0
 */
public record RotationStats(
    Destination destination,
    Path currentFile,
    long currentSize,
    Instant lastModified,
    int rotatedFiles,
    int compressedFiles,
    long rotationCount) {

  public Optional<Instant> lastModifiedTime() {
    return Optional.ofNullable(lastModified);
  }
}
