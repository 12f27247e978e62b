package ca.gc.cra.logvault.infrastructure.rotation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Identity of a rotated file captured before compression; used to detect a rename in between.
 *
 * @param size file size in bytes
 * @param lastModified modification time
 * @param fileKey platform file key (inode on POSIX); may be {@code null}
 * @since 0.1.0
 */
public record FileIdentity(long size, FileTime lastModified, Object fileKey) {
  public FileIdentity {
    Objects.requireNonNull(lastModified, "lastModified");
  }

  /**
   * Reads the identity of {@code path}.
   *
   * @param path file to inspect
   * @return identity snapshot
   * @throws IOException if the attributes cannot be read
   */
  public static FileIdentity read(Path path) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
    return new FileIdentity(attributes.size(), attributes.lastModifiedTime(), attributes.fileKey());
  }
}
