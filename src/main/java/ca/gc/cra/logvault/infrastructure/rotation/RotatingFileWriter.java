package ca.gc.cra.logvault.infrastructure.rotation;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.ClockPort;
import ca.gc.cra.logvault.domain.entry.Destination;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.FilterOutputStream;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends formatted lines to one destination's current file and rotates it on size or age.
 *
 * <p>Rotated files are numbered by age: {@code name.log.1} is the newest. Each rotation shifts existing
 * numbered files (and their {@code .gz} archives) up by one, deletes those past the retention count and renames
 * the current file to {@code .1}. The rename is a single atomic move, so readers see either the old current
 * file or the new one, never a truncated file.</p>
 *
 * <p>Every public method synchronizes on this writer; writes, rotations and archive publication for one
 * destination therefore never interleave.</p>
 *
 * @since 0.1.0
 */
public final class RotatingFileWriter implements Closeable, Flushable {
  private static final Logger log = LoggerFactory.getLogger(RotatingFileWriter.class);
  private static final int BUFFER_BYTES = 64 * 1024;
  static final String ARCHIVE_SUFFIX = ".gz";

  private final Destination destination;
  private final Path path;
  private final String fileName;
  private final Pattern backupPattern;
  private final RotationPolicy policy;
  private final ClockPort clock;
  private final LogMetricsCollector metrics;

  private CountingOutputStream out;
  private long openedAtMillis;
  private long rotationCount;
  private boolean closed;

  RotatingFileWriter(
      Destination destination,
      Path path,
      RotationPolicy policy,
      ClockPort clock,
      LogMetricsCollector metrics) {
    this.destination = Objects.requireNonNull(destination, "destination");
    this.path = Objects.requireNonNull(path, "path");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fileName = path.getFileName().toString();
    this.backupPattern = Pattern.compile("^" + Pattern.quote(fileName) + "\\.(\\d+)(\\.gz)?$");
  }

  public Destination destination() {
    return destination;
  }

  public Path path() {
    return path;
  }

  /**
   * Appends one formatted line, rotating first when a threshold is reached.
   *
   * @param line UTF-8 bytes of one entry
   * @throws IOException if the file cannot be opened, rotated or written, or the writer is closed
   */
  public synchronized void write(byte[] line) throws IOException {
    Objects.requireNonNull(line, "line");
    ensureOpen();
    if (shouldRotate(line.length)) {
      rotateLocked();
    }
    out.write(line);
  }

  /**
   * Rotates the current file out of band. An absent or empty current file is left alone.
   *
   * @return {@code true} when a rotation happened
   * @throws IOException if the rename or reopen fails
   */
  public synchronized boolean rotate() throws IOException {
    if (closed) {
      return false;
    }
    if (out == null) {
      if (!Files.exists(path) || Files.size(path) == 0L) {
        return false;
      }
      ensureOpen();
    } else if (out.getCount() == 0L) {
      return false;
    }
    rotateLocked();
    return true;
  }

  @Override
  public synchronized void flush() throws IOException {
    if (out != null) {
      out.flush();
    }
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    closeStream();
  }

  /**
   * Lists rotated files that have not been archived yet, oldest first.
   *
   * @return uncompressed numbered files
   * @throws IOException if the directory cannot be listed
   */
  public synchronized List<Path> uncompressedBackups() throws IOException {
    List<Path> result = new ArrayList<>();
    for (Backup backup : listBackups()) {
      if (!backup.compressed()) {
        result.add(backup.path());
      }
    }
    result.sort(Comparator.comparing((Path p) -> backupNumber(p)).reversed());
    return result;
  }

  /**
   * Replaces a rotated file with its archive if the rotated file is unchanged since it was read.
   *
   * @param rotated numbered file that was compressed
   * @param expected identity captured before compression started
   * @param part completed archive written beside the rotated file
   * @return {@code true} when the archive was published and the original deleted
   * @throws IOException if the rename or delete fails
   */
  public synchronized boolean publishArchive(Path rotated, FileIdentity expected, Path part) throws IOException {
    FileIdentity current;
    try {
      current = FileIdentity.read(rotated);
    } catch (NoSuchFileException missing) {
      return false;
    }
    if (!current.equals(expected)) {
      return false;
    }
    Path archive = rotated.resolveSibling(rotated.getFileName() + ARCHIVE_SUFFIX);
    move(part, archive);
    Files.delete(rotated);
    return true;
  }

  /**
   * Describes the current file set.
   *
   * @return statistics snapshot
   * @throws IOException if the directory cannot be listed
   */
  public synchronized RotationStats stats() throws IOException {
    long size = 0L;
    Instant modified = null;
    if (Files.exists(path)) {
      BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
      size = attributes.size();
      modified = attributes.lastModifiedTime().toInstant();
    }
    if (out != null) {
      size = Math.max(size, out.getCount());
    }
    int rotated = 0;
    int compressed = 0;
    for (Backup backup : listBackups()) {
      if (backup.compressed()) {
        compressed++;
      } else {
        rotated++;
      }
    }
    return new RotationStats(destination, path, size, modified, rotated, compressed, rotationCount);
  }

  /**
   * Returns the size of the current file including buffered bytes.
   *
   * @return size in bytes, zero before the first write
   */
  public synchronized long currentSize() {
    return out == null ? 0L : out.getCount();
  }

  private boolean shouldRotate(int incoming) {
    long size = out.getCount();
    if (size == 0L) {
      return false;
    }
    if (size + incoming > policy.maxBytes()) {
      return true;
    }
    long age = Math.max(0L, clock.nowMillis() - openedAtMillis);
    return age >= policy.maxAge().toMillis();
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Destination " + destination.directory() + " is closed");
    }
    if (out != null) {
      return;
    }
    Path parent = path.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    long existing = 0L;
    long openedAt = clock.nowMillis();
    if (Files.exists(path)) {
      BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
      existing = attributes.size();
      if (existing > 0L) {
        openedAt = Math.min(openedAt, attributes.creationTime().toMillis());
      }
    }
    open(existing, openedAt);
  }

  private void open(long existingBytes, long openedAt) throws IOException {
    OutputStream file = Files.newOutputStream(
        path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    out = new CountingOutputStream(new BufferedOutputStream(file, BUFFER_BYTES), existingBytes);
    openedAtMillis = openedAt;
  }

  private void rotateLocked() throws IOException {
    closeStream();
    List<Backup> backups = listBackups();
    backups.sort(Comparator.comparingInt(Backup::number).reversed());
    for (Backup backup : backups) {
      int next = backup.number() + 1;
      if (next > policy.maxBackups()) {
        Files.deleteIfExists(backup.path());
      } else {
        String suffix = backup.compressed() ? ARCHIVE_SUFFIX : "";
        move(backup.path(), path.resolveSibling(fileName + "." + next + suffix));
      }
    }
    if (Files.exists(path)) {
      if (policy.maxBackups() > 0) {
        move(path, path.resolveSibling(fileName + ".1"));
      } else {
        Files.delete(path);
      }
    }
    open(0L, clock.nowMillis());
    rotationCount++;
    metrics.recordRotation(destination);
    log.debug("Rotated {} (rotation #{})", path, rotationCount);
  }

  private void closeStream() throws IOException {
    CountingOutputStream current = out;
    out = null;
    if (current != null) {
      current.close();
    }
  }

  private List<Backup> listBackups() throws IOException {
    List<Backup> backups = new ArrayList<>();
    Path directory = path.getParent();
    if (directory == null || !Files.isDirectory(directory)) {
      return backups;
    }
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, fileName + ".*")) {
      for (Path candidate : stream) {
        Matcher matcher = backupPattern.matcher(candidate.getFileName().toString());
        if (matcher.matches()) {
          backups.add(new Backup(candidate, Integer.parseInt(matcher.group(1)), matcher.group(2) != null));
        }
      }
    }
    return backups;
  }

  private int backupNumber(Path candidate) {
    Matcher matcher = backupPattern.matcher(candidate.getFileName().toString());
    return matcher.matches() ? Integer.parseInt(matcher.group(1)) : 0;
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private record Backup(Path path, int number, boolean compressed) {}

  private static final class CountingOutputStream extends FilterOutputStream {
    private long count;

    CountingOutputStream(OutputStream out, long initialCount) {
      super(out);
      this.count = initialCount;
    }

    long getCount() {
      return count;
    }

    @Override
    public void write(int b) throws IOException {
      out.write(b);
      count++;
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
      count += len;
    }
  }
}
