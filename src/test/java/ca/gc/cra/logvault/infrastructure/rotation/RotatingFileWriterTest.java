package ca.gc.cra.logvault.infrastructure.rotation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.MetricsPort;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.testutil.MutableClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RotatingFileWriterTest {
  @TempDir Path base;

  private MutableClock clock;
  private LogMetricsCollector metrics;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atSystemTime();
    metrics = new LogMetricsCollector(true, MetricsPort.NO_OP, clock);
  }

  @Test
  void rotatesBeforeWriteThatWouldExceedMaxBytes() throws IOException {
    RotatingFileWriter writer = manager(new RotationPolicy(20, Duration.ofDays(1), 3)).writer(Destination.APPLICATION);

    writer.write(line("0123456789"));
    writer.write(line("abcdefghij"));
    writer.flush();

    Path current = writer.path();
    assertEquals("abcdefghij\n", Files.readString(current));
    assertEquals("0123456789\n", Files.readString(sibling(current, ".1")));
    assertEquals(1L, metrics.snapshot().rotationCount());
  }

  @Test
  void oversizedLineIsWrittenWholeIntoEmptyFile() throws IOException {
    RotatingFileWriter writer = manager(new RotationPolicy(4, Duration.ofDays(1), 3)).writer(Destination.APPLICATION);

    writer.write(line("much longer than four bytes"));
    writer.flush();

    assertEquals("much longer than four bytes\n", Files.readString(writer.path()));
    assertFalse(Files.exists(sibling(writer.path(), ".1")));
  }

  @Test
  void rotatesWhenCurrentFileIsOlderThanMaxAge() throws IOException {
    RotatingFileWriter writer =
        manager(new RotationPolicy(1_000_000, Duration.ofHours(1), 3)).writer(Destination.APPLICATION);

    writer.write(line("first"));
    clock.advance(Duration.ofMinutes(61));
    writer.write(line("second"));
    writer.flush();

    assertEquals("second\n", Files.readString(writer.path()));
    assertEquals("first\n", Files.readString(sibling(writer.path(), ".1")));
  }

  @Test
  void keepsAtMostMaxBackupsNewestFirst() throws IOException {
    RotatingFileWriter writer = manager(new RotationPolicy(6, Duration.ofDays(1), 2)).writer(Destination.APPLICATION);

    for (String value : List.of("aaaaa", "bbbbb", "ccccc", "ddddd")) {
      writer.write(line(value));
    }
    writer.flush();

    assertEquals("ddddd\n", Files.readString(writer.path()));
    assertEquals("ccccc\n", Files.readString(sibling(writer.path(), ".1")));
    assertEquals("bbbbb\n", Files.readString(sibling(writer.path(), ".2")));
    assertFalse(Files.exists(sibling(writer.path(), ".3")));
    assertEquals(3L, metrics.snapshot().rotationCount());
  }

  @Test
  void zeroBackupsDiscardsRotatedContent() throws IOException {
    RotatingFileWriter writer = manager(new RotationPolicy(6, Duration.ofDays(1), 0)).writer(Destination.APPLICATION);

    writer.write(line("aaaaa"));
    writer.write(line("bbbbb"));
    writer.flush();

    assertEquals("bbbbb\n", Files.readString(writer.path()));
    assertFalse(Files.exists(sibling(writer.path(), ".1")));
  }

  @Test
  void compressedBackupsShiftWithTheirSuffix() throws IOException {
    RotatingFileWriter writer = manager(new RotationPolicy(6, Duration.ofDays(1), 5)).writer(Destination.APPLICATION);
    writer.write(line("aaaaa"));
    writer.write(line("bbbbb"));
    Path first = sibling(writer.path(), ".1");
    Files.move(first, sibling(writer.path(), ".1.gz"));

    writer.write(line("ccccc"));
    writer.flush();

    assertTrue(Files.exists(sibling(writer.path(), ".2.gz")));
    assertEquals("bbbbb\n", Files.readString(first));
    assertEquals(List.of(first), writer.uncompressedBackups());
  }

  @Test
  void manualRotationSkipsEmptyFiles() throws IOException {
    RotationManager manager = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));

    assertEquals(0, manager.rotateAll());

    manager.writer(Destination.APPLICATION).write(line("payload"));
    assertTrue(manager.rotate(Destination.APPLICATION));
    assertFalse(manager.rotate(Destination.APPLICATION));

    RotationStats stats = manager.stats().get(Destination.APPLICATION);
    assertEquals(1, stats.rotatedFiles());
    assertEquals(0L, stats.currentSize());
    assertEquals(1L, stats.rotationCount());
  }

  @Test
  void statsReportUnlistableDirectoryAsCheckedFailure() throws IOException {
    RotationManager manager = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));
    RotatingFileWriter app = manager.writer(Destination.APPLICATION);
    app.write(line("payload"));
    app.rotate();
    Path directory = app.path().getParent();
    Set<PosixFilePermission> original = Files.getPosixFilePermissions(directory);
    Files.setPosixFilePermissions(directory, EnumSet.noneOf(PosixFilePermission.class));
    try {
      assumeFalse(Files.isReadable(directory), "permissions are not enforced for this user");

      assertThrows(IOException.class, manager::stats);
    } finally {
      Files.setPosixFilePermissions(directory, original);
    }
    assertEquals(1, manager.stats().get(Destination.APPLICATION).rotatedFiles());
    manager.close();
  }

  @Test
  void appendsToExistingFileAcrossRestarts() throws IOException {
    RotationManager first = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));
    first.writer(Destination.APPLICATION).write(line("before"));
    first.close();

    RotationManager second = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));
    second.writer(Destination.APPLICATION).write(line("after"));
    second.flush();

    assertEquals("before\nafter\n", Files.readString(second.writer(Destination.APPLICATION).path()));
    assertEquals(13L, second.currentSizes().get(Destination.APPLICATION));
  }

  @Test
  void writesAfterCloseFail() throws IOException {
    RotationManager manager = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));
    RotatingFileWriter writer = manager.writer(Destination.APPLICATION);
    writer.write(line("x"));
    manager.close();

    assertThrows(IOException.class, () -> writer.write(line("y")));
  }

  @Test
  void rejectsDestinationsItDoesNotServe() {
    RotationManager manager = manager(new RotationPolicy(1_000, Duration.ofDays(1), 3));
    assertThrows(IllegalArgumentException.class, () -> manager.writer(Destination.METRICS));
  }

  private RotationManager manager(RotationPolicy policy) {
    return new RotationManager(
        base, "svc", policy, EnumSet.of(Destination.APPLICATION, Destination.ERROR), clock, metrics);
  }

  private static byte[] line(String value) {
    return (value + "\n").getBytes(StandardCharsets.UTF_8);
  }

  private static Path sibling(Path current, String suffix) {
    return current.resolveSibling(current.getFileName() + suffix);
  }
}
