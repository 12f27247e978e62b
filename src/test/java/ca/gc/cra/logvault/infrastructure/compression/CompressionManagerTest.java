package ca.gc.cra.logvault.infrastructure.compression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.MetricsPort;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.infrastructure.rotation.FileIdentity;
import ca.gc.cra.logvault.infrastructure.rotation.RotatingFileWriter;
import ca.gc.cra.logvault.infrastructure.rotation.RotationManager;
import ca.gc.cra.logvault.infrastructure.rotation.RotationPolicy;
import ca.gc.cra.logvault.logging.FallbackLog;
import ca.gc.cra.logvault.testutil.MutableClock;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompressionManagerTest {
  private static final String PAYLOAD = "GET /api/users 200 ".repeat(200) + "\n";

  @TempDir Path base;

  private MutableClock clock;
  private LogMetricsCollector metrics;
  private RotationManager rotation;
  private RotatingFileWriter writer;

  @BeforeEach
  void setUp() throws IOException {
    clock = MutableClock.atSystemTime();
    metrics = new LogMetricsCollector(true, MetricsPort.NO_OP, clock);
    rotation = new RotationManager(
        base,
        "svc",
        new RotationPolicy(1_000_000, Duration.ofDays(1), 5),
        EnumSet.of(Destination.APPLICATION),
        clock,
        metrics);
    writer = rotation.writer(Destination.APPLICATION);
    writer.write(PAYLOAD.getBytes(StandardCharsets.UTF_8));
    writer.rotate();
  }

  @AfterEach
  void tearDown() throws IOException {
    rotation.close();
  }

  @Test
  void archivesRotatedFilesOnceOldEnough() throws IOException {
    CompressionManager manager = manager(Duration.ofDays(1));
    Path rotated = sibling(".1");

    SweepReport early = manager.sweep();
    assertEquals(0, early.compressed());
    assertEquals(1, early.deferred());
    assertTrue(Files.exists(rotated));

    clock.advance(Duration.ofDays(2));
    SweepReport due = manager.sweep();

    assertEquals(1, due.compressed());
    assertTrue(due.bytesSaved() > 0L);
    assertFalse(Files.exists(rotated));
    assertFalse(Files.exists(sibling(".1.gz.part")));
    assertEquals(PAYLOAD, gunzip(sibling(".1.gz")));
    assertEquals(1L, metrics.snapshot().compressedFileCount());
    assertEquals(due.bytesSaved(), metrics.snapshot().compressionBytesSaved());
  }

  @Test
  void archivedFilesAreNotCompressedTwice() throws IOException {
    CompressionManager manager = manager(Duration.ZERO);
    clock.advance(Duration.ofMinutes(1));
    assertEquals(1, manager.sweep().compressed());

    SweepReport second = manager.sweep();

    assertEquals(0, second.compressed());
    assertEquals(0, second.deferred());
    assertEquals(1, rotation.stats().get(Destination.APPLICATION).compressedFiles());
  }

  @Test
  void archiveKeepsShiftingAfterLaterRotations() throws IOException {
    CompressionManager manager = manager(Duration.ZERO);
    clock.advance(Duration.ofMinutes(1));
    manager.sweep();

    writer.write("next\n".getBytes(StandardCharsets.UTF_8));
    writer.rotate();

    assertTrue(Files.exists(sibling(".2.gz")));
    assertEquals("next\n", Files.readString(sibling(".1")));
    assertEquals(PAYLOAD, gunzip(sibling(".2.gz")));
  }

  @Test
  void failedArchiveKeepsOriginalAndIsRetriedOnNextSweep() throws IOException {
    writer.write("second\n".getBytes(StandardCharsets.UTF_8));
    writer.rotate();
    Path older = sibling(".2");
    Path blockedPart = Files.createDirectory(sibling(".2.gz.part"));
    Files.writeString(blockedPart.resolve("occupied"), "x");
    CompressionManager manager = manager(Duration.ZERO);
    clock.advance(Duration.ofMinutes(1));

    SweepReport first = manager.sweep();

    assertEquals(1, first.failed());
    assertEquals(1, first.compressed());
    assertTrue(Files.exists(older));
    assertFalse(Files.exists(sibling(".2.gz")));
    assertEquals("second\n", gunzip(sibling(".1.gz")));
    assertEquals(1L, metrics.snapshot().compressionFailureCount());

    Files.delete(blockedPart.resolve("occupied"));
    Files.delete(blockedPart);
    SweepReport retry = manager.sweep();

    assertEquals(0, retry.failed());
    assertEquals(1, retry.compressed());
    assertFalse(Files.exists(older));
    assertEquals(PAYLOAD, gunzip(sibling(".2.gz")));
  }

  @Test
  void archiveIsNotPublishedWhenRotatedFileChanged() throws IOException {
    Path rotated = sibling(".1");
    FileIdentity before = FileIdentity.read(rotated);
    Path part = Files.writeString(sibling(".1.gz.part"), "archive");
    Files.writeString(rotated, "replaced by a later rotation\n");

    assertFalse(writer.publishArchive(rotated, before, part));

    assertTrue(Files.exists(rotated));
    assertFalse(Files.exists(sibling(".1.gz")));
    assertEquals(0, rotation.stats().get(Destination.APPLICATION).compressedFiles());
  }

  @Test
  void stopIsIdempotentAndBlocksLaterStarts() {
    CompressionManager manager = manager(Duration.ZERO);
    manager.start();
    manager.stop();
    manager.stop();

    assertThrows(IllegalStateException.class, manager::start);
  }

  @Test
  void awaitStopGivesUpAtTheCallersDeadline() throws InterruptedException {
    CompressionManager manager = manager(Duration.ZERO);
    synchronized (writer) {
      manager.start();
      waitForBlockedSweep();
      manager.requestStop();

      long started = System.nanoTime();
      assertFalse(manager.awaitStop(Duration.ofMillis(100)));
      assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(2));
    }
    assertThrows(IllegalStateException.class, manager::start);
  }

  private static void waitForBlockedSweep() throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      for (Thread thread : Thread.getAllStackTraces().keySet()) {
        if (thread.getName().startsWith("logvault-compress") && thread.getState() == Thread.State.BLOCKED) {
          return;
        }
      }
      Thread.sleep(5);
    }
    throw new AssertionError("compression sweep never reached the writer lock");
  }

  private CompressionManager manager(Duration compressAfter) {
    return new CompressionManager(
        rotation, compressAfter, Duration.ofHours(1), Duration.ofSeconds(5), clock, metrics, new FallbackLog());
  }

  private Path sibling(String suffix) {
    Path current = writer.path();
    return current.resolveSibling(current.getFileName() + suffix);
  }

  private static String gunzip(Path archive) throws IOException {
    try (InputStream in = new GZIPInputStream(Files.newInputStream(archive))) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
