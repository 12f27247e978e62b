package ca.gc.cra.logvault.infrastructure.compression;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.ClockPort;
import ca.gc.cra.logvault.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.logvault.infrastructure.rotation.FileIdentity;
import ca.gc.cra.logvault.infrastructure.rotation.RotatingFileWriter;
import ca.gc.cra.logvault.infrastructure.rotation.RotationManager;
import ca.gc.cra.logvault.logging.FallbackLog;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Background sweep that gzips rotated files once they are older than a configured delay.
 * <p><strong>Why:</strong> Keeps retained history small without putting compression on the logging path.</p>
 * <p><strong>Role:</strong> Reads each destination's rotated files through {@link RotationManager}; publishes
 * archives under the destination's writer lock.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Sweep once at start and then on a fixed delay.</li>
 *   <li>Write {@code name.log.N.gz.part}, verify it closed with a non-zero size, then publish it as
 *   {@code name.log.N.gz} and delete the original. The original is never deleted first.</li>
 *   <li>Isolate failures per file; a failed file stays in place and is retried next sweep.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Sweeps are serialized; {@link #sweep()} may be called directly while the
 * scheduler is running.</p>
 * <p><strong>Observability:</strong> Failures go to {@link FallbackLog}, never to a log destination.</p>
 *
 * @since 0.1.0
 */
public final class CompressionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompressionManager.class);
  private static final int BUFFER_BYTES = 64 * 1024;
  private static final String PART_SUFFIX = ".gz.part";

  private final RotationManager rotation;
  private final Duration compressAfter;
  private final Duration interval;
  private final Duration stopTimeout;
  private final ClockPort clock;
  private final LogMetricsCollector metrics;
  private final FallbackLog fallback;
  private final ReentrantLock sweepLock = new ReentrantLock();
  private final AtomicBoolean stopRequested = new AtomicBoolean();

  private ScheduledExecutorService scheduler;

  /**
   * Creates a compression manager; nothing runs until {@link #start()}.
   *
   * @param rotation owner of the destination files
   * @param compressAfter minimum age of a rotated file before it is archived; zero archives on the next sweep
   * @param interval delay between sweeps
   * @param stopTimeout bound on how long {@link #stop()} waits for an in-progress sweep
   * @param clock time source for file ages
   * @param metrics collector receiving compression counts
   * @param fallback error path for per-file failures
   */
  public CompressionManager(
      RotationManager rotation,
      Duration compressAfter,
      Duration interval,
      Duration stopTimeout,
      ClockPort clock,
      LogMetricsCollector metrics,
      FallbackLog fallback) {
    this.rotation = Objects.requireNonNull(rotation, "rotation");
    this.compressAfter = Objects.requireNonNull(compressAfter, "compressAfter");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
    if (compressAfter.isNegative()) {
      throw new IllegalArgumentException("compressAfter must not be negative");
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /**
   * Schedules the periodic sweep; the first sweep runs immediately.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public synchronized void start() {
    if (scheduler != null || stopRequested.get()) {
      throw new IllegalStateException("Compression manager already started");
    }
    scheduler = ExecutorFactories.newMaintenanceScheduler("logvault-compress", this::handleCrash);
    scheduler.scheduleWithFixedDelay(
        this::scheduledSweep, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
    log.info("Compression sweep scheduled every {} (delay {})", interval, compressAfter);
  }

  /**
   * Runs one sweep over every destination on the calling thread.
   *
   * @return sweep outcome
   */
  public SweepReport sweep() {
    sweepLock.lock();
    try {
      int compressed = 0;
      int deferred = 0;
      int failed = 0;
      long saved = 0L;
      for (RotatingFileWriter writer : rotation.allWriters()) {
        List<Path> candidates;
        try {
          candidates = writer.uncompressedBackups();
        } catch (IOException ex) {
          failed++;
          metrics.recordCompressionFailure();
          fallback.error("Failed to list rotated files for {}", writer.path(), ex);
          continue;
        }
        for (Path candidate : candidates) {
          if (stopRequested.get()) {
            return new SweepReport(compressed, deferred, failed, saved);
          }
          Outcome outcome = compressIfDue(writer, candidate);
          switch (outcome.status()) {
            case COMPRESSED -> {
              compressed++;
              saved += outcome.savedBytes();
            }
            case DEFERRED -> deferred++;
            case FAILED -> failed++;
          }
        }
      }
      if (compressed > 0 || failed > 0) {
        log.debug("Compression sweep: {} compressed, {} deferred, {} failed", compressed, deferred, failed);
      }
      return new SweepReport(compressed, deferred, failed, saved);
    } finally {
      sweepLock.unlock();
    }
  }

  /**
   * Cancels the schedule and waits up to the stop timeout for an in-progress sweep.
   */
  public void stop() {
    requestStop();
    awaitStop(stopTimeout);
  }

  /**
   * Cancels the schedule without waiting; an in-progress sweep stops before its next file.
   */
  public synchronized void requestStop() {
    stopRequested.set(true);
    if (scheduler != null) {
      scheduler.shutdown();
    }
  }

  /**
   * Waits for an in-progress sweep after {@link #requestStop()}, interrupting it once {@code timeout} elapses.
   *
   * @param timeout longest wait; zero or negative checks once without waiting
   * @return {@code true} when no sweep is running any more
   */
  public boolean awaitStop(Duration timeout) {
    ScheduledExecutorService executor;
    synchronized (this) {
      executor = scheduler;
    }
    if (executor == null) {
      return true;
    }
    long waitMillis = Math.max(0L, timeout.toMillis());
    try {
      if (executor.awaitTermination(waitMillis, TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Compression sweep still running after {} ms; interrupting", waitMillis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    executor.shutdownNow();
    return false;
  }

  @Override
  public void close() {
    stop();
  }

  private Outcome compressIfDue(RotatingFileWriter writer, Path file) {
    FileIdentity identity;
    try {
      identity = FileIdentity.read(file);
    } catch (NoSuchFileException moved) {
      return Outcome.DEFERRED;
    } catch (IOException ex) {
      metrics.recordCompressionFailure();
      fallback.error("Failed to inspect rotated file {}", file, ex);
      return Outcome.FAILED;
    }
    long ageMillis = clock.nowMillis() - identity.lastModified().toMillis();
    if (ageMillis < compressAfter.toMillis()) {
      return Outcome.DEFERRED;
    }
    Path part = file.resolveSibling(file.getFileName() + PART_SUFFIX);
    try {
      Files.deleteIfExists(part);
      gzip(file, part);
      long archived = Files.size(part);
      if (archived == 0L) {
        throw new IOException("Archive " + part + " is empty");
      }
      if (!writer.publishArchive(file, identity, part)) {
        Files.deleteIfExists(part);
        return Outcome.DEFERRED;
      }
      long saved = identity.size() - archived;
      metrics.recordCompression(saved);
      return new Outcome(Status.COMPRESSED, Math.max(0L, saved));
    } catch (IOException ex) {
      discardPart(part, ex);
      metrics.recordCompressionFailure();
      fallback.error("Failed to compress {}; original kept for the next sweep", file, ex);
      return Outcome.FAILED;
    }
  }

  private static void gzip(Path source, Path target) throws IOException {
    try (InputStream in = Files.newInputStream(source);
        OutputStream file = Files.newOutputStream(
            target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        GZIPOutputStream out = new GZIPOutputStream(file, BUFFER_BYTES)) {
      in.transferTo(out);
      out.finish();
    }
  }

  private static void discardPart(Path part, IOException cause) {
    try {
      Files.deleteIfExists(part);
    } catch (IOException cleanup) {
      cause.addSuppressed(cleanup);
    }
  }

  private void scheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException ex) {
      metrics.recordCompressionFailure();
      fallback.error("Compression sweep aborted", ex);
    }
  }

  private void handleCrash(Thread thread, Throwable throwable) {
    metrics.recordCompressionFailure();
    fallback.error("Compression thread {} threw an uncaught exception", thread.getName(), throwable);
  }

  private enum Status {
    COMPRESSED,
    DEFERRED,
    FAILED
  }

  private record Outcome(Status status, long savedBytes) {
    static final Outcome DEFERRED = new Outcome(Status.DEFERRED, 0L);
    static final Outcome FAILED = new Outcome(Status.FAILED, 0L);
  }
}
