package ca.gc.cra.logvault.application.metrics;

import ca.gc.cra.logvault.application.port.ClockPort;
import ca.gc.cra.logvault.application.port.MetricsPort;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.FieldValue;
import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Lock-free counters observing the facade, async buffer, rotation and compression.
 * <p><strong>Why:</strong> Degradations (overflow, drop on shutdown, write failures) are never raised to callers;
 * these counters are how they become visible.</p>
 * <p><strong>Role:</strong> Shared by every LOGVAULT component; mirrors each event into a {@link MetricsPort}.</p>
 * <p><strong>Thread-safety:</strong> Counters use {@link LongAdder} and CAS loops; map keys are created with
 * {@link ConcurrentMap#computeIfAbsent}. No lock is taken on the recording path.</p>
 * <p><strong>Performance:</strong> When disabled every recording call returns after one boolean check.</p>
 *
 * @since 0.1.0
 */
public final class LogMetricsCollector {
  static final int MAX_TRACKED_PATHS = 1_000;
  static final int MAX_TRACKED_COMPONENTS = 1_000;
  private static final double WRITE_TIME_EMA_WEIGHT = 0.1d;

  private final boolean enabled;
  private final MetricsPort exporter;
  private final ClockPort clock;

  private final LongAdder accepted = new LongAdder();
  private final LongAdder written = new LongAdder();
  private final LongAdder overflow = new LongAdder();
  private final LongAdder dropped = new LongAdder();
  private final LongAdder rejected = new LongAdder();
  private final LongAdder flushes = new LongAdder();
  private final LongAdder rotations = new LongAdder();
  private final LongAdder compressedFiles = new LongAdder();
  private final LongAdder compressionFailures = new LongAdder();
  private final LongAdder compressionSaved = new LongAdder();
  private final LongAdder writeErrors = new LongAdder();
  private final Map<LogLevel, LongAdder> byLevel = new EnumMap<>(LogLevel.class);
  private final ConcurrentMap<String, LongAdder> byComponent = new ConcurrentHashMap<>();
  private final AtomicLong lastFlushMillis = new AtomicLong();
  private final AtomicLong writeTimeEmaBits = new AtomicLong(Double.doubleToRawLongBits(0d));

  private final LongAdder requests = new LongAdder();
  private final LongAdder requestErrors = new LongAdder();
  private final LongAdder bytesTransferred = new LongAdder();
  private final LongAdder responseNanos = new LongAdder();
  private final AtomicLong minResponseNanos = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong maxResponseNanos = new AtomicLong();
  private final ConcurrentMap<Integer, LongAdder> byStatus = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongAdder> byMethod = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongAdder> byPath = new ConcurrentHashMap<>();

  private volatile long collectionStartMillis;
  private volatile IntSupplier bufferOccupancy = () -> 0;
  private volatile int bufferCapacity;
  private volatile Supplier<Map<Destination, Long>> fileSizes = Map::of;

  /**
   * Creates a collector.
   *
   * @param enabled when {@code false} every recording call is a no-op
   * @param exporter port mirroring counters to an external backend
   * @param clock time source for the collection window and flush timestamps
   */
  public LogMetricsCollector(boolean enabled, MetricsPort exporter, ClockPort clock) {
    this.enabled = enabled;
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.clock = Objects.requireNonNull(clock, "clock");
    for (LogLevel level : LogLevel.values()) {
      byLevel.put(level, new LongAdder());
    }
    this.collectionStartMillis = clock.nowMillis();
  }


  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Binds the async buffer gauges read at snapshot time.
   *
   * @param occupancy supplier of the current queue depth
   * @param capacity fixed queue capacity
   */
  public void bindBuffer(IntSupplier occupancy, int capacity) {
    this.bufferOccupancy = Objects.requireNonNull(occupancy, "occupancy");
    this.bufferCapacity = capacity;
  }

  /**
   * Binds the per-destination file size gauge read at snapshot time.
   *
   * @param sizes supplier of current file sizes
   */
  public void bindFileSizes(Supplier<Map<Destination, Long>> sizes) {
    this.fileSizes = Objects.requireNonNull(sizes, "sizes");
  }

  /**
   * Counts an entry accepted by the facade and, for access-tagged entries, its request fields.
   *
   * @param entry accepted entry
   */
  public void recordAccepted(LogEntry entry) {
    if (!enabled) {
      return;
    }
    accepted.increment();
    byLevel.get(entry.level()).increment();
    exporter.increment("logvault.entries.accepted");
    exporter.increment("logvault.entries.level." + entry.level().label());
    String component = entry.component();
    if (component != null) {
      LongAdder counter = byComponent.get(component);
      if (counter == null && byComponent.size() < MAX_TRACKED_COMPONENTS) {
        counter = byComponent.computeIfAbsent(component, key -> new LongAdder());
      }
      if (counter != null) {
        counter.increment();
      }
    }
    if (entry.isKind(EntryKind.ACCESS)) {
      recordAccessFields(entry.fields());
    }
  }

  /**
   * Counts entries handed to destination writers by the consumer or the synchronous path.
   *
   * @param count number of entries
   */
  public void recordWritten(int count) {
    if (!enabled || count <= 0) {
      return;
    }
    written.add(count);
    exporter.observe("logvault.entries.written", count);
  }

  /**
   * Folds one entry write duration into the moving average.
   *
   * @param nanos write duration
   */
  public void recordWriteTime(long nanos) {
    if (!enabled) {
      return;
    }
    updateEma(writeTimeEmaBits, nanos);
    exporter.observe("logvault.write.latencyNanos", nanos);
  }

  public void recordOverflow() {
    if (!enabled) {
      return;
    }
    overflow.increment();
    exporter.increment("logvault.buffer.overflow");
  }

  /**
   * Counts entries discarded because the shutdown drain timed out.
   *
   * @param count number of entries
   */
  public void recordDropped(int count) {
    if (!enabled || count <= 0) {
      return;
    }
    dropped.add(count);
    exporter.observe("logvault.shutdown.dropped", count);
  }

  public void recordRejected() {
    if (!enabled) {
      return;
    }
    rejected.increment();
    exporter.increment("logvault.entries.rejected");
  }

  public void recordFlush() {
    if (!enabled) {
      return;
    }
    flushes.increment();
    lastFlushMillis.set(clock.nowMillis());
    exporter.increment("logvault.buffer.flush");
  }

  /**
   * Counts one rotation.
   *
   * @param destination rotated destination
   */
  public void recordRotation(Destination destination) {
    if (!enabled) {
      return;
    }
    rotations.increment();
    exporter.increment("logvault.rotation." + destination.directory());
  }

  /**
   * Counts one archived file.
   *
   * @param savedBytes original size minus archive size; negative values count as zero
   */
  public void recordCompression(long savedBytes) {
    if (!enabled) {
      return;
    }
    compressedFiles.increment();
    compressionSaved.add(Math.max(0L, savedBytes));
    exporter.increment("logvault.compression.files");
    exporter.observe("logvault.compression.savedBytes", Math.max(0L, savedBytes));
  }

  public void recordCompressionFailure() {
    if (!enabled) {
      return;
    }
    compressionFailures.increment();
    exporter.increment("logvault.compression.failure");
  }

  /**
   * Counts one failed destination write or flush.
   *
   * @param destination failing destination
   */
  public void recordWriteError(Destination destination) {
    if (!enabled) {
      return;
    }
    writeErrors.increment();
    exporter.increment("logvault.write.error." + destination.directory());
  }

  /**
   * Records one HTTP-style request.
   *
   * @param method request method; may be {@code null}
   * @param path request path; may be {@code null}
   * @param status response status code
   * @param responseTime time to serve the request
   * @param bytes response bytes; negative values count as zero
   */
  public void recordAccess(String method, String path, int status, Duration responseTime, long bytes) {
    if (!enabled) {
      return;
    }
    long nanos = responseTime == null ? 0L : Math.max(0L, responseTime.toNanos());
    requests.increment();
    responseNanos.add(nanos);
    bytesTransferred.add(Math.max(0L, bytes));
    minResponseNanos.accumulateAndGet(nanos, Math::min);
    maxResponseNanos.accumulateAndGet(nanos, Math::max);
    byStatus.computeIfAbsent(status, key -> new LongAdder()).increment();
    if (method != null) {
      byMethod.computeIfAbsent(method, key -> new LongAdder()).increment();
    }
    if (path != null) {
      LongAdder counter = byPath.get(path);
      if (counter == null && byPath.size() < MAX_TRACKED_PATHS) {
        counter = byPath.computeIfAbsent(path, key -> new LongAdder());
      }
      if (counter != null) {
        counter.increment();
      }
    }
    if (status >= 400) {
      requestErrors.increment();
      exporter.increment("logvault.access.error");
    }
    exporter.increment("logvault.access.requests");
    exporter.observe("logvault.access.responseNanos", nanos);
  }

  /**
   * Captures the current counters.
   *
   * @return immutable snapshot
   */
  public MetricsSnapshot snapshot() {
    long now = clock.nowMillis();
    long start = collectionStartMillis;
    Map<LogLevel, Long> levels = new EnumMap<>(LogLevel.class);
    byLevel.forEach((level, counter) -> levels.put(level, counter.sum()));
    long lastFlush = lastFlushMillis.get();
    return new MetricsSnapshot(
        Instant.ofEpochMilli(start),
        Instant.ofEpochMilli(now),
        accepted.sum(),
        levels,
        sums(byComponent),
        bufferOccupancy.getAsInt(),
        bufferCapacity,
        overflow.sum(),
        flushes.sum(),
        lastFlush == 0L ? null : Instant.ofEpochMilli(lastFlush),
        rotations.sum(),
        compressionSaved.sum(),
        compressedFiles.sum(),
        compressionFailures.sum(),
        writeErrors.sum(),
        written.sum(),
        dropped.sum(),
        rejected.sum(),
        Duration.ofNanos(Math.round(Double.longBitsToDouble(writeTimeEmaBits.get()))),
        fileSizes.get(),
        accessSnapshot(now - start));
  }

  /**
   * Zeroes every counter and restarts the collection window.
   */
  public void reset() {
    for (LongAdder adder : new LongAdder[] {
        accepted, written, overflow, dropped, rejected, flushes, rotations, compressedFiles,
        compressionFailures, compressionSaved, writeErrors, requests, requestErrors,
        bytesTransferred, responseNanos}) {
      adder.reset();
    }
    byLevel.values().forEach(LongAdder::reset);
    byComponent.clear();
    byStatus.clear();
    byMethod.clear();
    byPath.clear();
    minResponseNanos.set(Long.MAX_VALUE);
    maxResponseNanos.set(0L);
    lastFlushMillis.set(0L);
    writeTimeEmaBits.set(Double.doubleToRawLongBits(0d));
    collectionStartMillis = clock.nowMillis();
  }

  private void recordAccessFields(Map<String, FieldValue> fields) {
    String method = Fields.text(fields, "method");
    if (!(fields.get("status_code") instanceof FieldValue.Int status) || method == null) {
      return;
    }
    Duration duration = Duration.ZERO;
    FieldValue rawDuration = fields.get("duration");
    if (rawDuration instanceof FieldValue.Elapsed elapsed) {
      duration = elapsed.value();
    } else if (fields.get("duration_ms") instanceof FieldValue.Decimal millis) {
      duration = Duration.ofNanos(Math.round(millis.value() * 1_000_000d));
    } else if (fields.get("duration_ms") instanceof FieldValue.Int millis) {
      duration = Duration.ofMillis(millis.value());
    }
    long bytes = fields.get("bytes_written") instanceof FieldValue.Int sent ? sent.value() : 0L;
    recordAccess(method, Fields.text(fields, "path"), (int) status.value(), duration, bytes);
  }

  private MetricsSnapshot.AccessSnapshot accessSnapshot(long windowMillis) {
    long total = requests.sum();
    long min = minResponseNanos.get();
    double seconds = windowMillis / 1_000d;
    return new MetricsSnapshot.AccessSnapshot(
        total,
        requestErrors.sum(),
        sums(byStatus),
        sums(byMethod),
        sums(byPath),
        Duration.ofNanos(total == 0 || min == Long.MAX_VALUE ? 0L : min),
        Duration.ofNanos(maxResponseNanos.get()),
        Duration.ofNanos(total == 0 ? 0L : responseNanos.sum() / total),
        bytesTransferred.sum(),
        seconds > 0d ? total / seconds : 0d);
  }

  private static <K> Map<K, Long> sums(Map<K, LongAdder> counters) {
    Map<K, Long> result = new HashMap<>();
    counters.forEach((key, counter) -> result.put(key, counter.sum()));
    return result;
  }

  private static void updateEma(AtomicLong emaBits, long sample) {
    while (true) {
      long currentBits = emaBits.get();
      double current = Double.longBitsToDouble(currentBits);
      double next = current == 0d
          ? sample
          : (1 - WRITE_TIME_EMA_WEIGHT) * current + WRITE_TIME_EMA_WEIGHT * sample;
      if (emaBits.compareAndSet(currentBits, Double.doubleToRawLongBits(next))) {
        return;
      }
    }
  }
}
