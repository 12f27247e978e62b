package ca.gc.cra.logvault.application.metrics;

import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the collector at the moment {@link LogMetricsCollector#snapshot()} ran.
 *
 * <p>Each counter is individually consistent; the snapshot is not transactional across fields.</p>
 *
 * @param collectionStart start of the current collection window
 * @param capturedAt time the snapshot was taken
 * @param totalEntries entries accepted by emit
 * @param levelCounts accepted entries per level
 * @param componentCounts accepted entries per component
 * @param bufferOccupancy entries currently queued in the async buffer
 * @param bufferCapacity fixed async buffer capacity; zero when async is disabled
 * @param overflowCount entries written synchronously because the buffer was full
 * @param flushCount batch flushes performed
 * @param lastFlushTime time of the most recent flush; {@code null} before the first one
 * @param rotationCount rotations across all destinations
 * @param compressionBytesSaved bytes reclaimed by compression
 * @param compressedFileCount rotated files archived
 * @param compressionFailureCount archive attempts that failed
 * @param writeErrorCount destination writes that failed
 * @param entriesWritten entries written by the consumer or the synchronous path, excluding overflow writes
 * @param droppedOnShutdown entries discarded when the drain timed out
 * @param rejectedAfterClose emits refused because the logger was closed
 * @param averageWriteTime exponential moving average of one entry write
 * @param fileSizes current file size per opened destination
 * @param access HTTP-style access counters
 * @since 0.1.0
 */
public record MetricsSnapshot(
    Instant collectionStart,
    Instant capturedAt,
    long totalEntries,
    Map<LogLevel, Long> levelCounts,
    Map<String, Long> componentCounts,
    int bufferOccupancy,
    int bufferCapacity,
    long overflowCount,
    long flushCount,
    Instant lastFlushTime,
    long rotationCount,
    long compressionBytesSaved,
    long compressedFileCount,
    long compressionFailureCount,
    long writeErrorCount,
    long entriesWritten,
    long droppedOnShutdown,
    long rejectedAfterClose,
    Duration averageWriteTime,
    Map<Destination, Long> fileSizes,
    AccessSnapshot access) {

  public MetricsSnapshot {
    levelCounts = Map.copyOf(levelCounts);
    componentCounts = Map.copyOf(componentCounts);
    fileSizes = Map.copyOf(fileSizes);
  }

  /**
   * Returns the accepted count for one level.
   *
   * @param level level to read
   * @return count, zero when none
   */
  public long levelCount(LogLevel level) {
    return levelCounts.getOrDefault(level, 0L);
  }

  /**
   * Returns the last flush time when one happened.
   *
   * @return optional flush instant
   */
  public Optional<Instant> lastFlush() {
    return Optional.ofNullable(lastFlushTime);
  }

  /**
   * Access-tagged traffic observed during the window.
   *
   * @param totalRequests access entries seen
   * @param errorCount access entries with status 400 or above
   * @param statusCounts requests per status code
   * @param methodCounts requests per method
   * @param pathCounts requests per path, capped at a fixed number of distinct paths
   * @param minResponseTime fastest response; zero when none
   * @param maxResponseTime slowest response; zero when none
   * @param averageResponseTime mean response time; zero when none
   * @param bytesTransferred sum of reported response bytes
   * @param requestsPerSecond requests divided by the window length
   */
  public record AccessSnapshot(
      long totalRequests,
      long errorCount,
      Map<Integer, Long> statusCounts,
      Map<String, Long> methodCounts,
      Map<String, Long> pathCounts,
      Duration minResponseTime,
      Duration maxResponseTime,
      Duration averageResponseTime,
      long bytesTransferred,
      double requestsPerSecond) {

    public AccessSnapshot {
      statusCounts = Map.copyOf(statusCounts);
      methodCounts = Map.copyOf(methodCounts);
      pathCounts = Map.copyOf(pathCounts);
    }
  }
}
