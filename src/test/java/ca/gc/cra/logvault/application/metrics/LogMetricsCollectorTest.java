package ca.gc.cra.logvault.application.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import ca.gc.cra.logvault.testutil.MutableClock;
import ca.gc.cra.logvault.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LogMetricsCollectorTest {
  private MutableClock clock;
  private RecordingMetricsPort port;
  private LogMetricsCollector collector;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(1_700_000_000_000L);
    port = new RecordingMetricsPort();
    collector = new LogMetricsCollector(true, port, clock);
  }

  @Test
  void countsAcceptedEntriesByLevelAndComponent() {
    collector.recordAccepted(entry(LogLevel.INFO, "db", EntryKind.STANDARD, Map.of()));
    collector.recordAccepted(entry(LogLevel.INFO, "db", EntryKind.STANDARD, Map.of()));
    collector.recordAccepted(entry(LogLevel.ERROR, null, EntryKind.STANDARD, Map.of()));

    MetricsSnapshot snapshot = collector.snapshot();
    assertEquals(3L, snapshot.totalEntries());
    assertEquals(2L, snapshot.levelCount(LogLevel.INFO));
    assertEquals(1L, snapshot.levelCount(LogLevel.ERROR));
    assertEquals(0L, snapshot.levelCount(LogLevel.DEBUG));
    assertEquals(Map.of("db", 2L), snapshot.componentCounts());
    assertEquals(3, port.count("logvault.entries.accepted"));
    assertEquals(2, port.count("logvault.entries.level.info"));
  }

  @Test
  void accessEntriesFeedRequestStatistics() {
    collector.recordAccepted(access("GET", "/api/users", 200, Duration.ofMillis(10), 512));
    collector.recordAccepted(access("POST", "/api/users", 503, Duration.ofMillis(30), 128));
    clock.advance(Duration.ofSeconds(2));

    MetricsSnapshot.AccessSnapshot access = collector.snapshot().access();
    assertEquals(2L, access.totalRequests());
    assertEquals(1L, access.errorCount());
    assertEquals(Map.of(200, 1L, 503, 1L), access.statusCounts());
    assertEquals(Map.of("GET", 1L, "POST", 1L), access.methodCounts());
    assertEquals(Map.of("/api/users", 2L), access.pathCounts());
    assertEquals(Duration.ofMillis(10), access.minResponseTime());
    assertEquals(Duration.ofMillis(30), access.maxResponseTime());
    assertEquals(Duration.ofMillis(20), access.averageResponseTime());
    assertEquals(640L, access.bytesTransferred());
    assertEquals(1.0d, access.requestsPerSecond(), 1e-9);
  }

  @Test
  void tracksBufferFlushAndRotationCounters() {
    collector.bindBuffer(() -> 7, 10);
    collector.recordOverflow();
    collector.recordFlush();
    collector.recordRotation(Destination.ERROR);
    collector.recordCompression(900L);
    collector.recordCompression(-5L);
    collector.recordWriteError(Destination.ACCESS);
    collector.recordDropped(3);
    collector.recordRejected();

    MetricsSnapshot snapshot = collector.snapshot();
    assertEquals(7, snapshot.bufferOccupancy());
    assertEquals(10, snapshot.bufferCapacity());
    assertEquals(1L, snapshot.overflowCount());
    assertEquals(1L, snapshot.flushCount());
    assertEquals(Instant.ofEpochMilli(clock.nowMillis()), snapshot.lastFlush().orElseThrow());
    assertEquals(1L, snapshot.rotationCount());
    assertEquals(2L, snapshot.compressedFileCount());
    assertEquals(900L, snapshot.compressionBytesSaved());
    assertEquals(1L, snapshot.writeErrorCount());
    assertEquals(3L, snapshot.droppedOnShutdown());
    assertEquals(1L, snapshot.rejectedAfterClose());
    assertEquals(1, port.count("logvault.rotation.error"));
    assertEquals(1, port.count("logvault.write.error.access"));
  }

  @Test
  void resetZeroesCountersAndRestartsWindow() {
    collector.recordAccepted(entry(LogLevel.WARN, "api", EntryKind.STANDARD, Map.of()));
    collector.recordFlush();
    clock.advance(Duration.ofMinutes(5));

    collector.reset();

    MetricsSnapshot snapshot = collector.snapshot();
    assertEquals(0L, snapshot.totalEntries());
    assertEquals(0L, snapshot.flushCount());
    assertTrue(snapshot.lastFlush().isEmpty());
    assertTrue(snapshot.componentCounts().isEmpty());
    assertEquals(Instant.ofEpochMilli(clock.nowMillis()), snapshot.collectionStart());
  }

  @Test
  void disabledCollectorRecordsNothing() {
    LogMetricsCollector disabled = new LogMetricsCollector(false, port, clock);
    disabled.recordAccepted(entry(LogLevel.INFO, null, EntryKind.STANDARD, Map.of()));
    disabled.recordOverflow();

    assertEquals(0L, disabled.snapshot().totalEntries());
    assertEquals(0L, disabled.snapshot().overflowCount());
    assertTrue(!port.hasCounter("logvault.entries.accepted"));
  }

  private LogEntry entry(LogLevel level, String component, EntryKind kind, Map<String, ?> fields) {
    return new LogEntry(Instant.ofEpochMilli(clock.nowMillis()), level, "m", Fields.of(fields), component, kind, null);
  }

  private LogEntry access(String method, String path, int status, Duration duration, long bytes) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("method", method);
    fields.put("path", path);
    fields.put("status_code", status);
    fields.put("duration", duration);
    fields.put("bytes_written", bytes);
    return entry(LogLevel.INFO, "http_server", EntryKind.ACCESS, fields);
  }
}
