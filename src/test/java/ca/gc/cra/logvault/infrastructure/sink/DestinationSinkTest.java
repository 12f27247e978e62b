package ca.gc.cra.logvault.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.MetricsPort;
import ca.gc.cra.logvault.application.routing.DestinationRouter;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import ca.gc.cra.logvault.infrastructure.format.TextEntryFormatter;
import ca.gc.cra.logvault.infrastructure.rotation.RotationManager;
import ca.gc.cra.logvault.infrastructure.rotation.RotationPolicy;
import ca.gc.cra.logvault.logging.FallbackLog;
import ca.gc.cra.logvault.testutil.LogCapture;
import ca.gc.cra.logvault.testutil.MutableClock;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DestinationSinkTest {
  private static final Instant TS = Instant.parse("2024-03-01T00:00:00Z");

  @TempDir Path base;

  private MutableClock clock;
  private LogMetricsCollector metrics;
  private RotationManager rotation;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atSystemTime();
    metrics = new LogMetricsCollector(true, MetricsPort.NO_OP, clock);
    rotation = new RotationManager(
        base,
        "svc",
        new RotationPolicy(1_000_000, Duration.ofDays(1), 3),
        EnumSet.allOf(Destination.class),
        clock,
        metrics);
  }

  @Test
  void routesEachEntryToItsDestinations() throws IOException {
    DestinationSink sink = sink(null);

    sink.writeBatch(List.of(
        entry(LogLevel.INFO, "started", EntryKind.STANDARD),
        entry(LogLevel.ERROR, "GET /x 500", EntryKind.ACCESS),
        entry(LogLevel.INFO, "gauge", EntryKind.METRICS)));
    sink.close();

    assertEquals(3, lines(Destination.APPLICATION).size());
    assertEquals(List.of("level=error message=\"GET /x 500\""), lines(Destination.ACCESS));
    assertEquals(List.of("level=error message=\"GET /x 500\""), lines(Destination.ERROR));
    assertEquals(List.of("level=info message=gauge"), lines(Destination.METRICS));
  }

  @Test
  void failingDestinationDoesNotStopOthers() throws IOException {
    Files.createFile(base.resolve("error"));
    DestinationSink sink = sink(null);

    try (LogCapture capture = LogCapture.attach(FallbackLog.LOGGER_NAME)) {
      sink.write(entry(LogLevel.ERROR, "payment declined", EntryKind.STANDARD));
      sink.write(entry(LogLevel.INFO, "retrying", EntryKind.STANDARD));
      sink.flush();

      assertEquals(1, capture.events().size());
      assertTrue(capture.messages().get(0).contains("payment declined"));
    }

    assertEquals(
        List.of("level=error message=\"payment declined\"", "level=info message=retrying"),
        lines(Destination.APPLICATION));
    assertEquals(1L, metrics.snapshot().writeErrorCount());
  }

  @Test
  void consoleReceivesTheSameLinesAsFiles() throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    DestinationSink sink = sink(new ConsoleSink(new PrintStream(buffer, true, StandardCharsets.UTF_8)));

    sink.write(entry(LogLevel.WARN, "disk at 91%", EntryKind.STANDARD));
    sink.close();

    String console = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(console.endsWith("level=warn message=\"disk at 91%\"\n"));
    assertEquals(Files.readString(Destination.APPLICATION.currentFile(base, "svc")), console);
  }

  @Test
  void consoleOnlySinkWritesNoFiles() throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    DestinationSink sink = new DestinationSink(
        DestinationRouter.applicationOnly(),
        new TextEntryFormatter(),
        null,
        new ConsoleSink(new PrintStream(buffer, true, StandardCharsets.UTF_8)),
        metrics,
        new FallbackLog());

    sink.write(entry(LogLevel.INFO, "hello", EntryKind.STANDARD));
    sink.close();

    assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("message=hello"));
    assertFalse(Files.exists(base.resolve("app")));
  }

  private DestinationSink sink(ConsoleSink console) {
    return new DestinationSink(
        new DestinationRouter(EnumSet.allOf(Destination.class)),
        new TextEntryFormatter(),
        rotation,
        console,
        metrics,
        new FallbackLog());
  }

  private static LogEntry entry(LogLevel level, String message, EntryKind kind) {
    return new LogEntry(TS, level, message, Fields.of(Map.of()), null, kind, null);
  }

  private List<String> lines(Destination destination) throws IOException {
    return Files.readAllLines(destination.currentFile(base, "svc")).stream()
        .map(line -> line.substring(line.indexOf(' ') + 1))
        .toList();
  }
}
