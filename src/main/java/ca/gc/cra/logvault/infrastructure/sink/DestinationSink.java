package ca.gc.cra.logvault.infrastructure.sink;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.EntryFormatter;
import ca.gc.cra.logvault.application.port.LogSink;
import ca.gc.cra.logvault.application.routing.DestinationRouter;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.infrastructure.rotation.RotatingFileWriter;
import ca.gc.cra.logvault.infrastructure.rotation.RotationManager;
import ca.gc.cra.logvault.logging.FallbackLog;
import ca.gc.cra.logvault.logging.Logs;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> {@link LogSink} that formats each entry once and writes it to every routed destination
 * and, optionally, the console.
 * <p><strong>Why:</strong> One write path for consumer batches, overflow writes and synchronous mode.</p>
 * <p><strong>Role:</strong> Adapter between the async buffer and {@link RotationManager}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Route through {@link DestinationRouter}; skip destinations without a writer.</li>
 *   <li>Isolate failures per destination. A failed write is counted and reported on {@link FallbackLog}; the
 *   remaining destinations still receive the entry.</li>
 *   <li>Flush each touched destination once per batch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each {@link RotatingFileWriter} serializes itself.</p>
 * <p><strong>Observability:</strong> Records write latency and per-destination write errors.</p>
 *
 * @since 0.1.0
 */
public final class DestinationSink implements LogSink {
  private static final int EXCERPT_BYTES = 256;

  private final DestinationRouter router;
  private final EntryFormatter formatter;
  private final RotationManager rotation;
  private final ConsoleSink console;
  private final LogMetricsCollector metrics;
  private final FallbackLog fallback;

  /**
   * Creates a sink.
   *
   * @param router destination selection
   * @param formatter line encoder
   * @param rotation file owner; {@code null} when file output is disabled
   * @param console console target; {@code null} when console output is disabled
   * @param metrics collector for write timings and errors
   * @param fallback error path for failed writes
   */
  public DestinationSink(
      DestinationRouter router,
      EntryFormatter formatter,
      RotationManager rotation,
      ConsoleSink console,
      LogMetricsCollector metrics,
      FallbackLog fallback) {
    this.router = Objects.requireNonNull(router, "router");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.rotation = rotation;
    this.console = console;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  @Override
  public void write(LogEntry entry) {
    writeBatch(List.of(entry));
  }

  @Override
  public void writeBatch(List<LogEntry> entries) {
    Objects.requireNonNull(entries, "entries");
    Set<Destination> touched = EnumSet.noneOf(Destination.class);
    for (LogEntry entry : entries) {
      writeOne(entry, touched);
    }
    for (Destination destination : touched) {
      RotatingFileWriter writer = rotation.writer(destination);
      try {
        writer.flush();
      } catch (IOException ex) {
        metrics.recordWriteError(destination);
        fallback.error("Failed to flush {}: {}", writer.path(), ex.getMessage(), ex);
      }
    }
    if (console != null) {
      console.flush();
    }
  }

  @Override
  public void flush() throws IOException {
    if (rotation != null) {
      rotation.flush();
    }
    if (console != null) {
      console.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (console != null) {
      console.flush();
    }
    if (rotation != null) {
      rotation.close();
    }
  }

  private void writeOne(LogEntry entry, Set<Destination> touched) {
    long started = System.nanoTime();
    byte[] line;
    try {
      line = formatter.format(entry);
    } catch (RuntimeException ex) {
      metrics.recordWriteError(Destination.APPLICATION);
      fallback.error("Failed to format entry '{}'", Logs.truncate(entry.message(), EXCERPT_BYTES), ex);
      return;
    }
    if (console != null && !console.write(line)) {
      fallback.error("Console stream reported an error writing '{}'", Logs.truncate(entry.message(), EXCERPT_BYTES));
    }
    if (rotation != null) {
      for (Destination destination : router.route(entry)) {
        if (!rotation.destinations().contains(destination)) {
          continue;
        }
        RotatingFileWriter writer = rotation.writer(destination);
        try {
          writer.write(line);
          touched.add(destination);
        } catch (IOException ex) {
          metrics.recordWriteError(destination);
          fallback.error(
              "Failed to write to {} ({}): '{}'",
              destination.directory(),
              ex.getMessage(),
              Logs.truncate(entry.message(), EXCERPT_BYTES),
              ex);
        }
      }
    }
    metrics.recordWriteTime(System.nanoTime() - started);
  }
}
