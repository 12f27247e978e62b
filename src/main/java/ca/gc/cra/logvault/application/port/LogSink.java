package ca.gc.cra.logvault.application.port;

import ca.gc.cra.logvault.domain.entry.LogEntry;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Output port that formats entries and hands the bytes to their destination writers.
 * <p><strong>Why:</strong> Decouples the async buffer from routing, formatting and file rotation so the same
 * path serves consumer batches and the synchronous overflow fallback.</p>
 * <p><strong>Role:</strong> Implemented by {@code DestinationSink}; wrapped by {@code AsyncLogWriter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write each entry to every destination selected for it.</li>
 *   <li>Absorb per-destination I/O failures, counting them instead of throwing.</li>
 *   <li>Flush buffered bytes on request and release file handles on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls; the consumer thread and
 * overflowing producers write at the same time.</p>
 *
 * @since 0.1.0
 */
public interface LogSink extends AutoCloseable {
  /**
   * Writes one entry and flushes the destinations it touched.
   *
   * @param entry entry to write; must not be {@code null}
   */
  void write(LogEntry entry);

  /**
   * Writes a batch of entries, flushing each touched destination once at the end.
   *
   * @param entries entries in FIFO order; must not be {@code null}
   */
  default void writeBatch(List<LogEntry> entries) {
    for (LogEntry entry : entries) {
      write(entry);
    }
  }

  /**
   * Flushes buffered bytes for every open destination.
   *
   * @throws IOException if a destination cannot be flushed
   */
  void flush() throws IOException;

  /**
   * Closes every destination handle.
   *
   * @throws IOException if a handle fails to close
   */
  @Override
  void close() throws IOException;
}
