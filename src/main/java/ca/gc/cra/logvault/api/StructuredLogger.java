package ca.gc.cra.logvault.api;

import ca.gc.cra.logvault.application.metrics.MetricsSnapshot;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Structured logging surface handed to application code.
 * <p><strong>Why:</strong> Callers hold an explicitly constructed logger instead of looking one up by name;
 * derived views carry bound fields and tags without touching shared state.</p>
 * <p><strong>Role:</strong> Implemented by {@link LogEngine} and the views it returns.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Emit entries; {@code emit} never throws and never blocks longer than one synchronous file write.</li>
 *   <li>Derive views ({@code withFields}, {@code withComponent}, {@code asAccess}, ...) that share the engine's
 *   writers. Deriving a view performs no I/O.</li>
 *   <li>Flush and close the shared engine.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every implementation is safe for concurrent use; views are immutable.</p>
 *
 * @since 0.1.0
 */
public interface StructuredLogger extends Closeable {
  /**
   * Emits one entry. Entries below the configured level are discarded; failures are counted, never thrown.
   *
   * @param level severity; {@link LogLevel#FATAL} does not terminate the process
   * @param message message text
   * @param fields call-site fields; override bound fields with the same key
   */
  void emit(LogLevel level, String message, Map<String, ?> fields);

  default void emit(LogLevel level, String message) {
    emit(level, message, Collections.emptyMap());
  }

  default void debug(String message) {
    emit(LogLevel.DEBUG, message);
  }

  default void debug(String message, Map<String, ?> fields) {
    emit(LogLevel.DEBUG, message, fields);
  }

  default void info(String message) {
    emit(LogLevel.INFO, message);
  }

  default void info(String message, Map<String, ?> fields) {
    emit(LogLevel.INFO, message, fields);
  }

  default void warn(String message) {
    emit(LogLevel.WARN, message);
  }

  default void warn(String message, Map<String, ?> fields) {
    emit(LogLevel.WARN, message, fields);
  }

  default void error(String message) {
    emit(LogLevel.ERROR, message);
  }

  default void error(String message, Map<String, ?> fields) {
    emit(LogLevel.ERROR, message, fields);
  }

  default void fatal(String message) {
    emit(LogLevel.FATAL, message);
  }

  default void fatal(String message, Map<String, ?> fields) {
    emit(LogLevel.FATAL, message, fields);
  }

  /**
   * Tests whether entries at {@code level} reach the destinations.
   *
   * @param level level to test
   * @return {@code true} when the level passes the configured minimum
   */
  boolean isEnabled(LogLevel level);

  /**
   * Returns a view whose entries carry {@code fields}; later bindings override earlier ones.
   *
   * @param fields fields to bind
   * @return new view sharing this logger's engine
   */
  StructuredLogger withFields(Map<String, ?> fields);

  default StructuredLogger withField(String key, Object value) {
    return withFields(Collections.singletonMap(key, value));
  }

  /**
   * Returns a view whose entries belong to {@code component}.
   *
   * @param component logical component name
   * @return new view
   */
  StructuredLogger withComponent(String component);

  default StructuredLogger withRequestId(String requestId) {
    return withField("request_id", requestId);
  }

  /**
   * Binds a duration as {@code duration} and as fractional {@code duration_ms}.
   *
   * @param duration elapsed time
   * @return new view
   */
  default StructuredLogger withDuration(Duration duration) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("duration", duration);
    fields.put("duration_ms", duration == null ? 0d : duration.toNanos() / 1_000_000d);
    return withFields(fields);
  }

  default StructuredLogger withError(Throwable error) {
    return withField("error", error);
  }

  default StructuredLogger named(String name) {
    return withField("logger", name);
  }

  /**
   * Returns a view whose entries are tagged for the access destination.
   *
   * @return new view
   */
  StructuredLogger asAccess();

  /**
   * Returns a view whose entries are tagged for the metrics destination.
   *
   * @return new view
   */
  StructuredLogger asMetrics();

  /**
   * Emits one HTTP access record to the access destination.
   *
   * <p>The level is {@code error} for status 500 and above, {@code warn} for 400 and above and {@code info}
   * otherwise. The message reads {@code "METHOD path status"}.</p>
   *
   * @param method request method
   * @param path request path
   * @param query raw query string; may be empty
   * @param status response status code
   * @param duration time to serve the request
   * @param bytesWritten response size in bytes
   * @param userAgent client user agent
   * @param remoteAddr client address
   * @param requestId correlation id
   */
  default void logAccess(
      String method,
      String path,
      String query,
      int status,
      Duration duration,
      long bytesWritten,
      String userAgent,
      String remoteAddr,
      String requestId) {
    Duration elapsed = duration == null ? Duration.ZERO : duration;
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("request_id", orEmpty(requestId));
    fields.put("method", method);
    fields.put("path", path);
    fields.put("query", orEmpty(query));
    fields.put("status_code", status);
    fields.put("duration", elapsed);
    fields.put("duration_ms", elapsed.toNanos() / 1_000_000d);
    fields.put("user_agent", orEmpty(userAgent));
    fields.put("remote_addr", orEmpty(remoteAddr));
    fields.put("bytes_written", bytesWritten);
    fields.put("component", "http_server");
    LogLevel level = status >= 500 ? LogLevel.ERROR : status >= 400 ? LogLevel.WARN : LogLevel.INFO;
    asAccess().emit(level, method + " " + path + " " + status, fields);
  }

  /**
   * Writes every entry accepted before the call and flushes the destination files.
   *
   * @throws IOException if a destination file cannot be flushed
   */
  void flush() throws IOException;

  /**
   * Drains the buffer, stops background work and closes every file. Later emits are rejected and counted.
   *
   * @throws IOException if a destination file cannot be closed
   */
  @Override
  void close() throws IOException;

  /**
   * Captures the engine's operational counters.
   *
   * @return immutable snapshot
   */
  MetricsSnapshot metricsSnapshot();

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
