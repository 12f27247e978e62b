package ca.gc.cra.logvault.domain.entry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable record of one log event.
 * <p><strong>Role:</strong> Created by the logger facade at emit time and consumed exactly once, either by the
 * async consumer or by the synchronous fallback path.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the field map is an unmodifiable ordered copy.</p>
 *
 * @param timestamp creation instant
 * @param level severity
 * @param message human readable message; {@code null} becomes empty
 * @param fields ordered structured fields
 * @param component logical component name; may be {@code null}
 * @param kind destination tag
 * @param sourceLocation {@code Class.method:line} of the call site; may be {@code null}
 * @since 0.1.0
 */
public record LogEntry(
    Instant timestamp,
    LogLevel level,
    String message,
    Map<String, FieldValue> fields,
    String component,
    EntryKind kind,
    String sourceLocation) {

  public LogEntry {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(kind, "kind");
    message = message == null ? "" : message;
    fields = fields == null || fields.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Creates an untagged entry without component or source location.
   *
   * @param timestamp creation instant
   * @param level severity
   * @param message message text
   * @param fields structured fields
   * @return new entry
   */
  public static LogEntry of(Instant timestamp, LogLevel level, String message, Map<String, FieldValue> fields) {
    return new LogEntry(timestamp, level, message, fields, null, EntryKind.STANDARD, null);
  }

  /**
   * Tests whether the caller tagged this entry with {@code candidate}.
   *
   * @param candidate kind to test
   * @return {@code true} when tagged
   */
  public boolean isKind(EntryKind candidate) {
    return kind == candidate;
  }
}
