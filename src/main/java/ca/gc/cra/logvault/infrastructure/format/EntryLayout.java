package ca.gc.cra.logvault.infrastructure.format;

import ca.gc.cra.logvault.domain.entry.LogEntry;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Set;

/**
 * Key names and timestamp layout shared by the JSON and text formatters.
 */
final class EntryLayout {
  static final String TIMESTAMP = "timestamp";
  static final String LEVEL = "level";
  static final String MESSAGE = "message";
  static final String COMPONENT = "component";
  static final String CALLER = "caller";
  static final String CLASH_PREFIX = "fields.";

  private static final Set<String> RESERVED = Set.of(TIMESTAMP, LEVEL, MESSAGE, CALLER);
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSXXX").withZone(ZoneOffset.UTC);

  private EntryLayout() {}

  static String timestamp(LogEntry entry) {
    return TIMESTAMP_FORMAT.format(entry.timestamp());
  }

  /** Field keys that collide with top-level keys are written under {@value #CLASH_PREFIX}. */
  static String fieldKey(String key) {
    return RESERVED.contains(key) ? CLASH_PREFIX + key : key;
  }

  /** The component is written at top level only when no field already carries it. */
  static boolean writeComponent(LogEntry entry) {
    return entry.component() != null && !entry.fields().containsKey(COMPONENT);
  }
}
