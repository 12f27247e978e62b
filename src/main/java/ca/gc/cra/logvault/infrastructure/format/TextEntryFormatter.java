package ca.gc.cra.logvault.infrastructure.format;

import ca.gc.cra.logvault.application.port.EntryFormatter;
import ca.gc.cra.logvault.domain.entry.FieldValue;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Renders entries as {@code key=value} lines; values containing spaces, quotes or {@code =} are quoted.
 *
 * @since 0.1.0
 */
public final class TextEntryFormatter implements EntryFormatter {

  @Override
  public byte[] format(LogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    StringBuilder line = new StringBuilder(128);
    append(line, EntryLayout.TIMESTAMP, EntryLayout.timestamp(entry));
    append(line, EntryLayout.LEVEL, entry.level().label());
    append(line, EntryLayout.MESSAGE, entry.message());
    if (EntryLayout.writeComponent(entry)) {
      append(line, EntryLayout.COMPONENT, entry.component());
    }
    if (entry.sourceLocation() != null) {
      append(line, EntryLayout.CALLER, entry.sourceLocation());
    }
    for (Map.Entry<String, FieldValue> field : entry.fields().entrySet()) {
      append(line, EntryLayout.fieldKey(field.getKey()), field.getValue().display());
    }
    line.append('\n');
    return line.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static void append(StringBuilder line, String key, String value) {
    if (line.length() > 0) {
      line.append(' ');
    }
    line.append(key).append('=');
    if (!needsQuoting(value)) {
      line.append(value);
      return;
    }
    line.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> line.append("\\\"");
        case '\\' -> line.append("\\\\");
        case '\n' -> line.append("\\n");
        case '\r' -> line.append("\\r");
        case '\t' -> line.append("\\t");
        default -> line.append(c);
      }
    }
    line.append('"');
  }

  private static boolean needsQuoting(String value) {
    if (value.isEmpty()) {
      return true;
    }
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c <= ' ' || c == '=' || c == '"' || c == '\\') {
        return true;
      }
    }
    return false;
  }
}
