package ca.gc.cra.logvault.domain.entry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for building the ordered, immutable field maps carried by {@link LogEntry}.
 *
 * @since 0.1.0
 */
public final class Fields {
  private Fields() {
    // Utility
  }

  /**
   * Returns an empty field map.
   *
   * @return immutable empty map
   */
  public static Map<String, FieldValue> empty() {
    return Collections.emptyMap();
  }

  /**
   * Converts caller-supplied values, preserving insertion order.
   *
   * @param raw caller map; {@code null} yields an empty map. Blank keys are skipped.
   * @return immutable ordered map
   */
  public static Map<String, FieldValue> of(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return empty();
    }
    Map<String, FieldValue> converted = new LinkedHashMap<>(raw.size() * 2);
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        continue;
      }
      converted.put(key, FieldValue.from(entry.getValue()));
    }
    return Collections.unmodifiableMap(converted);
  }

  /**
   * Overlays {@code overlay} on top of {@code base}; keys in {@code overlay} win and keep base order.
   *
   * @param base lower priority fields
   * @param overlay higher priority fields
   * @return immutable merged map
   */
  public static Map<String, FieldValue> merge(Map<String, FieldValue> base, Map<String, FieldValue> overlay) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(overlay, "overlay");
    if (overlay.isEmpty()) {
      return base;
    }
    if (base.isEmpty()) {
      return overlay;
    }
    Map<String, FieldValue> merged = new LinkedHashMap<>(base);
    merged.putAll(overlay);
    return Collections.unmodifiableMap(merged);
  }

  /**
   * Reads a string field.
   *
   * @param fields source map
   * @param key field name
   * @return string value, or {@code null} when absent or not text
   */
  public static String text(Map<String, FieldValue> fields, String key) {
    return fields.get(key) instanceof FieldValue.Text text ? text.value() : null;
  }
}
