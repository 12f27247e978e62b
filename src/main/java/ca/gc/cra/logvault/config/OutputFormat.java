package ca.gc.cra.logvault.config;

import java.util.Locale;

/** Line encoding written to every destination. */
public enum OutputFormat {
  JSON,
  TEXT;

  /**
   * Parses a configuration label.
   *
   * @param raw {@code json} or {@code text}, case-insensitive
   * @return matching format
   * @throws IllegalArgumentException when the label is unknown
   */
  public static OutputFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "text" -> TEXT;
      default -> throw new IllegalArgumentException("invalid format '" + raw + "' (expected json or text)");
    };
  }
}
