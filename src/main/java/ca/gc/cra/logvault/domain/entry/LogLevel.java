package ca.gc.cra.logvault.domain.entry;

import java.util.Locale;

/**
 * Severity attached to every {@link LogEntry}, ordered from least to most severe.
 *
 * <p>{@link #FATAL} is a severity only; emitting at that level never terminates the process.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR,
  FATAL;

  /**
   * Returns the lowercase label used in configuration files and formatted output.
   *
   * @return label such as {@code info}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Tests whether this level is at least as severe as {@code threshold}.
   *
   * @param threshold minimum level; must not be {@code null}
   * @return {@code true} when this level passes the threshold
   */
  public boolean isAtLeast(LogLevel threshold) {
    return compareTo(threshold) >= 0;
  }

  /**
   * Parses a configuration label into a level.
   *
   * @param raw label such as {@code debug} or {@code WARN}; {@code warning} is accepted as an alias
   * @return matching level
   * @throws IllegalArgumentException when the label is blank or unknown
   */
  public static LogLevel parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "debug" -> DEBUG;
      case "info" -> INFO;
      case "warn", "warning" -> WARN;
      case "error" -> ERROR;
      case "fatal" -> FATAL;
      default -> throw new IllegalArgumentException(
          "invalid level '" + raw + "' (expected debug, info, warn, error or fatal)");
    };
  }
}
