package ca.gc.cra.logvault.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human-friendly duration strings used in configuration.
 *
 * <p>Accepted forms: {@code 500ms}, {@code 5s}, {@code 10m}, {@code 1h}, {@code 2d}, ISO-8601 such as
 * {@code PT5S}, or a bare number of seconds. Fractions are allowed ({@code 1.5s}).</p>
 *
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern SUFFIXED = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d)?$");

  private Durations() {
    // Utility
  }

  /**
   * Parses a duration option.
   *
   * @param option dotted key used in error messages
   * @param raw configured text
   * @return parsed duration
   * @throws ConfigurationException when the text is blank or malformed
   */
  public static Duration parse(String option, String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigurationException(option, "duration must not be blank");
    }
    String value = raw.trim();
    if (value.startsWith("P") || value.startsWith("p")) {
      try {
        return Duration.parse(value.toUpperCase(Locale.ROOT));
      } catch (DateTimeParseException ex) {
        throw new ConfigurationException(option, "malformed ISO-8601 duration '" + raw + "'", ex);
      }
    }
    Matcher matcher = SUFFIXED.matcher(value.toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new ConfigurationException(
          option, "malformed duration '" + raw + "' (expected e.g. 500ms, 5s, 10m, 1h, 2d or PT5S)");
    }
    double amount = Double.parseDouble(matcher.group(1));
    String unit = matcher.group(2) == null ? "s" : matcher.group(2);
    double millis = switch (unit) {
      case "ms" -> amount;
      case "m" -> amount * 60_000d;
      case "h" -> amount * 3_600_000d;
      case "d" -> amount * 86_400_000d;
      default -> amount * 1_000d;
    };
    return Duration.ofMillis(Math.round(millis));
  }

  /**
   * Converts a fractional number of days into a duration.
   *
   * @param days day count; may be fractional
   * @return equivalent duration rounded to the millisecond
   */
  public static Duration ofDays(double days) {
    return Duration.ofMillis(Math.round(days * 86_400_000d));
  }
}
