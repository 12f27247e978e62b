package ca.gc.cra.logvault.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for configuration strings such as file names and service names.
 * <p><strong>Why:</strong> Keeps blank or control-character values out of file paths and base fields.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Ensures a value can be used as a single file name segment.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate file name
   * @return trimmed value free of path separators
   * @throws IllegalArgumentException if the value is blank or contains {@code /} or {@code \}
   */
  public static String requireFileName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.indexOf('/') >= 0 || sanitized.indexOf('\\') >= 0
        || sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must be a plain file name (was '" + sanitized + "')"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
