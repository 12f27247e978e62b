package ca.gc.cra.logvault.domain.entry;

import java.util.Locale;
import java.util.Optional;

/**
 * Caller-supplied tag that makes an entry eligible for the access or metrics destination.
 *
 * @since 0.1.0
 */
public enum EntryKind {
  /** Regular application entry. */
  STANDARD,
  /** HTTP-style access record. */
  ACCESS,
  /** Operational metrics record. */
  METRICS;

  /** Reserved field name that tags an entry when no view tag is present. */
  public static final String TAG_FIELD = "log_type";

  /**
   * Resolves the tag carried in a {@value #TAG_FIELD} field value.
   *
   * @param raw field value; may be {@code null}
   * @return matching kind, or empty when the value names no tagged destination
   */
  public static Optional<EntryKind> fromTag(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "access" -> Optional.of(ACCESS);
      case "metrics" -> Optional.of(METRICS);
      default -> Optional.empty();
    };
  }

  /**
   * Returns the value written into the {@value #TAG_FIELD} field for this kind.
   *
   * @return lowercase tag
   */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
