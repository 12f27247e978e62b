package ca.gc.cra.logvault.infrastructure.rotation;

import java.time.Duration;
import java.util.Objects;

/**
 * Rotation thresholds and retention shared by every destination.
 *
 * @param maxBytes size threshold; a write that would push the current file past it rotates first
 * @param maxAge age threshold measured from the moment the current file was opened
 * @param maxBackups numbered files retained; {@code 0} keeps no history
 * @since 0.1.0
 */
public record RotationPolicy(long maxBytes, Duration maxAge, int maxBackups) {
  public RotationPolicy {
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (maxAge.isZero() || maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must be positive");
    }
    if (maxBackups < 0) {
      throw new IllegalArgumentException("maxBackups must not be negative");
    }
  }
}
