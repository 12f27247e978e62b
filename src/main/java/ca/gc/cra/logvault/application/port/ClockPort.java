package ca.gc.cra.logvault.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to entry stamping, rotation age checks and the
 * compression sweep.
 * <p><strong>Why:</strong> Age-based rotation and delayed compression need a deterministic clock under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; producer threads, the async consumer
 * and the compression task all read the clock.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.logvault.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
