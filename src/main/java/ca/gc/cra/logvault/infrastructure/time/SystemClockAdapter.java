package ca.gc.cra.logvault.infrastructure.time;

import ca.gc.cra.logvault.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing; rotation age checks tolerate
   *     backwards steps by treating negative ages as zero.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
