package ca.gc.cra.logvault.testutil;

import ca.gc.cra.logvault.application.port.ClockPort;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually advanced clock for rotation age and compression delay tests.
 */
public final class MutableClock implements ClockPort {
  private final AtomicLong millis;

  public MutableClock(long startMillis) {
    this.millis = new AtomicLong(startMillis);
  }

  public static MutableClock atSystemTime() {
    return new MutableClock(System.currentTimeMillis());
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(Duration amount) {
    millis.addAndGet(amount.toMillis());
  }
}
