package ca.gc.cra.logvault.logging;

import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Last-resort diagnostic stream for failures inside the logging engine itself.
 * <p><strong>Why:</strong> A failing destination cannot report its own failure; this stream goes to the SLF4J
 * backend (stderr by default) and never back into LOGVAULT, so reporting cannot recurse.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the occurrence counter is atomic.</p>
 * <p><strong>Performance:</strong> Repeated failures are rate limited to the first and then every
 * {@value #LOG_EVERY}th occurrence.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class FallbackLog {
  /** Logger name used for fallback diagnostics. */
  public static final String LOGGER_NAME = "ca.gc.cra.logvault.fallback";
  static final int LOG_EVERY = 1_000;

  private final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);
  private final AtomicInteger occurrences = new AtomicInteger();

  /**
   * Reports a failure, subject to rate limiting.
   *
   * @param message SLF4J message pattern
   * @param args pattern arguments; a trailing {@link Throwable} is logged with its stack trace
   */
  public void error(String message, Object... args) {
    int count = occurrences.incrementAndGet();
    if (count == 1 || count % LOG_EVERY == 0) {
      logger.error(message, args);
      if (count >= LOG_EVERY * 100) {
        occurrences.set(0);
      }
    }
  }

  /**
   * Returns failures reported since creation (or since the counter last wrapped).
   *
   * @return occurrence count
   */
  public int occurrences() {
    return occurrences.get();
  }
}
