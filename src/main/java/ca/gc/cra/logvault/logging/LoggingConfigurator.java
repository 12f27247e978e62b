package ca.gc.cra.logvault.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the level of LOGVAULT's own diagnostic loggers.
 * <p><strong>Why:</strong> Operators can raise engine diagnostics (rotations, sweeps, drain timing) through
 * {@code diagnostics.verbose} without editing the Logback configuration.</p>
 * <p><strong>Thread-safety:</strong> Intended for engine creation; Logback synchronizes level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 * @see FallbackLog
 */
public final class LoggingConfigurator {
  /** Root of every engine logger name. */
  public static final String ENGINE_LOGGER = "ca.gc.cra.logvault";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Sets the engine loggers to DEBUG within the running JVM.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger engine = context.getLogger(ENGINE_LOGGER);
      if (!Level.DEBUG.equals(engine.getLevel())) {
        engine.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose diagnostics requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
