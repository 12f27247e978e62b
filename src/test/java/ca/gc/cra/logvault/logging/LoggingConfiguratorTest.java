package ca.gc.cra.logvault.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void verboseLoggingLowersEngineLoggerToDebug() {
    Logger engine = (Logger) LoggerFactory.getLogger(LoggingConfigurator.ENGINE_LOGGER);
    Level original = engine.getLevel();
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging());
      assertEquals(Level.DEBUG, engine.getLevel());
      assertTrue(LoggerFactory.getLogger("ca.gc.cra.logvault.infrastructure.rotation.RotatingFileWriter").isDebugEnabled());
    } finally {
      engine.setLevel(original);
    }
  }
}
