package ca.gc.cra.logvault.domain.entry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {

  @Test
  void levelsAreTotallyOrdered() {
    assertTrue(LogLevel.FATAL.isAtLeast(LogLevel.ERROR));
    assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.ERROR));
    assertFalse(LogLevel.WARN.isAtLeast(LogLevel.ERROR));
    assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFO));
  }

  @Test
  void parseAcceptsAnyCaseAndWarningAlias() {
    assertEquals(LogLevel.DEBUG, LogLevel.parse("DEBUG"));
    assertEquals(LogLevel.WARN, LogLevel.parse(" warning "));
    assertEquals(LogLevel.FATAL, LogLevel.parse("Fatal"));
  }

  @Test
  void parseRejectsUnknownLevel() {
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("trace"));
    assertThrows(IllegalArgumentException.class, () -> LogLevel.parse(" "));
  }

  @Test
  void labelIsLowercase() {
    assertEquals("error", LogLevel.ERROR.label());
  }
}
