package ca.gc.cra.logvault.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logvault.testutil.LogCapture;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("payload", Logs.truncate("payload", 16));
    assertEquals("<null>", Logs.truncate(null, 16));
  }

  @Test
  void longValuesAreCutOnCharacterBoundary() {
    String truncated = Logs.truncate("héllo wörld", 2);
    assertTrue(truncated.startsWith("h... (truncated, 2 of 13 bytes)"), truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void fallbackLogIsRateLimited() {
    FallbackLog fallback = new FallbackLog();
    try (LogCapture capture = LogCapture.attach(FallbackLog.LOGGER_NAME)) {
      for (int i = 0; i < FallbackLog.LOG_EVERY + 1; i++) {
        fallback.error("write failed {}", i);
      }
      assertEquals(2, capture.events().size());
      assertEquals("write failed 0", capture.messages().get(0));
    }
    assertEquals(FallbackLog.LOG_EVERY + 1, fallback.occurrences());
  }
}
