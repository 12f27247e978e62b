package ca.gc.cra.logvault.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parsesSuffixedValues() {
    assertEquals(Duration.ofMillis(500), Durations.parse("x", "500ms"));
    assertEquals(Duration.ofSeconds(5), Durations.parse("x", "5s"));
    assertEquals(Duration.ofMinutes(10), Durations.parse("x", "10m"));
    assertEquals(Duration.ofMinutes(90), Durations.parse("x", "1.5h"));
    assertEquals(Duration.ofDays(2), Durations.parse("x", "2d"));
  }

  @Test
  void bareNumbersAreSeconds() {
    assertEquals(Duration.ofSeconds(30), Durations.parse("x", "30"));
  }

  @Test
  void acceptsIsoDurations() {
    assertEquals(Duration.ofSeconds(5), Durations.parse("x", "PT5S"));
    assertEquals(Duration.ofHours(1), Durations.parse("x", "pt1h"));
  }

  @Test
  void fractionalDays() {
    assertEquals(Duration.ofHours(12), Durations.ofDays(0.5d));
  }

  @Test
  void malformedValuesReportTheOption() {
    ConfigurationException ex =
        assertThrows(ConfigurationException.class, () -> Durations.parse("async.flush_interval", "soon"));
    assertEquals("async.flush_interval", ex.option());
    assertThrows(ConfigurationException.class, () -> Durations.parse("x", "PTxS"));
    assertThrows(ConfigurationException.class, () -> Durations.parse("x", " "));
  }
}
