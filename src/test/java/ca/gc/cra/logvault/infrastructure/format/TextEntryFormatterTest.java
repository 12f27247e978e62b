package ca.gc.cra.logvault.infrastructure.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextEntryFormatterTest {
  private static final Instant TS = Instant.parse("2024-03-01T12:34:56.789Z");

  private final TextEntryFormatter formatter = new TextEntryFormatter();

  @Test
  void rendersKeyValuePairsQuotingWhereNeeded() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("user_id", 123);
    fields.put("path", "/api/users");
    fields.put("error", new IOException("disk full"));
    LogEntry entry = LogEntry.of(TS, LogLevel.ERROR, "Upload failed\nretrying", Fields.of(fields));

    String line = new String(formatter.format(entry), StandardCharsets.UTF_8);

    assertEquals(
        "timestamp=2024-03-01T12:34:56.789Z level=error message=\"Upload failed\\nretrying\" user_id=123"
            + " path=/api/users error=\"java.io.IOException: disk full\"\n",
        line);
  }

  @Test
  void emptyValuesAreQuoted() {
    LogEntry entry = LogEntry.of(TS, LogLevel.INFO, "", Fields.of(Map.of("query", "")));

    String line = new String(formatter.format(entry), StandardCharsets.UTF_8);

    assertEquals("timestamp=2024-03-01T12:34:56.789Z level=info message=\"\" query=\"\"\n", line);
  }
}
