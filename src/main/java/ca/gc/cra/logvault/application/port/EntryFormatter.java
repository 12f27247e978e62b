package ca.gc.cra.logvault.application.port;

import ca.gc.cra.logvault.domain.entry.LogEntry;

/**
 * Renders an entry as one newline-terminated UTF-8 line.
 *
 * <p>Implementations are stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface EntryFormatter {
  /**
   * Formats the entry.
   *
   * @param entry entry to render; must not be {@code null}
   * @return UTF-8 bytes ending with {@code '\n'}
   */
  byte[] format(LogEntry entry);
}
