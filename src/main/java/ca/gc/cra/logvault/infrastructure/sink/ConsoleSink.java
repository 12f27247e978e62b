package ca.gc.cra.logvault.infrastructure.sink;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes formatted lines to a console stream, normally {@link System#out}.
 *
 * <p>The stream is shared with the rest of the process, so it is flushed but never closed.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleSink {
  private final PrintStream stream;

  /**
   * Creates a console sink.
   *
   * @param stream target stream; not closed by this sink
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "The console stream is process-wide and intentionally shared, never copied.")
  public ConsoleSink(PrintStream stream) {
    this.stream = Objects.requireNonNull(stream, "stream");
  }

  /**
   * Writes one formatted line.
   *
   * @param line UTF-8 bytes including the trailing newline
   * @return {@code false} when the stream reported an error
   */
  public boolean write(byte[] line) {
    synchronized (stream) {
      stream.write(line, 0, line.length);
    }
    return !stream.checkError();
  }

  public void flush() {
    stream.flush();
  }
}
