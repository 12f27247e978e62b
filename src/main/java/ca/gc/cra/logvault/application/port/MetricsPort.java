package ca.gc.cra.logvault.application.port;

/**
 * <strong>What:</strong> Port for exporting LOGVAULT counters and observations to an external metrics backend.
 * <p><strong>Why:</strong> Lets the in-process collector mirror its counters without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code OpenTelemetryMetricsAdapter} and {@link #NO_OP}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from producer threads, the
 * async consumer and the compression sweep.</p>
 * <p><strong>Performance:</strong> Calls sit on the emit path; they must be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code logvault.buffer.overflow}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier such as {@code logvault.entries.accepted}; must not be {@code null}
   *
   * <p><strong>Concurrency:</strong> Safe to call from any thread.</p>
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes, depth); semantics defined by the caller
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent invocation.</p>
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   * <p><strong>Performance:</strong> Constant time no-op.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
