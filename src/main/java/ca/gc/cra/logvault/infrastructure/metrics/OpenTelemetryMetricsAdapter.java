package ca.gc.cra.logvault.infrastructure.metrics;

import ca.gc.cra.logvault.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} that forwards collector counters and observations to OpenTelemetry instruments.
 *
 * <p>Each dotted key becomes one instrument, created on first use and cached. The original key travels as the
 * {@code logvault.metric.key} attribute when the instrument name had to be sanitized.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("logvault.metric.key");
  private static final String FALLBACK_METRIC_NAME = "logvault.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter.
   *
   * @param serviceName service name attached to exported metrics
   * @param serviceVersion service version attached to exported metrics
   * @param environment deployment environment attached to exported metrics
   * @return adapter; degrades to a no-op meter when the exporter cannot start
   */
  public static OpenTelemetryMetricsAdapter fromEnvironment(
      String serviceName, String serviceVersion, String environment) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(
        new OpenTelemetryBootstrap.ServiceIdentity(serviceName, serviceVersion, environment)));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    CounterInstrument instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    HistogramInstrument instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Pushes pending data points to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("LOGVAULT counter " + key)
        .build();
    return new CounterInstrument(counter, attributesFor(key, name));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("LOGVAULT observation " + key)
        .build();
    return new HistogramInstrument(histogram, attributesFor(key, name));
  }

  private static Attributes attributesFor(String key, String name) {
    if (name.equals(key)) {
      return Attributes.empty();
    }
    log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
