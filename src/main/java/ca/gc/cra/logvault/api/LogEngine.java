package ca.gc.cra.logvault.api;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.metrics.MetricsSnapshot;
import ca.gc.cra.logvault.application.pipeline.AsyncLogWriter;
import ca.gc.cra.logvault.application.port.ClockPort;
import ca.gc.cra.logvault.application.port.EntryFormatter;
import ca.gc.cra.logvault.application.port.MetricsPort;
import ca.gc.cra.logvault.application.routing.DestinationRouter;
import ca.gc.cra.logvault.config.ConfigurationException;
import ca.gc.cra.logvault.config.LogConfig;
import ca.gc.cra.logvault.config.OutputFormat;
import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.EntryKind;
import ca.gc.cra.logvault.domain.entry.FieldValue;
import ca.gc.cra.logvault.domain.entry.Fields;
import ca.gc.cra.logvault.domain.entry.LogEntry;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import ca.gc.cra.logvault.infrastructure.compression.CompressionManager;
import ca.gc.cra.logvault.infrastructure.compression.SweepReport;
import ca.gc.cra.logvault.infrastructure.format.JsonEntryFormatter;
import ca.gc.cra.logvault.infrastructure.format.TextEntryFormatter;
import ca.gc.cra.logvault.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.logvault.infrastructure.rotation.RotationManager;
import ca.gc.cra.logvault.infrastructure.rotation.RotationPolicy;
import ca.gc.cra.logvault.infrastructure.rotation.RotationStats;
import ca.gc.cra.logvault.infrastructure.sink.ConsoleSink;
import ca.gc.cra.logvault.infrastructure.sink.DestinationSink;
import ca.gc.cra.logvault.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.logvault.logging.FallbackLog;
import ca.gc.cra.logvault.logging.LoggingConfigurator;
import ca.gc.cra.logvault.logging.Logs;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns one logging pipeline: router, formatter, rotating files, async writer, compression
 * sweep and metrics.
 * <p><strong>Why:</strong> Every logger is an explicitly constructed object; there is no process-wide registry.
 * Views derived from an engine share its writers.</p>
 * <p><strong>Role:</strong> Composition root and root {@link StructuredLogger}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate configuration before any file is opened.</li>
 *   <li>Build entries (base fields, bound fields, call-site fields, tag, component, caller) and hand them to the
 *   async writer.</li>
 *   <li>Shut down in order: drain the buffer, stop compression, close files, close the metrics exporter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Engine diagnostics go to SLF4J; degradations are counted in
 * {@link #metricsSnapshot()}.</p>
 *
 * @since 0.1.0
 */
public final class LogEngine implements StructuredLogger {
  private static final Logger log = LoggerFactory.getLogger(LogEngine.class);
  private static final int EXCERPT_BYTES = 256;
  private static final Duration SYNC_CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private final LogConfig config;
  private final ClockPort clock;
  private final LogMetricsCollector metrics;
  private final FallbackLog fallback;
  private final RotationManager rotation;
  private final DestinationSink sink;
  private final AsyncLogWriter writer;
  private final CompressionManager compression;
  private final OpenTelemetryMetricsAdapter exporter;
  private final Duration closeTimeout;
  private final Map<String, FieldValue> baseFields;
  private final BoundLogger root;
  private final AtomicBoolean closed = new AtomicBoolean();

  private LogEngine(Builder builder) {
    this.config = builder.config;
    this.clock = builder.clock;
    this.fallback = new FallbackLog();

    MetricsPort port = builder.metricsPort;
    OpenTelemetryMetricsAdapter otel = null;
    if (port == null && config.metrics().export()) {
      otel = OpenTelemetryMetricsAdapter.fromEnvironment(
          config.service().name(), config.service().version(), config.service().environment());
      port = otel;
    }
    this.exporter = otel;
    this.metrics = new LogMetricsCollector(
        config.metrics().enabled(), port == null ? MetricsPort.NO_OP : port, clock);

    LogConfig.FileSettings file = config.file();
    if (file.enabled()) {
      LogConfig.RotationSettings thresholds = config.rotation();
      this.rotation = new RotationManager(
          file.basePath(),
          file.name(),
          new RotationPolicy(thresholds.maxBytes(), thresholds.maxAge(), thresholds.maxBackups()),
          config.separation().destinations(),
          clock,
          metrics);
      metrics.bindFileSizes(rotation::currentSizes);
    } else {
      this.rotation = null;
    }

    EntryFormatter formatter =
        config.format() == OutputFormat.TEXT ? new TextEntryFormatter() : new JsonEntryFormatter();
    ConsoleSink console = config.consoleEnabled() ? new ConsoleSink(builder.consoleStream) : null;
    this.sink = new DestinationSink(
        new DestinationRouter(config.separation().destinations()), formatter, rotation, console, metrics, fallback);

    LogConfig.AsyncSettings async = config.async();
    this.closeTimeout = async.enabled() ? async.shutdownTimeout() : SYNC_CLOSE_TIMEOUT;
    this.writer = async.enabled()
        ? new AsyncLogWriter(
            sink,
            new AsyncLogWriter.Settings(async.bufferSize(), async.flushInterval(), async.shutdownTimeout()),
            metrics,
            fallback)
        : AsyncLogWriter.synchronous(sink, metrics, fallback);

    if (rotation != null && config.rotation().compress()) {
      this.compression = new CompressionManager(
          rotation,
          config.rotation().compressAfter(),
          config.rotation().compressInterval(),
          closeTimeout,
          clock,
          metrics,
          fallback);
    } else {
      this.compression = null;
    }

    this.baseFields = baseFields(config.service());
    this.root = new BoundLogger(this, Fields.empty(), null, null);
  }

  /**
   * Validates {@code config} and starts an engine with the system clock.
   *
   * @param config engine configuration
   * @return running engine
   * @throws ConfigurationException when the configuration cannot be used; no file has been opened
   */
  public static LogEngine create(LogConfig config) {
    return builder(config).build();
  }

  /**
   * Starts an engine builder for callers that inject a clock, a metrics port or a console stream.
   *
   * @param config engine configuration
   * @return builder
   */
  public static Builder builder(LogConfig config) {
    return new Builder(config);
  }

  public LogConfig config() {
    return config;
  }

  /** Dispatches an emit from any view. */
  void dispatch(BoundLogger view, LogLevel level, String message, Map<String, ?> callFields) {
    if (closed.get()) {
      metrics.recordRejected();
      return;
    }
    if (level == null || !level.isAtLeast(config.level())) {
      return;
    }
    try {
      LogEntry entry = buildEntry(view, level, message, callFields);
      AsyncLogWriter.Outcome outcome = writer.write(entry);
      if (outcome == AsyncLogWriter.Outcome.REJECTED) {
        metrics.recordRejected();
      } else {
        metrics.recordAccepted(entry);
      }
    } catch (RuntimeException ex) {
      metrics.recordWriteError(Destination.APPLICATION);
      fallback.error("Failed to emit '{}'", Logs.truncate(message, EXCERPT_BYTES), ex);
    }
  }

  @Override
  public void emit(LogLevel level, String message, Map<String, ?> fields) {
    root.emit(level, message, fields);
  }

  @Override
  public boolean isEnabled(LogLevel level) {
    return level != null && level.isAtLeast(config.level()) && !closed.get();
  }

  @Override
  public StructuredLogger withFields(Map<String, ?> fields) {
    return root.withFields(fields);
  }

  @Override
  public StructuredLogger withComponent(String component) {
    return root.withComponent(component);
  }

  @Override
  public StructuredLogger asAccess() {
    return root.asAccess();
  }

  @Override
  public StructuredLogger asMetrics() {
    return root.asMetrics();
  }

  @Override
  public void flush() throws IOException {
    if (closed.get()) {
      return;
    }
    if (!writer.flush()) {
      log.debug("Flush returned before the async consumer caught up");
    }
    sink.flush();
  }

  /**
   * Signals the async consumer and the compression sweep together, then waits for both against one deadline
   * of {@code async.shutdown_timeout} before closing the files. Repeated calls do nothing.
   *
   * @throws IOException if a destination file cannot be closed
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    long deadline = System.nanoTime() + closeTimeout.toNanos();
    if (compression != null) {
      compression.requestStop();
    }
    int dropped = writer.shutdown();
    if (compression != null) {
      compression.awaitStop(Duration.ofNanos(deadline - System.nanoTime()));
    }
    try {
      sink.close();
    } finally {
      if (exporter != null) {
        exporter.close();
      }
      log.info("LOGVAULT stopped (dropped={})", dropped);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public MetricsSnapshot metricsSnapshot() {
    return metrics.snapshot();
  }

  /** Zeroes every counter and restarts the collection window. */
  public void resetMetrics() {
    metrics.reset();
  }

  /**
   * Rotates every destination that has content.
   *
   * @return number of destinations rotated
   * @throws IOException if a rotation fails
   */
  public int rotate() throws IOException {
    return rotation == null ? 0 : rotation.rotateAll();
  }

  /**
   * Rotates one destination.
   *
   * @param destination destination to rotate
   * @return {@code true} when the current file was rotated
   * @throws IOException if the rotation fails
   * @throws IllegalArgumentException if the destination is not enabled
   */
  public boolean rotate(Destination destination) throws IOException {
    if (rotation == null) {
      return false;
    }
    return rotation.rotate(destination);
  }

  /**
   * Describes each enabled destination's file set.
   *
   * @return statistics keyed by destination; empty when file output is disabled
   * @throws IOException if a destination directory cannot be listed
   */
  public Map<Destination, RotationStats> rotationStats() throws IOException {
    return rotation == null ? Map.of() : rotation.stats();
  }

  /**
   * Returns the current file of a destination.
   *
   * @param destination destination to resolve
   * @return current file, or empty when file output is disabled
   */
  public Optional<Path> currentFile(Destination destination) {
    if (rotation == null) {
      return Optional.empty();
    }
    return Optional.of(destination.currentFile(rotation.basePath(), config.file().name()));
  }

  /** Runs one compression sweep on the calling thread. */
  Optional<SweepReport> compressNow() {
    return compression == null ? Optional.empty() : Optional.of(compression.sweep());
  }

  private void start() {
    if (config.verboseDiagnostics()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (config.async().enabled()) {
      writer.start();
    }
    if (compression != null) {
      compression.start();
    }
    log.info(
        "LOGVAULT started (level={}, format={}, async={}, destinations={})",
        config.level().label(),
        config.format(),
        config.async().enabled(),
        rotation == null ? "console" : rotation.destinations());
  }

  private LogEntry buildEntry(BoundLogger view, LogLevel level, String message, Map<String, ?> callFields) {
    Map<String, FieldValue> fields =
        Fields.merge(Fields.merge(baseFields, view.fields()), Fields.of(callFields));
    EntryKind kind = view.kind() != null
        ? view.kind()
        : EntryKind.fromTag(Fields.text(fields, EntryKind.TAG_FIELD)).orElse(EntryKind.STANDARD);
    String component = Fields.text(fields, "component");
    if (component == null) {
      component = view.component();
    }
    String caller = config.metrics().includeCaller() ? CallerLocator.locate() : null;
    return new LogEntry(Instant.ofEpochMilli(clock.nowMillis()), level, message, fields, component, kind, caller);
  }

  private static Map<String, FieldValue> baseFields(LogConfig.ServiceInfo service) {
    Map<String, Object> base = new LinkedHashMap<>();
    base.put("service", service.name());
    base.put("version", service.version());
    base.put("environment", service.environment());
    base.put("hostname", hostname());
    base.put("pid", ProcessHandle.current().pid());
    return Fields.of(base);
  }

  private static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name", ex);
      return "unknown";
    }
  }

  private static void requireUsableBasePath(LogConfig config) {
    if (!config.file().enabled()) {
      return;
    }
    Path base = config.file().basePath();
    if (Files.exists(base) && !Files.isDirectory(base)) {
      throw new ConfigurationException("file.base_path", base + " exists and is not a directory");
    }
  }

  /** Builder for engines with injected collaborators. */
  public static final class Builder {
    private final LogConfig config;
    private ClockPort clock = new SystemClockAdapter();
    private MetricsPort metricsPort;
    private PrintStream consoleStream = System.out;

    private Builder(LogConfig config) {
      this.config = Objects.requireNonNull(config, "config");
    }

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Mirrors counters into {@code port} instead of the exporter selected by {@code metrics.export}.
     *
     * @param port metrics port
     * @return this builder
     */
    public Builder metricsPort(MetricsPort port) {
      this.metricsPort = Objects.requireNonNull(port, "port");
      return this;
    }

    public Builder consoleStream(PrintStream stream) {
      this.consoleStream = Objects.requireNonNull(stream, "stream");
      return this;
    }

    /**
     * Validates and starts the engine.
     *
     * @return running engine
     * @throws ConfigurationException when the configuration cannot be used
     */
    public LogEngine build() {
      requireUsableBasePath(config);
      LogEngine engine = new LogEngine(this);
      engine.start();
      return engine;
    }
  }
}
