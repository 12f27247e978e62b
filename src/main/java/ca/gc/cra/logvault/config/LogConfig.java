package ca.gc.cra.logvault.config;

import ca.gc.cra.logvault.domain.entry.Destination;
import ca.gc.cra.logvault.domain.entry.LogLevel;
import ca.gc.cra.logvault.validation.Numbers;
import ca.gc.cra.logvault.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Immutable logging engine configuration.
 *
 * <p>Built from flattened dotted keys via {@link #fromMap(Map)} (as produced by {@link LogConfigLoader}) or
 * programmatically via {@link #builder()}. Every invalid value raises a {@link ConfigurationException} naming the
 * option.</p>
 *
 * @param level minimum level accepted by emit
 * @param format line encoding for every destination
 * @param consoleEnabled also write every accepted entry to stdout
 * @param file file output settings
 * @param rotation rotation and compression thresholds
 * @param separation which destinations beyond application are enabled
 * @param async buffer settings
 * @param metrics collector settings
 * @param service identity written into every entry
 * @param verboseDiagnostics raise the engine's own SLF4J loggers to DEBUG
 * @since 0.1.0
 */
public record LogConfig(
    LogLevel level,
    OutputFormat format,
    boolean consoleEnabled,
    FileSettings file,
    RotationSettings rotation,
    SeparationSettings separation,
    AsyncSettings async,
    MetricsSettings metrics,
    ServiceInfo service,
    boolean verboseDiagnostics) {

  static final double DEFAULT_MAX_SIZE_MB = 100d;
  static final double DEFAULT_MAX_AGE_DAYS = 1d;
  static final int DEFAULT_MAX_BACKUPS = 30;
  static final double DEFAULT_COMPRESS_AFTER_DAYS = 1d;
  static final Duration DEFAULT_COMPRESS_INTERVAL = Duration.ofHours(1);
  static final int DEFAULT_BUFFER_SIZE = 1_000;
  static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
  static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
  private static final int MAX_BUFFER_SIZE = 1_000_000;
  private static final int MAX_BACKUPS_LIMIT = 10_000;
  private static final Duration MAX_ASYNC_WAIT = Duration.ofDays(1);
  private static final Duration MAX_COMPRESS_INTERVAL = Duration.ofDays(365);
  private static final long BYTES_PER_MB = 1_024L * 1_024L;

  public LogConfig {
    level = Objects.requireNonNullElse(level, LogLevel.INFO);
    format = Objects.requireNonNullElse(format, OutputFormat.JSON);
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(rotation, "rotation");
    Objects.requireNonNull(separation, "separation");
    Objects.requireNonNull(async, "async");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(service, "service");
    if (!consoleEnabled && !file.enabled()) {
      throw new ConfigurationException(
          "console.enabled", "at least one of console or file output must be enabled");
    }
  }

  /**
   * Returns the default configuration.
   *
   * @return defaults for every option
   */
  public static LogConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses flattened dotted keys; absent keys keep their defaults and unknown keys are ignored.
   *
   * @param values option map such as {@code rotation.max_size_mb=10}; may be {@code null}
   * @return validated configuration
   * @throws ConfigurationException when a value is malformed or out of range
   */
  public static LogConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : values;
    Builder builder = builder();
    ifPresent(kv, "level", raw -> builder.level(parse("level", () -> LogLevel.parse(raw))));
    ifPresent(kv, "format", raw -> builder.format(parse("format", () -> OutputFormat.parse(raw))));
    ifPresent(kv, "console.enabled", raw -> builder.consoleEnabled(bool("console.enabled", raw)));
    ifPresent(kv, "file.enabled", raw -> builder.fileEnabled(bool("file.enabled", raw)));
    ifPresent(kv, "file.base_path", raw -> builder.basePath(path("file.base_path", raw)));
    ifPresent(kv, "file.name", builder::fileName);
    ifPresent(kv, "rotation.max_size_mb", raw -> builder.maxSizeMb(number("rotation.max_size_mb", raw)));
    ifPresent(kv, "rotation.max_age_days",
        raw -> builder.maxAgeDays(number("rotation.max_age_days", raw)));
    ifPresent(kv, "rotation.max_backups",
        raw -> builder.maxBackups(integer("rotation.max_backups", raw)));
    ifPresent(kv, "rotation.compress", raw -> builder.compress(bool("rotation.compress", raw)));
    ifPresent(kv, "rotation.compress_after_days",
        raw -> builder.compressAfterDays(number("rotation.compress_after_days", raw)));
    ifPresent(kv, "rotation.compress_interval",
        raw -> builder.compressInterval(Durations.parse("rotation.compress_interval", raw)));
    ifPresent(kv, "separation.enabled", raw -> builder.separationEnabled(bool("separation.enabled", raw)));
    ifPresent(kv, "separation.access", raw -> builder.separateAccess(bool("separation.access", raw)));
    ifPresent(kv, "separation.error", raw -> builder.separateErrors(bool("separation.error", raw)));
    ifPresent(kv, "separation.metrics", raw -> builder.separateMetrics(bool("separation.metrics", raw)));
    ifPresent(kv, "async.enabled", raw -> builder.asyncEnabled(bool("async.enabled", raw)));
    ifPresent(kv, "async.buffer_size", raw -> builder.bufferSize(integer("async.buffer_size", raw)));
    ifPresent(kv, "async.flush_interval",
        raw -> builder.flushInterval(Durations.parse("async.flush_interval", raw)));
    ifPresent(kv, "async.shutdown_timeout",
        raw -> builder.shutdownTimeout(Durations.parse("async.shutdown_timeout", raw)));
    ifPresent(kv, "metrics.enabled", raw -> builder.metricsEnabled(bool("metrics.enabled", raw)));
    ifPresent(kv, "metrics.include_caller",
        raw -> builder.includeCaller(bool("metrics.include_caller", raw)));
    ifPresent(kv, "metrics.export", raw -> builder.exportMetrics(bool("metrics.export", raw)));
    ifPresent(kv, "service.name", builder::serviceName);
    ifPresent(kv, "service.version", builder::serviceVersion);
    ifPresent(kv, "service.environment", builder::environment);
    ifPresent(kv, "diagnostics.verbose", raw -> builder.verboseDiagnostics(bool("diagnostics.verbose", raw)));
    return builder.build();
  }

  /**
   * File output settings.
   *
   * @param enabled write to rotating files
   * @param basePath root directory holding one subdirectory per destination
   * @param name file stem of the application destination
   */
  public record FileSettings(boolean enabled, Path basePath, String name) {
    public FileSettings {
      String candidate = nullToEmpty(name);
      name = validated("file.name", () -> Strings.requireFileName("file.name", candidate));
      if (enabled && basePath == null) {
        throw new ConfigurationException("file.base_path", "must be set when file output is enabled");
      }
    }
  }

  /**
   * Rotation and compression thresholds.
   *
   * @param maxBytes size threshold of the current file
   * @param maxAge age threshold of the current file
   * @param maxBackups rotated files kept per destination; zero keeps none
   * @param compress archive rotated files in the background
   * @param compressAfter minimum age of a rotated file before it is archived
   * @param compressInterval delay between compression sweeps
   */
  public record RotationSettings(
      long maxBytes,
      Duration maxAge,
      int maxBackups,
      boolean compress,
      Duration compressAfter,
      Duration compressInterval) {
    public RotationSettings {
      if (maxBytes <= 0L) {
        throw new ConfigurationException("rotation.max_size_mb", "must be greater than 0");
      }
      requirePositive("rotation.max_age_days", maxAge);
      validated("rotation.max_backups",
          () -> Numbers.requireRange("rotation.max_backups", maxBackups, 0, MAX_BACKUPS_LIMIT));
      Objects.requireNonNull(compressAfter, "compressAfter");
      if (compressAfter.isNegative()) {
        throw new ConfigurationException("rotation.compress_after_days", "must not be negative");
      }
      requireBounded("rotation.compress_interval", compressInterval, MAX_COMPRESS_INTERVAL);
    }
  }

  /**
   * Destination separation switches. The application destination is always enabled.
   *
   * @param enabled master switch; when {@code false} only the application destination is written
   * @param access write access-tagged entries to their own destination
   * @param error copy ERROR and FATAL entries to the error destination
   * @param metrics write metrics-tagged entries to their own destination
   */
  public record SeparationSettings(boolean enabled, boolean access, boolean error, boolean metrics) {
    /**
     * Returns the destinations that receive a writer.
     *
     * @return application plus each separated destination
     */
    public Set<Destination> destinations() {
      Set<Destination> result = EnumSet.of(Destination.APPLICATION);
      if (enabled) {
        if (access) {
          result.add(Destination.ACCESS);
        }
        if (error) {
          result.add(Destination.ERROR);
        }
        if (metrics) {
          result.add(Destination.METRICS);
        }
      }
      return Collections.unmodifiableSet(result);
    }
  }

  /**
   * Async buffer settings; validated only when enabled.
   *
   * @param enabled buffer entries and write them on a consumer thread
   * @param bufferSize fixed queue capacity
   * @param flushInterval period of the forced flush
   * @param shutdownTimeout bound on the drain performed by close
   */
  public record AsyncSettings(boolean enabled, int bufferSize, Duration flushInterval, Duration shutdownTimeout) {
    public AsyncSettings {
      if (enabled) {
        validated("async.buffer_size",
            () -> Numbers.requireRange("async.buffer_size", bufferSize, 1, MAX_BUFFER_SIZE));
        requireBounded("async.flush_interval", flushInterval, MAX_ASYNC_WAIT);
        requireBounded("async.shutdown_timeout", shutdownTimeout, MAX_ASYNC_WAIT);
      }
    }
  }

  /**
   * Metrics collector settings.
   *
   * @param enabled maintain counters
   * @param includeCaller record the call site of each entry
   * @param export mirror counters through OpenTelemetry
   */
  public record MetricsSettings(boolean enabled, boolean includeCaller, boolean export) {}

  /**
   * Service identity written into every entry.
   *
   * @param name service name
   * @param version service version
   * @param environment deployment environment
   */
  public record ServiceInfo(String name, String version, String environment) {
    public ServiceInfo {
      name = requireText("service.name", name);
      version = requireText("service.version", version);
      environment = requireText("service.environment", environment);
    }
  }

  /** Mutable builder; every option starts at its default. */
  public static final class Builder {
    private LogLevel level = LogLevel.INFO;
    private OutputFormat format = OutputFormat.JSON;
    private boolean consoleEnabled = true;
    private boolean fileEnabled = true;
    private Path basePath = Path.of("logs");
    private String fileName = "app";
    private long maxBytes = Math.round(DEFAULT_MAX_SIZE_MB * BYTES_PER_MB);
    private Duration maxAge = Durations.ofDays(DEFAULT_MAX_AGE_DAYS);
    private int maxBackups = DEFAULT_MAX_BACKUPS;
    private boolean compress = true;
    private Duration compressAfter = Durations.ofDays(DEFAULT_COMPRESS_AFTER_DAYS);
    private Duration compressInterval = DEFAULT_COMPRESS_INTERVAL;
    private boolean separationEnabled = true;
    private boolean separateAccess = true;
    private boolean separateErrors = true;
    private boolean separateMetrics = true;
    private boolean asyncEnabled = true;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private boolean metricsEnabled = true;
    private boolean includeCaller = true;
    private boolean exportMetrics;
    private String serviceName = "logvault";
    private String serviceVersion = "dev";
    private String environment = defaultEnvironment();
    private boolean verboseDiagnostics;

    private Builder() {}

    public Builder level(LogLevel level) {
      this.level = level;
      return this;
    }

    public Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    public Builder consoleEnabled(boolean consoleEnabled) {
      this.consoleEnabled = consoleEnabled;
      return this;
    }

    public Builder fileEnabled(boolean fileEnabled) {
      this.fileEnabled = fileEnabled;
      return this;
    }

    public Builder basePath(Path basePath) {
      this.basePath = basePath;
      return this;
    }

    public Builder fileName(String fileName) {
      this.fileName = fileName;
      return this;
    }

    /**
     * Sets the size threshold in mebibytes; fractions are allowed.
     *
     * @param megabytes threshold; must be positive
     * @return this builder
     */
    public Builder maxSizeMb(double megabytes) {
      validated("rotation.max_size_mb", () -> Numbers.requirePositive("rotation.max_size_mb", megabytes));
      this.maxBytes = Math.max(1L, Math.round(megabytes * BYTES_PER_MB));
      return this;
    }

    public Builder maxSizeBytes(long maxBytes) {
      this.maxBytes = maxBytes;
      return this;
    }

    /**
     * Sets the age threshold in days; fractions are allowed.
     *
     * @param days threshold; must be positive
     * @return this builder
     */
    public Builder maxAgeDays(double days) {
      validated("rotation.max_age_days", () -> Numbers.requirePositive("rotation.max_age_days", days));
      this.maxAge = Durations.ofDays(days);
      return this;
    }

    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    public Builder maxBackups(int maxBackups) {
      this.maxBackups = maxBackups;
      return this;
    }

    public Builder compress(boolean compress) {
      this.compress = compress;
      return this;
    }

    /**
     * Sets the compression delay in days; zero archives on the next sweep.
     *
     * @param days delay; must not be negative
     * @return this builder
     */
    public Builder compressAfterDays(double days) {
      validated("rotation.compress_after_days",
          () -> Numbers.requireNonNegative("rotation.compress_after_days", days));
      this.compressAfter = Durations.ofDays(days);
      return this;
    }

    public Builder compressAfter(Duration compressAfter) {
      this.compressAfter = compressAfter;
      return this;
    }

    public Builder compressInterval(Duration compressInterval) {
      this.compressInterval = compressInterval;
      return this;
    }

    public Builder separationEnabled(boolean separationEnabled) {
      this.separationEnabled = separationEnabled;
      return this;
    }

    public Builder separateAccess(boolean separateAccess) {
      this.separateAccess = separateAccess;
      return this;
    }

    public Builder separateErrors(boolean separateErrors) {
      this.separateErrors = separateErrors;
      return this;
    }

    public Builder separateMetrics(boolean separateMetrics) {
      this.separateMetrics = separateMetrics;
      return this;
    }

    public Builder asyncEnabled(boolean asyncEnabled) {
      this.asyncEnabled = asyncEnabled;
      return this;
    }

    public Builder bufferSize(int bufferSize) {
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    public Builder metricsEnabled(boolean metricsEnabled) {
      this.metricsEnabled = metricsEnabled;
      return this;
    }

    public Builder includeCaller(boolean includeCaller) {
      this.includeCaller = includeCaller;
      return this;
    }

    public Builder exportMetrics(boolean exportMetrics) {
      this.exportMetrics = exportMetrics;
      return this;
    }

    public Builder serviceName(String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    public Builder serviceVersion(String serviceVersion) {
      this.serviceVersion = serviceVersion;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    public Builder verboseDiagnostics(boolean verboseDiagnostics) {
      this.verboseDiagnostics = verboseDiagnostics;
      return this;
    }

    /**
     * Validates and builds the configuration.
     *
     * @return immutable configuration
     * @throws ConfigurationException when an option is invalid
     */
    public LogConfig build() {
      return new LogConfig(
          level,
          format,
          consoleEnabled,
          new FileSettings(fileEnabled, basePath, fileName),
          new RotationSettings(maxBytes, maxAge, maxBackups, compress, compressAfter, compressInterval),
          new SeparationSettings(separationEnabled, separateAccess, separateErrors, separateMetrics),
          new AsyncSettings(asyncEnabled, bufferSize, flushInterval, shutdownTimeout),
          new MetricsSettings(metricsEnabled, includeCaller, exportMetrics),
          new ServiceInfo(serviceName, serviceVersion, environment),
          verboseDiagnostics);
    }
  }

  static String defaultEnvironment() {
    String env = System.getenv("ENV");
    if (env == null || env.isBlank()) {
      env = System.getenv("ENVIRONMENT");
    }
    return env == null || env.isBlank() ? "development" : env.trim();
  }

  private static void requirePositive(String option, Duration value) {
    if (value == null) {
      throw new ConfigurationException(option, "must be set");
    }
    if (value.isZero() || value.isNegative()) {
      throw new ConfigurationException(option, "must be greater than 0 (was " + value + ")");
    }
  }

  private static String requireText(String option, String value) {
    String candidate = nullToEmpty(value);
    return validated(option, () -> Strings.requireNonBlank(option, candidate));
  }

  private static void requireBounded(String option, Duration value, Duration max) {
    requirePositive(option, value);
    validated(option, () -> Numbers.requireRange(option, value.getSeconds(), 0L, max.getSeconds()));
  }

  private static <T> T validated(String option, Supplier<T> check) {
    try {
      return check.get();
    } catch (ConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new ConfigurationException(option, ex.getMessage(), ex);
    }
  }

  private static <T> T parse(String option, Supplier<T> parser) {
    return validated(option, parser);
  }

  private static void ifPresent(Map<String, String> kv, String key, Consumer<String> action) {
    String raw = kv.get(key);
    if (raw != null && !raw.isBlank()) {
      action.accept(raw.trim());
    }
  }

  private static boolean bool(String option, String raw) {
    return switch (raw.toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new ConfigurationException(option, "expected true or false (was '" + raw + "')");
    };
  }

  private static double number(String option, String raw) {
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(option, "expected a number (was '" + raw + "')", ex);
    }
  }

  private static int integer(String option, String raw) {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(option, "expected an integer (was '" + raw + "')", ex);
    }
  }

  private static Path path(String option, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new ConfigurationException(option, "invalid path '" + raw + "'", ex);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
