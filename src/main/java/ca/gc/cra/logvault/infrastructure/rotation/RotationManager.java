package ca.gc.cra.logvault.infrastructure.rotation;

import ca.gc.cra.logvault.application.metrics.LogMetricsCollector;
import ca.gc.cra.logvault.application.port.ClockPort;
import ca.gc.cra.logvault.domain.entry.Destination;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns one {@link RotatingFileWriter} per destination under a common base path.
 * <p><strong>Why:</strong> File handles have exactly one owner; the sink, the compression sweep and
 * administrative rotation all go through the writer returned here.</p>
 * <p><strong>Thread-safety:</strong> Writers are created lazily and at most once per destination; each writer
 * serializes its own operations.</p>
 * <p><strong>Observability:</strong> Rotations are counted through {@link LogMetricsCollector#recordRotation}.</p>
 *
 * @since 0.1.0
 */
public final class RotationManager implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(RotationManager.class);

  private final Path basePath;
  private final String applicationName;
  private final RotationPolicy policy;
  private final ClockPort clock;
  private final LogMetricsCollector metrics;
  private final Set<Destination> destinations;
  private final ConcurrentMap<Destination, RotatingFileWriter> writers = new ConcurrentHashMap<>();

  /**
   * Creates a manager. No directory or file is touched until the first write.
   *
   * @param basePath root directory for all destinations
   * @param applicationName file stem of the application destination
   * @param policy rotation thresholds
   * @param destinations destinations this manager serves
   * @param clock time source for age checks
   * @param metrics collector receiving rotation counts
   */
  public RotationManager(
      Path basePath,
      String applicationName,
      RotationPolicy policy,
      Set<Destination> destinations,
      ClockPort clock,
      LogMetricsCollector metrics) {
    this.basePath = Objects.requireNonNull(basePath, "basePath");
    this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.destinations = destinations.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(destinations));
  }

  public Path basePath() {
    return basePath;
  }

  public Set<Destination> destinations() {
    return destinations;
  }

  /**
   * Returns the writer for a destination, creating it on first use.
   *
   * @param destination destination served by this manager
   * @return writer owning the destination's files
   * @throws IllegalArgumentException if the destination is not served by this manager
   */
  public RotatingFileWriter writer(Destination destination) {
    Objects.requireNonNull(destination, "destination");
    if (!destinations.contains(destination)) {
      throw new IllegalArgumentException("Destination " + destination + " is not enabled");
    }
    return writers.computeIfAbsent(
        destination,
        d -> new RotatingFileWriter(d, d.currentFile(basePath, applicationName), policy, clock, metrics));
  }

  /**
   * Returns writers for every served destination.
   *
   * @return writers in destination order
   */
  public List<RotatingFileWriter> allWriters() {
    List<RotatingFileWriter> result = new ArrayList<>(destinations.size());
    for (Destination destination : destinations) {
      result.add(writer(destination));
    }
    return result;
  }

  /**
   * Rotates one destination out of band.
   *
   * @param destination destination to rotate
   * @return {@code true} when the current file was rotated
   * @throws IOException if the rotation fails
   */
  public boolean rotate(Destination destination) throws IOException {
    return writer(destination).rotate();
  }

  /**
   * Rotates every served destination that has content; failures do not stop the remaining destinations.
   *
   * @return number of destinations rotated
   * @throws IOException the first failure, with later ones suppressed
   */
  public int rotateAll() throws IOException {
    int rotated = 0;
    IOException failure = null;
    for (RotatingFileWriter writer : allWriters()) {
      try {
        if (writer.rotate()) {
          rotated++;
        }
      } catch (IOException ex) {
        failure = accumulate(failure, ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
    return rotated;
  }

  /**
   * Describes every served destination.
   *
   * @return statistics keyed by destination
   * @throws IOException the first destination whose directory cannot be listed, with later ones suppressed
   */
  public Map<Destination, RotationStats> stats() throws IOException {
    Map<Destination, RotationStats> result = new EnumMap<>(Destination.class);
    IOException failure = null;
    for (RotatingFileWriter writer : allWriters()) {
      try {
        result.put(writer.destination(), writer.stats());
      } catch (IOException ex) {
        failure = accumulate(failure, ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
    return result;
  }

  /**
   * Returns the current size of each opened destination file.
   *
   * @return sizes keyed by destination
   */
  public Map<Destination, Long> currentSizes() {
    Map<Destination, Long> sizes = new EnumMap<>(Destination.class);
    writers.forEach((destination, writer) -> sizes.put(destination, writer.currentSize()));
    return sizes;
  }

  /**
   * Flushes every opened writer.
   *
   * @throws IOException the first failure, with later ones suppressed
   */
  public void flush() throws IOException {
    IOException failure = null;
    for (RotatingFileWriter writer : writers.values()) {
      try {
        writer.flush();
      } catch (IOException ex) {
        metrics.recordWriteError(writer.destination());
        failure = accumulate(failure, ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (RotatingFileWriter writer : writers.values()) {
      try {
        writer.close();
      } catch (IOException ex) {
        log.warn("Failed to close {}", writer.path(), ex);
        failure = accumulate(failure, ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static IOException accumulate(IOException first, IOException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
