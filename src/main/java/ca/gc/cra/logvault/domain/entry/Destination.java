package ca.gc.cra.logvault.domain.entry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Named log stream backed by its own rotating file set under the configured base path.
 *
 * <p>Layout: {@code base/app/<name>.log}, {@code base/access/access.log}, {@code base/error/error.log}
 * and {@code base/metrics/metrics.log}.</p>
 *
 * @since 0.1.0
 */
public enum Destination {
  APPLICATION("app", null),
  ACCESS("access", "access"),
  ERROR("error", "error"),
  METRICS("metrics", "metrics");

  private final String directory;
  private final String fixedName;

  Destination(String directory, String fixedName) {
    this.directory = directory;
    this.fixedName = fixedName;
  }

  /**
   * Returns the directory name below the base path.
   *
   * @return directory segment such as {@code error}
   */
  public String directory() {
    return directory;
  }

  /**
   * Returns the stem of the current file name, without the {@code .log} suffix.
   *
   * @param applicationName configured name for the application destination
   * @return file stem
   */
  public String fileStem(String applicationName) {
    return fixedName != null ? fixedName : Objects.requireNonNull(applicationName, "applicationName");
  }

  /**
   * Resolves the current file for this destination.
   *
   * @param basePath configured root directory
   * @param applicationName configured name for the application destination
   * @return path of the active (unrotated) file
   */
  public Path currentFile(Path basePath, String applicationName) {
    Objects.requireNonNull(basePath, "basePath");
    return basePath.resolve(directory).resolve(fileStem(applicationName) + ".log");
  }
}
