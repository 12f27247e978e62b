package ca.gc.cra.logvault.config;

/**
 * Raised when a logging option is missing, malformed or out of range.
 *
 * @since 0.1.0
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String option;

  /**
   * Creates an exception naming the offending option.
   *
   * @param option dotted option key such as {@code async.buffer_size}
   * @param problem description of the violation
   */
  public ConfigurationException(String option, String problem) {
    super("Invalid logging option '" + option + "': " + problem);
    this.option = option;
  }

  /**
   * Creates an exception naming the offending option with an underlying cause.
   *
   * @param option dotted option key
   * @param problem description of the violation
   * @param cause parse or validation failure
   */
  public ConfigurationException(String option, String problem, Throwable cause) {
    super("Invalid logging option '" + option + "': " + problem, cause);
    this.option = option;
  }

  /**
   * Returns the option key that failed validation.
   *
   * @return dotted option key
   */
  public String option() {
    return option;
  }
}
