package ca.gc.cra.logvault.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads logging configuration from a YAML document and flattens one section into dotted keys.
 *
 * <p>A root-level {@code common} section is applied first; the requested section overrides it:</p>
 * <pre>{@code
 * common:
 *   service: {name: billing}
 * logging:
 *   level: debug
 *   rotation: {max_size_mb: 50, max_backups: 7}
 * }</pre>
 */
public final class LogConfigLoader {
  /** Section read when none is named. */
  public static final String DEFAULT_SECTION = "logging";

  private LogConfigLoader() {}

  /**
   * Loads the {@value #DEFAULT_SECTION} section.
   *
   * @param path location of the YAML configuration
   * @return configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the YAML structure or a value is invalid
   */
  public static Optional<LogConfig> load(Path path) throws IOException {
    return load(path, DEFAULT_SECTION);
  }

  /**
   * Loads one section.
   *
   * @param path location of the YAML configuration
   * @param section root key holding the logging options
   * @return configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the YAML structure or a value is invalid
   */
  public static Optional<LogConfig> load(Path path, String section) throws IOException {
    return flatten(path, section).map(LogConfig::fromMap);
  }

  /**
   * Reads the merged {@code common} and {@code section} keys without validating them.
   *
   * @param path location of the YAML configuration
   * @param section root key holding the logging options
   * @return flat map of dotted keys, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> flatten(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String normalized = section.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened);
      }
      Object selected = findSection(root, normalized);
      if (selected != null) {
        flatten(asMap(selected, normalized), "", flattened);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new ConfigurationException(normalized, "failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigurationException(context, "section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new ConfigurationException(context, "section contains non-string key " + entry.getKey());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new ConfigurationException(prefix.isEmpty() ? "root" : prefix, "YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new ConfigurationException(composite, "YAML arrays are not supported");
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
