package ca.gc.cra.logpipe.config;

import ca.gc.cra.logpipe.config.PipelineConfig.CallerStrategy;
import ca.gc.cra.logpipe.domain.log.LogLevel;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link PipelineConfig} from a YAML document.
 *
 * <p>Recognised sections are {@code thresholds}, {@code bridge} and {@code metrics}; missing sections and keys
 * keep the values of {@link PipelineConfig#defaults()}. Namespace keys under {@code thresholds.namespaces} are
 * taken verbatim, dots included. Level names are case-insensitive.</p>
 *
 * @since 0.1.0
 */
public final class PipelineConfigLoader {

  private PipelineConfigLoader() {}

  /**
   * Loads configuration from {@code path}.
   *
   * @param path location of the YAML configuration
   * @return parsed configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid; unknown level names raise
   *     {@link ca.gc.cra.logpipe.domain.log.InvalidLogLevelException}
   */
  public static Optional<PipelineConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(PipelineConfig.defaults());
      }
      return Optional.of(parse(asMap(document, "root")));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  static PipelineConfig parse(Map<String, Object> root) {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, Object> thresholds = section(root, "thresholds");
    Map<String, Object> bridge = section(root, "bridge");
    Map<String, Object> metrics = section(root, "metrics");

    LogLevel defaultThreshold = level(thresholds, "default", defaults.defaultThreshold());
    LogLevel rootThreshold = level(thresholds, "root", null);
    Map<String, LogLevel> namespaces = new LinkedHashMap<>();
    Object namespaceSection = thresholds.get("namespaces");
    if (namespaceSection != null) {
      for (Map.Entry<String, Object> entry : asMap(namespaceSection, "thresholds.namespaces").entrySet()) {
        if (entry.getValue() == null) {
          throw new IllegalArgumentException("thresholds.namespaces." + entry.getKey() + " has no level");
        }
        namespaces.put(entry.getKey(), LogLevel.levelWithName(entry.getValue().toString()));
      }
    }

    return new PipelineConfig(
        defaultThreshold,
        rootThreshold,
        namespaces,
        string(bridge, "logger", defaults.loggerName()),
        CallerStrategy.from(string(bridge, "caller", null)),
        integer(bridge, "stackDepth", defaults.stackDepth()),
        string(bridge, "sinkLevel", defaults.sinkLevel()),
        string(metrics, "exporter", defaults.metricsExporter()),
        string(metrics, "endpoint", defaults.metricsEndpoint()),
        string(metrics, "prefix", defaults.metricPrefix()));
  }

  private static Map<String, Object> section(Map<String, Object> root, String key) {
    Object value = root.get(key);
    return value == null ? Map.of() : asMap(value, key);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static LogLevel level(Map<String, Object> section, String key, LogLevel fallback) {
    Object value = section.get(key);
    return value == null ? fallback : LogLevel.levelWithName(value.toString());
  }

  private static String string(Map<String, Object> section, String key, String fallback) {
    Object value = section.get(key);
    if (value == null || value.toString().isBlank()) {
      return fallback;
    }
    return value.toString().trim();
  }

  private static int integer(Map<String, Object> section, String key, int fallback) {
    Object value = section.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Integer number) {
      return number;
    }
    if (value instanceof Number) {
      throw new IllegalArgumentException(key + " must be an integer, got " + value);
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer, got " + value, ex);
    }
  }
}
