package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.validation.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active pipeline mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws ConfigurationException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    dropShadowedAliases(merged, yamlCopy);
    merged.putAll(yamlCopy);
    dropShadowedAliases(merged, cliCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  // an alias (output, input) given in a higher layer beats the canonical key from lower layers
  private static void dropShadowedAliases(Map<String, String> merged, Map<String, String> layer) {
    if (layer.containsKey("output") && !layer.containsKey("out")) {
      merged.remove("out");
    }
    if (layer.containsKey("input") && !layer.containsKey("in")) {
      merged.remove("in");
    }
  }

  private static void validate(Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("none") && !exporter.equals("otlp")) {
      throw new ConfigurationException("metricsExporter must be none or otlp (was '" + exporter + "')");
    }
    String endpoint = trim(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty() && !endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
      throw new ConfigurationException("otelEndpoint must be an http(s) URL (was '" + endpoint + "')");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
