package ca.gc.cra.brownian.api;

import ca.gc.cra.brownian.config.ConfigMerger;
import ca.gc.cra.brownian.config.DefaultsForMode;
import ca.gc.cra.brownian.config.YamlConfigLoader;
import ca.gc.cra.brownian.validation.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML and default configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value != null && !value.isBlank()) {
      return value.trim();
    }
    return null;
  }

  /**
   * Resolves the effective configuration for {@code mode}: embedded defaults, then the optional YAML file named by
   * {@code config=PATH}, then the remaining CLI arguments.
   *
   * @throws ConfigurationException when the YAML file is missing or malformed, or the merged values are invalid
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs, Logger log)
      throws IOException {
    String configPath = extractConfigPath(cliArgs);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new ConfigurationException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, cliArgs, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      default -> false;
    };
  }
}
