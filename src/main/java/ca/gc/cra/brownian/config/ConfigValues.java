package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.validation.ConfigurationException;
import ca.gc.cra.brownian.validation.Numbers;
import ca.gc.cra.brownian.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Typed lookups over flattened configuration maps shared by the mode configuration records.
 */
final class ConfigValues {
  private ConfigValues() {}

  static Domain domain(Map<String, String> options, Domain fallback) {
    return new Domain(
        doubleValue(options, "domainXMin", fallback.xMin()),
        doubleValue(options, "domainXMax", fallback.xMax()),
        doubleValue(options, "domainYMin", fallback.yMin()),
        doubleValue(options, "domainYMax", fallback.yMax()));
  }

  static double doubleValue(Map<String, String> options, String key, double fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseDouble(key, raw);
  }

  static long longValue(Map<String, String> options, String key, long fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseLong(key, raw);
  }

  static OptionalLong seed(Map<String, String> options) {
    String raw = options.get("seed");
    if (raw == null || raw.isBlank()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(Numbers.parseLong("seed", raw));
  }

  static boolean booleanValue(Map<String, String> options, String key, boolean fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new ConfigurationException(key + " must be true or false (was '" + raw.trim() + "')");
    };
  }

  static String firstNonBlank(Map<String, String> options, String... keys) {
    for (String key : keys) {
      String value = options.get(key);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  static Path parsePath(String name, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(name, raw)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new ConfigurationException(name + " is not a valid path: " + raw, ex);
    }
  }

  static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new ConfigurationException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
