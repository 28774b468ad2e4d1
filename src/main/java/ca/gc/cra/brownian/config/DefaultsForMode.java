package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.validation.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code simulate} or {@code plot})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws ConfigurationException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "simulate" -> buildSimulateDefaults();
      case "plot" -> buildPlotDefaults();
      default -> throw new ConfigurationException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSimulateDefaults() {
    SimulationConfig defaults = SimulationConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    putDomain(map);
    map.put("maxExits", Long.toString(defaults.maxExits()));
    map.put("pathsPerThread", Integer.toString(defaults.pathsPerThread()));
    map.put("stepSize", Double.toString(defaults.stepSize()));
    map.put("seed", "");
    map.put("threads", Integer.toString(defaults.threads()));
    map.put("out", SimulationConfig.DEFAULT_OUTPUT);
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildPlotDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", PlotConfig.DEFAULT_INPUT);
    map.put("out", PlotConfig.DEFAULT_OUTPUT);
    map.put("nPaths", Integer.toString(PlotConfig.DEFAULT_PATHS));
    putDomain(map);
    map.put("seed", "");
    map.put("allowOverwrite", "false");
    return map;
  }

  private static void putDomain(Map<String, String> map) {
    map.put("domainXMin", "0.0");
    map.put("domainXMax", "1.0");
    map.put("domainYMin", "0.0");
    map.put("domainYMax", "1.0");
  }
}
