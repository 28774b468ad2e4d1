package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.validation.ConfigurationException;
import ca.gc.cra.brownian.validation.Numbers;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Configuration of the {@code plot} pipeline.
 *
 * @param input CSV file written by a previous {@code simulate} run
 * @param output SVG file to create
 * @param nPaths number of paths to draw; fewer are drawn when the input holds fewer
 * @param domain domain outline to draw; should match the one the input was simulated in
 * @param seed optional seed for the random path selection
 * @param allowOverwrite whether an existing {@code output} may be replaced
 * @since 0.1.0
 * @see ca.gc.cra.brownian.application.pipeline.PlotUseCase
 */
public record PlotConfig(
    Path input,
    Path output,
    int nPaths,
    Domain domain,
    OptionalLong seed,
    boolean allowOverwrite) {

  /** Upper bound on the number of paths drawn in one figure. */
  public static final int MAX_PATHS = 1000;

  static final int DEFAULT_PATHS = 5;
  static final String DEFAULT_INPUT = SimulationConfig.DEFAULT_OUTPUT;
  static final String DEFAULT_OUTPUT = "brownian_paths.svg";

  public PlotConfig {
    input = ConfigValues.normalizePath("in", input);
    output = ConfigValues.normalizePath("out", output);
    Objects.requireNonNull(domain, "domain");
    seed = Objects.requireNonNullElse(seed, OptionalLong.empty());
    Numbers.requireRange("nPaths", nPaths, 1, MAX_PATHS);
    if (input.equals(output)) {
      throw new ConfigurationException("out must differ from in (both were " + input + ")");
    }
  }

  /**
   * Returns the configuration used when no option is supplied.
   *
   * @return default plot configuration
   */
  public static PlotConfig defaults() {
    return new PlotConfig(
        Path.of(DEFAULT_INPUT),
        Path.of(DEFAULT_OUTPUT),
        DEFAULT_PATHS,
        Domain.unitSquare(),
        OptionalLong.empty(),
        false);
  }

  /**
   * Builds a configuration from flattened key/value options.
   *
   * @param options keys such as {@code in}, {@code out}, {@code nPaths}
   * @return validated configuration
   * @throws ConfigurationException when a value is malformed or out of range
   */
  public static PlotConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PlotConfig defaults = defaults();
    String inRaw = ConfigValues.firstNonBlank(options, "in", "input");
    String outRaw = ConfigValues.firstNonBlank(options, "out", "output");
    long nPaths = ConfigValues.longValue(options, "nPaths", defaults.nPaths());
    Numbers.requireRange("nPaths", nPaths, 1, MAX_PATHS);
    return new PlotConfig(
        inRaw == null ? defaults.input() : ConfigValues.parsePath("in", inRaw),
        outRaw == null ? defaults.output() : ConfigValues.parsePath("out", outRaw),
        (int) nPaths,
        ConfigValues.domain(options, defaults.domain()),
        ConfigValues.seed(options),
        ConfigValues.booleanValue(options, "allowOverwrite", false));
  }
}
