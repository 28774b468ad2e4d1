package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.application.simulation.SimulationParameters;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.validation.ConfigurationException;
import ca.gc.cra.brownian.validation.Numbers;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Configuration of the {@code simulate} pipeline.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into one validated record so the run either
 * starts fully configured or fails before any worker thread exists.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param domain rectangle the walks are confined to
 * @param maxExits number of exits after which the run stops
 * @param pathsPerThread concurrently active walks per worker
 * @param stepSize standard deviation of each Gaussian step component
 * @param seed optional global seed
 * @param threads worker count
 * @param output CSV file receiving the filtered segments
 * @param allowOverwrite whether an existing {@code output} may be replaced
 * @param dryRun when {@code true}, validate and print the plan without running
 * @since 0.1.0
 * @see ca.gc.cra.brownian.application.pipeline.SimulationUseCase
 */
public record SimulationConfig(
    Domain domain,
    long maxExits,
    int pathsPerThread,
    double stepSize,
    OptionalLong seed,
    int threads,
    Path output,
    boolean allowOverwrite,
    boolean dryRun) {

  static final long DEFAULT_MAX_EXITS = 50_000;
  static final int DEFAULT_PATHS_PER_THREAD = 100;
  static final double DEFAULT_STEP_SIZE = 0.05;
  static final String DEFAULT_OUTPUT = "brownian_paths.csv";

  /**
   * Validates every knob by building the engine parameters once.
   *
   * @throws ConfigurationException naming the first invalid value
   */
  public SimulationConfig {
    Objects.requireNonNull(domain, "domain");
    seed = Objects.requireNonNullElse(seed, OptionalLong.empty());
    output = ConfigValues.normalizePath("out", output);
    new SimulationParameters(domain, maxExits, pathsPerThread, stepSize, seed, threads);
  }

  /**
   * Returns the configuration used when no option is supplied.
   *
   * @return default simulate configuration
   */
  public static SimulationConfig defaults() {
    return new SimulationConfig(
        Domain.unitSquare(),
        DEFAULT_MAX_EXITS,
        DEFAULT_PATHS_PER_THREAD,
        DEFAULT_STEP_SIZE,
        OptionalLong.empty(),
        SimulationParameters.defaultThreads(),
        Path.of(DEFAULT_OUTPUT),
        false,
        false);
  }

  /**
   * Builds a configuration from flattened key/value options, falling back to {@link #defaults()} per key.
   *
   * @param options keys such as {@code domainXMin}, {@code maxExits}, {@code out}
   * @return validated configuration
   * @throws ConfigurationException when a value is malformed or out of range
   */
  public static SimulationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SimulationConfig defaults = defaults();
    Domain domain = ConfigValues.domain(options, defaults.domain());

    long maxExits = ConfigValues.longValue(options, "maxExits", defaults.maxExits());
    long pathsPerThread = ConfigValues.longValue(options, "pathsPerThread", defaults.pathsPerThread());
    Numbers.requireRange("pathsPerThread", pathsPerThread, 1, SimulationParameters.MAX_PATHS_PER_THREAD);
    double stepSize = ConfigValues.doubleValue(options, "stepSize", defaults.stepSize());
    long threads = ConfigValues.longValue(options, "threads", defaults.threads());
    Numbers.requireRange("threads", threads, 1, SimulationParameters.MAX_THREADS);
    OptionalLong seed = ConfigValues.seed(options);

    String outRaw = ConfigValues.firstNonBlank(options, "out", "output");
    Path output = outRaw == null ? defaults.output() : ConfigValues.parsePath("out", outRaw);

    return new SimulationConfig(
        domain,
        maxExits,
        (int) pathsPerThread,
        stepSize,
        seed,
        (int) threads,
        output,
        ConfigValues.booleanValue(options, "allowOverwrite", false),
        ConfigValues.booleanValue(options, "dryRun", false));
  }

  /**
   * Converts this configuration into engine parameters.
   *
   * @return engine parameters
   */
  public SimulationParameters toParameters() {
    return new SimulationParameters(domain, maxExits, pathsPerThread, stepSize, seed, threads);
  }
}
