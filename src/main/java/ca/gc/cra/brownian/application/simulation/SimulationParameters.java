package ca.gc.cra.brownian.application.simulation;

import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.validation.Numbers;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Validated inputs of one {@link SimulationEngine#simulate(SimulationParameters)} call.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param domain rectangle the walks are confined to
 * @param maxGlobalExits number of exits after which the run stops
 * @param pathsPerThread number of concurrently active walks owned by each worker
 * @param stepSize standard deviation of each Gaussian step component
 * @param seed optional seed from which every worker's random source is derived
 * @param threads number of worker threads
 * @since 0.1.0
 */
public record SimulationParameters(
    Domain domain,
    long maxGlobalExits,
    int pathsPerThread,
    double stepSize,
    OptionalLong seed,
    int threads) {

  /** Upper bound on the worker count. */
  public static final int MAX_THREADS = 1024;

  /** Upper bound on walks per worker. */
  public static final int MAX_PATHS_PER_THREAD = 10_000_000;

  /**
   * Validates every knob before any worker is created.
   *
   * @throws ca.gc.cra.brownian.validation.ConfigurationException naming the first invalid value
   */
  public SimulationParameters {
    Objects.requireNonNull(domain, "domain");
    seed = Objects.requireNonNullElse(seed, OptionalLong.empty());
    Numbers.requireRange("maxExits", maxGlobalExits, 0, Long.MAX_VALUE / 2);
    Numbers.requireRange("pathsPerThread", pathsPerThread, 1, MAX_PATHS_PER_THREAD);
    Numbers.requirePositive("stepSize", stepSize);
    Numbers.requireRange("threads", threads, 1, MAX_THREADS);
  }

  /**
   * Creates parameters using one worker per available processor.
   */
  public static SimulationParameters withDefaultThreads(
      Domain domain, long maxGlobalExits, int pathsPerThread, double stepSize, OptionalLong seed) {
    return new SimulationParameters(
        domain, maxGlobalExits, pathsPerThread, stepSize, seed, defaultThreads());
  }

  /**
   * Returns the number of hardware threads visible to the JVM.
   *
   * @return available processors, at least one
   */
  public static int defaultThreads() {
    return Math.max(1, Math.min(MAX_THREADS, Runtime.getRuntime().availableProcessors()));
  }
}
