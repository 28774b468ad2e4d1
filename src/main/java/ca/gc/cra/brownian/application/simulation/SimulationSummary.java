package ca.gc.cra.brownian.application.simulation;

import ca.gc.cra.brownian.domain.geometry.ExitBoundary;
import ca.gc.cra.brownian.domain.path.Segment;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate figures printed after a simulation run.
 *
 * @param totalSegments number of segments in the result
 * @param uniquePaths number of distinct path ids
 * @param totalExits number of exiting segments
 * @param exitsByBoundary exit count per boundary, every boundary present
 * @param minSteps fewest segments on any path, zero when empty
 * @param meanSteps mean segments per path, zero when empty
 * @param medianSteps median segments per path, zero when empty
 * @param maxSteps most segments on any path, zero when empty
 * @since 0.1.0
 */
public record SimulationSummary(
    long totalSegments,
    long uniquePaths,
    long totalExits,
    Map<ExitBoundary, Long> exitsByBoundary,
    int minSteps,
    double meanSteps,
    double medianSteps,
    int maxSteps) {

  public SimulationSummary {
    exitsByBoundary = Collections.unmodifiableMap(new EnumMap<>(exitsByBoundary));
  }

  /**
   * Computes the summary of a result list.
   *
   * @param segments simulation output
   * @return summary figures
   */
  public static SimulationSummary of(Iterable<Segment> segments) {
    Map<ExitBoundary, Long> byBoundary = new EnumMap<>(ExitBoundary.class);
    for (ExitBoundary boundary : ExitBoundary.values()) {
      byBoundary.put(boundary, 0L);
    }
    Map<Long, Integer> stepsPerPath = new LinkedHashMap<>();
    long total = 0;
    long exits = 0;
    for (Segment segment : segments) {
      total++;
      stepsPerPath.merge(segment.pathId(), 1, Integer::sum);
      if (segment.hasExited()) {
        exits++;
        byBoundary.merge(segment.exit().orElseThrow().boundary(), 1L, Long::sum);
      }
    }

    int[] steps = stepsPerPath.values().stream().mapToInt(Integer::intValue).sorted().toArray();
    if (steps.length == 0) {
      return new SimulationSummary(total, 0, exits, byBoundary, 0, 0.0, 0.0, 0);
    }
    double mean = Arrays.stream(steps).average().orElse(0.0);
    int mid = steps.length / 2;
    double median = steps.length % 2 == 1 ? steps[mid] : (steps[mid - 1] + steps[mid]) / 2.0;
    return new SimulationSummary(
        total, steps.length, exits, byBoundary, steps[0], mean, median, steps[steps.length - 1]);
  }

  /**
   * Renders the summary as the multi-line block printed by the CLI.
   *
   * @return human-readable summary
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Segments: ").append(totalSegments).append(System.lineSeparator());
    sb.append("Paths: ").append(uniquePaths).append(System.lineSeparator());
    sb.append("Exits: ").append(totalExits).append(System.lineSeparator());
    for (Map.Entry<ExitBoundary, Long> entry : exitsByBoundary.entrySet()) {
      sb.append("  ").append(entry.getKey().label()).append(": ").append(entry.getValue())
          .append(System.lineSeparator());
    }
    sb.append(String.format(
        Locale.ROOT,
        "Steps per path: min=%d mean=%.2f median=%.1f max=%d", minSteps, meanSteps, medianSteps, maxSteps));
    return sb.toString();
  }
}
