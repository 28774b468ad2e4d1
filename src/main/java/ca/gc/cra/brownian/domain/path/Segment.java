package ca.gc.cra.brownian.domain.path;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One recorded step of one random walk.
 * <p><strong>Why:</strong> The output of a run is the ordered collection of these records; CSV writers and the
 * plot renderer rebuild per-path polylines from them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe across threads once appended to a sink.</p>
 *
 * @param pathId globally unique id of the walk
 * @param step 1-based index of the step within its walk
 * @param startX abscissa before the step
 * @param startY ordinate before the step
 * @param endX abscissa after the step (outside the domain for an exit)
 * @param endY ordinate after the step
 * @param exit exit metadata; present only on the step that left the domain
 * @since 0.1.0
 */
public record Segment(
    long pathId,
    int step,
    double startX,
    double startY,
    double endX,
    double endY,
    Optional<ExitCrossing> exit) {

  public Segment {
    if (step < 1) {
      throw new IllegalArgumentException("step must be >= 1 (was " + step + ")");
    }
    exit = Objects.requireNonNullElse(exit, Optional.empty());
  }

  /**
   * Creates a segment for a step that stayed inside the domain.
   */
  public static Segment interior(long pathId, int step, double startX, double startY, double endX, double endY) {
    return new Segment(pathId, step, startX, startY, endX, endY, Optional.empty());
  }

  /**
   * Creates a segment for the step that left the domain.
   */
  public static Segment exited(
      long pathId,
      int step,
      double startX,
      double startY,
      double endX,
      double endY,
      ExitCrossing exit) {
    return new Segment(pathId, step, startX, startY, endX, endY, Optional.of(exit));
  }

  /**
   * Returns whether this step left the domain.
   *
   * @return {@code true} when exit metadata is present
   */
  public boolean hasExited() {
    return exit.isPresent();
  }
}
