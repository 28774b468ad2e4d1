package ca.gc.cra.brownian.domain.path;

/**
 * Position of one active walk inside a worker's slot array.
 * <p>Owned by exactly one worker; slots are overwritten in place rather than removed.</p>
 *
 * @param id globally unique path id
 * @param x current abscissa
 * @param y current ordinate
 * @param stepCount number of steps taken so far
 * @since 0.1.0
 */
public record PathState(long id, double x, double y, int stepCount) {

  /**
   * Starts a new walk at the given position.
   */
  public static PathState start(long id, double x, double y) {
    return new PathState(id, x, y, 0);
  }

  /**
   * Returns the state after an interior step to {@code (newX, newY)}.
   */
  public PathState moveTo(double newX, double newY) {
    return new PathState(id, newX, newY, stepCount + 1);
  }
}
