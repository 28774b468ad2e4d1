package ca.gc.cra.brownian.domain.path;

import ca.gc.cra.brownian.domain.geometry.BoundaryCrossing;
import ca.gc.cra.brownian.domain.geometry.ExitBoundary;
import java.util.Objects;

/**
 * Exit metadata carried only by the final segment of a path.
 *
 * @param intersectionX abscissa where the step crosses the boundary
 * @param intersectionY ordinate where the step crosses the boundary
 * @param boundary edge that was crossed
 * @param boundaryValue coordinate of that edge
 * @since 0.1.0
 */
public record ExitCrossing(
    double intersectionX, double intersectionY, ExitBoundary boundary, double boundaryValue) {

  public ExitCrossing {
    Objects.requireNonNull(boundary, "boundary");
  }

  /**
   * Combines an intersection point with its classified boundary.
   *
   * @param x intersection abscissa
   * @param y intersection ordinate
   * @param crossing classified boundary
   * @return exit metadata
   */
  public static ExitCrossing at(double x, double y, BoundaryCrossing crossing) {
    return new ExitCrossing(x, y, crossing.boundary(), crossing.value());
  }
}
