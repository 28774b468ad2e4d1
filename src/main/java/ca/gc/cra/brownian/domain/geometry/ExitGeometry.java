package ca.gc.cra.brownian.domain.geometry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Exact line/rectangle intersection for steps that leave a {@link Domain}.
 * <p><strong>Role:</strong> Pure domain functions called by every simulation worker on each exiting step.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Four divisions and a handful of comparisons; no allocation on the
 * {@link #findExitPoint} path.</p>
 *
 * @since 0.1.0
 */
public final class ExitGeometry {
  private static final Logger log = LoggerFactory.getLogger(ExitGeometry.class);

  /** Absolute tolerance used to match an intersection point to a boundary line. */
  public static final double BOUNDARY_TOLERANCE = 1e-10;

  private ExitGeometry() {}

  /**
   * Finds the first parameter {@code t} at which the step {@code (x1,y1) -> (x2,y2)} reaches the domain boundary.
   *
   * <p>The step is the line {@code P(t) = (x1, y1) + t * (dx, dy)}. Each of the four boundary lines yields one
   * candidate; candidates that are not finite (a zero component on that axis), fall outside {@code [0, 1]}, or
   * produce a point outside the closed rectangle (widened by {@link #BOUNDARY_TOLERANCE}) are dropped. When
   * nothing survives, {@code 1.0} is returned so the step endpoint itself stands in for the exit point.</p>
   *
   * @param x1 start abscissa, inside or on the domain
   * @param y1 start ordinate, inside or on the domain
   * @param x2 end abscissa
   * @param y2 end ordinate
   * @param domain rectangle being left
   * @return smallest valid {@code t} in {@code [0, 1]}, or {@code 1.0} when none is valid
   */
  public static double findExitPoint(double x1, double y1, double x2, double y2, Domain domain) {
    double dx = x2 - x1;
    double dy = y2 - y1;

    double best = Double.POSITIVE_INFINITY;
    best = keepIfValid(best, (domain.xMin() - x1) / dx, x1, y1, dx, dy, domain);
    best = keepIfValid(best, (domain.xMax() - x1) / dx, x1, y1, dx, dy, domain);
    best = keepIfValid(best, (domain.yMin() - y1) / dy, x1, y1, dx, dy, domain);
    best = keepIfValid(best, (domain.yMax() - y1) / dy, x1, y1, dx, dy, domain);

    if (best == Double.POSITIVE_INFINITY) {
      if (log.isDebugEnabled()) {
        log.debug("No valid boundary crossing for step ({}, {}) -> ({}, {}); using endpoint", x1, y1, x2, y2);
      }
      return 1.0;
    }
    return best;
  }

  /**
   * Classifies which boundary a point lies on, using {@link #BOUNDARY_TOLERANCE}.
   *
   * @param x abscissa of the intersection point
   * @param y ordinate of the intersection point
   * @param domain rectangle the point belongs to
   * @return first matching boundary in the order left, right, bottom, top
   * @throws GeometryException if the point is not within tolerance of any boundary
   */
  public static BoundaryCrossing identifyExitBoundary(double x, double y, Domain domain) {
    return identifyExitBoundary(x, y, domain, BOUNDARY_TOLERANCE);
  }

  /**
   * Classifies which boundary a point lies on.
   *
   * @param x abscissa of the intersection point
   * @param y ordinate of the intersection point
   * @param domain rectangle the point belongs to
   * @param tolerance absolute distance within which a coordinate matches a boundary line
   * @return first matching boundary in the order left, right, bottom, top
   * @throws GeometryException if the point is not within tolerance of any boundary
   */
  public static BoundaryCrossing identifyExitBoundary(
      double x, double y, Domain domain, double tolerance) {
    for (ExitBoundary boundary : ExitBoundary.values()) {
      double value = boundary.valueIn(domain);
      double coordinate = (boundary == ExitBoundary.LEFT || boundary == ExitBoundary.RIGHT) ? x : y;
      if (Math.abs(coordinate - value) <= tolerance) {
        return new BoundaryCrossing(boundary, value);
      }
    }
    throw new GeometryException(x, y, domain);
  }

  private static double keepIfValid(
      double best, double t, double x1, double y1, double dx, double dy, Domain domain) {
    if (!Double.isFinite(t) || t < 0.0 || t > 1.0 || t >= best) {
      return best;
    }
    double x = x1 + t * dx;
    double y = y1 + t * dy;
    // x1 + t * dx can land an ulp past the edge it was solved for
    if (x < domain.xMin() - BOUNDARY_TOLERANCE
        || x > domain.xMax() + BOUNDARY_TOLERANCE
        || y < domain.yMin() - BOUNDARY_TOLERANCE
        || y > domain.yMax() + BOUNDARY_TOLERANCE) {
      return best;
    }
    return t;
  }
}
