package ca.gc.cra.brownian.domain.geometry;

import ca.gc.cra.brownian.validation.ConfigurationException;
import ca.gc.cra.brownian.validation.Numbers;
import java.util.Random;

/**
 * <strong>What:</strong> Immutable rectangle {@code [xMin, xMax] x [yMin, yMax]} that random walks are confined to.
 * <p><strong>Role:</strong> Domain value shared read-only by every simulation worker.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe across threads.</p>
 *
 * @param xMin left boundary
 * @param xMax right boundary; strictly greater than {@code xMin}
 * @param yMin bottom boundary
 * @param yMax top boundary; strictly greater than {@code yMin}
 * @since 0.1.0
 */
public record Domain(double xMin, double xMax, double yMin, double yMax) {

  /**
   * Validates the bounds.
   *
   * @throws ConfigurationException if a bound is not finite or an axis is empty or inverted
   */
  public Domain {
    Numbers.requireFinite("domainXMin", xMin);
    Numbers.requireFinite("domainXMax", xMax);
    Numbers.requireFinite("domainYMin", yMin);
    Numbers.requireFinite("domainYMax", yMax);
    if (xMin >= xMax) {
      throw new ConfigurationException(
          "domainXMin must be < domainXMax (was " + xMin + " >= " + xMax + ")");
    }
    if (yMin >= yMax) {
      throw new ConfigurationException(
          "domainYMin must be < domainYMax (was " + yMin + " >= " + yMax + ")");
    }
  }

  /**
   * Returns the unit square {@code [0, 1] x [0, 1]}.
   *
   * @return unit square domain
   */
  public static Domain unitSquare() {
    return new Domain(0.0, 1.0, 0.0, 1.0);
  }

  /**
   * Returns whether the point lies inside the rectangle or on its boundary.
   *
   * @param x abscissa
   * @param y ordinate
   * @return {@code true} when {@code xMin <= x <= xMax} and {@code yMin <= y <= yMax}
   */
  public boolean contains(double x, double y) {
    return x >= xMin && x <= xMax && y >= yMin && y <= yMax;
  }

  /**
   * Returns whether the point lies strictly outside the rectangle on at least one axis.
   *
   * @param x abscissa
   * @param y ordinate
   * @return {@code true} for points a step must be clipped for
   */
  public boolean isOutside(double x, double y) {
    return !contains(x, y);
  }

  /** Width of the domain along x. */
  public double width() {
    return xMax - xMin;
  }

  /** Height of the domain along y. */
  public double height() {
    return yMax - yMin;
  }

  /**
   * Draws a uniformly distributed abscissa in {@code [xMin, xMax)}.
   *
   * @param random caller-owned random source
   * @return random abscissa
   */
  public double randomX(Random random) {
    return xMin + random.nextDouble() * width();
  }

  /**
   * Draws a uniformly distributed ordinate in {@code [yMin, yMax)}.
   *
   * @param random caller-owned random source
   * @return random ordinate
   */
  public double randomY(Random random) {
    return yMin + random.nextDouble() * height();
  }
}
