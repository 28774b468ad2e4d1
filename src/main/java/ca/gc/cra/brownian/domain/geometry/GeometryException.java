package ca.gc.cra.brownian.domain.geometry;

/**
 * Raised when a point judged to be on the way out of the domain cannot be matched to any edge.
 * <p>Indicates the exit test and the boundary classifier disagree through accumulated floating point error;
 * the simulation treats it as fatal and discards the run.</p>
 *
 * @since 0.1.0
 */
public final class GeometryException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final double x;
  private final double y;

  /**
   * Creates an exception for the unmatched point.
   *
   * @param x abscissa of the point
   * @param y ordinate of the point
   * @param domain domain the point was classified against
   */
  public GeometryException(double x, double y, Domain domain) {
    super("Point (" + x + ", " + y + ") is not on any boundary of " + domain);
    this.x = x;
    this.y = y;
  }

  /** Abscissa of the unmatched point. */
  public double x() {
    return x;
  }

  /** Ordinate of the unmatched point. */
  public double y() {
    return y;
  }
}
