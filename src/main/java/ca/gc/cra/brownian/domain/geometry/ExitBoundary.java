package ca.gc.cra.brownian.domain.geometry;

import java.util.Locale;

/**
 * Edge of a {@link Domain} crossed by an exiting step.
 * <p>Declaration order is the classification priority used by
 * {@link ExitGeometry#identifyExitBoundary(double, double, Domain)}.</p>
 *
 * @since 0.1.0
 */
public enum ExitBoundary {
  /** The line {@code x = xMin}. */
  LEFT,
  /** The line {@code x = xMax}. */
  RIGHT,
  /** The line {@code y = yMin}. */
  BOTTOM,
  /** The line {@code y = yMax}. */
  TOP;

  /**
   * Returns the lowercase label used in CSV output.
   *
   * @return {@code left}, {@code right}, {@code bottom}, or {@code top}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the coordinate of this edge within {@code domain}.
   *
   * @param domain rectangle the edge belongs to
   * @return {@code xMin}, {@code xMax}, {@code yMin}, or {@code yMax}
   */
  public double valueIn(Domain domain) {
    return switch (this) {
      case LEFT -> domain.xMin();
      case RIGHT -> domain.xMax();
      case BOTTOM -> domain.yMin();
      case TOP -> domain.yMax();
    };
  }

  /**
   * Parses a CSV label back into a boundary.
   *
   * @param label case-insensitive label
   * @return matching boundary
   * @throws IllegalArgumentException if the label names no boundary
   */
  public static ExitBoundary fromLabel(String label) {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("exit boundary label must not be blank");
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    for (ExitBoundary boundary : values()) {
      if (boundary.label().equals(normalized)) {
        return boundary;
      }
    }
    throw new IllegalArgumentException("unknown exit boundary: " + label);
  }
}
