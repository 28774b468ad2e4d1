package ca.gc.cra.brownian.domain.geometry;

import java.util.Objects;

/**
 * Classified boundary hit: which edge and that edge's coordinate.
 *
 * @param boundary edge that was crossed
 * @param value coordinate of that edge ({@code xMin}, {@code xMax}, {@code yMin}, or {@code yMax})
 * @since 0.1.0
 */
public record BoundaryCrossing(ExitBoundary boundary, double value) {
  public BoundaryCrossing {
    Objects.requireNonNull(boundary, "boundary");
  }
}
