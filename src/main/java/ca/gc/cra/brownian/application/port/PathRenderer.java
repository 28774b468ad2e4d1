package ca.gc.cra.brownian.application.port;

import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.domain.path.PathTrace;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Output port that draws selected walks over their domain.
 * <p><strong>Role:</strong> Rendering side of the plot pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Draw the domain boundary and one polyline per trace.</li>
 *   <li>Mark start points, boundary intersections, and exit end points.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface PathRenderer {
  /**
   * Renders the traces.
   *
   * @param domain domain drawn as the boundary rectangle
   * @param traces traces to draw, in legend order
   * @throws IOException if the rendering target cannot be written
   */
  void render(Domain domain, List<PathTrace> traces) throws IOException;
}
