package ca.gc.cra.brownian.application.port;

import ca.gc.cra.brownian.domain.path.Segment;
import java.io.IOException;
import java.util.List;

/**
 * Input port supplying previously persisted segments to the plot pipeline.
 *
 * @since 0.1.0
 */
public interface SegmentSource {
  /**
   * Reads every segment available from the source.
   *
   * @return segments in stored order
   * @throws IOException if the source cannot be read or is malformed
   */
  List<Segment> readAll() throws IOException;
}
