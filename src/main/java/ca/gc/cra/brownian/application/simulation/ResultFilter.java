package ca.gc.cra.brownian.application.simulation;

import ca.gc.cra.brownian.domain.path.Segment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops the segments of walks that were still active when the run stopped.
 *
 * @since 0.1.0
 */
public final class ResultFilter {
  private ResultFilter() {}

  /**
   * Keeps every segment whose path has at least one exiting segment.
   *
   * @param segments raw sink contents in arrival order
   * @return unmodifiable list of the retained segments, in the same relative order
   */
  public static List<Segment> retainExitedPaths(List<Segment> segments) {
    Set<Long> exited = new HashSet<>();
    for (Segment segment : segments) {
      if (segment.hasExited()) {
        exited.add(segment.pathId());
      }
    }
    List<Segment> kept = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      if (exited.contains(segment.pathId())) {
        kept.add(segment);
      }
    }
    return Collections.unmodifiableList(kept);
  }
}
