package ca.gc.cra.brownian.domain.path;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> All segments of one walk ordered by step, viewed as a polyline.
 * <p><strong>Role:</strong> Read-side domain value used by the plot pipeline and by run statistics.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param pathId id shared by every segment
 * @param segments segments sorted by ascending {@code step}; never empty
 * @since 0.1.0
 */
public record PathTrace(long pathId, List<Segment> segments) {

  public PathTrace {
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("path " + pathId + " has no segments");
    }
    List<Segment> sorted = new ArrayList<>(segments);
    sorted.sort(Comparator.comparingInt(Segment::step));
    for (Segment segment : sorted) {
      if (segment.pathId() != pathId) {
        throw new IllegalArgumentException(
            "segment of path " + segment.pathId() + " cannot belong to path " + pathId);
      }
    }
    segments = List.copyOf(sorted);
  }

  /**
   * Groups a flat segment list into traces keyed by path id, in order of first appearance.
   *
   * @param segments segments of any number of paths, in any order
   * @return ordered map of traces
   */
  public static Map<Long, PathTrace> group(List<Segment> segments) {
    Map<Long, List<Segment>> byPath = new LinkedHashMap<>();
    for (Segment segment : segments) {
      byPath.computeIfAbsent(segment.pathId(), id -> new ArrayList<>()).add(segment);
    }
    Map<Long, PathTrace> traces = new LinkedHashMap<>();
    byPath.forEach((id, list) -> traces.put(id, new PathTrace(id, list)));
    return traces;
  }

  /** Number of recorded steps. */
  public int stepCount() {
    return segments.size();
  }

  /** Abscissa where the walk started. */
  public double startX() {
    return segments.get(0).startX();
  }

  /** Ordinate where the walk started. */
  public double startY() {
    return segments.get(0).startY();
  }

  /**
   * Returns the polyline vertices: the start point followed by every segment end point.
   *
   * @return list of {@code {x, y}} pairs
   */
  public List<double[]> vertices() {
    List<double[]> points = new ArrayList<>(segments.size() + 1);
    points.add(new double[] {startX(), startY()});
    for (Segment segment : segments) {
      points.add(new double[] {segment.endX(), segment.endY()});
    }
    return points;
  }

  /**
   * Returns the first exiting segment, if the walk left the domain.
   *
   * @return exiting segment
   */
  public Optional<Segment> exitSegment() {
    return segments.stream().filter(Segment::hasExited).findFirst();
  }

  /**
   * Returns whether consecutive segments share end and start points exactly.
   *
   * @return {@code true} when the trace is a connected polyline
   */
  public boolean isConnected() {
    for (int i = 1; i < segments.size(); i++) {
      Segment previous = segments.get(i - 1);
      Segment current = segments.get(i);
      if (Double.compare(previous.endX(), current.startX()) != 0
          || Double.compare(previous.endY(), current.startY()) != 0) {
        return false;
      }
    }
    return true;
  }
}
