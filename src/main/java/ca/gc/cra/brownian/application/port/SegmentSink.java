package ca.gc.cra.brownian.application.port;

import ca.gc.cra.brownian.domain.path.Segment;
import java.util.List;

/**
 * <strong>What:</strong> Append-only collection shared by all simulation workers of one run.
 * <p><strong>Role:</strong> In-process output port of the simulation engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept segments from any worker thread.</li>
 *   <li>Preserve arrival order across threads.</li>
 *   <li>Hand back the accumulated sequence once every worker has joined.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #append(Segment)} must be safe for concurrent callers.</p>
 *
 * @since 0.1.0
 */
public interface SegmentSink {
  /**
   * Appends one segment.
   *
   * @param segment immutable segment; must not be {@code null}
   */
  void append(Segment segment);

  /**
   * Returns a copy of everything appended so far, in arrival order.
   *
   * @return immutable snapshot
   */
  List<Segment> snapshot();

  /**
   * Returns the number of segments appended so far.
   *
   * @return segment count
   */
  int size();
}
