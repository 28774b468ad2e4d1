package ca.gc.cra.brownian.infrastructure.persistence;

import ca.gc.cra.brownian.application.port.SegmentSink;
import ca.gc.cra.brownian.domain.path.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link SegmentSink} guarded by a single lock.
 * <p>Arrival order across worker threads is the order in which they acquire the lock.</p>
 *
 * @since 0.1.0
 */
public final class LockingSegmentSink implements SegmentSink {
  private final ReentrantLock lock = new ReentrantLock();
  private final List<Segment> segments;

  /**
   * Creates an empty sink.
   */
  public LockingSegmentSink() {
    this(1024);
  }

  /**
   * Creates an empty sink with the given initial capacity.
   *
   * @param initialCapacity expected number of segments
   */
  public LockingSegmentSink(int initialCapacity) {
    this.segments = new ArrayList<>(Math.max(16, initialCapacity));
  }

  @Override
  public void append(Segment segment) {
    Objects.requireNonNull(segment, "segment");
    lock.lock();
    try {
      segments.add(segment);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Segment> snapshot() {
    lock.lock();
    try {
      return List.copyOf(segments);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return segments.size();
    } finally {
      lock.unlock();
    }
  }
}
