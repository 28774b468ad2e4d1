package ca.gc.cra.brownian.application.simulation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out globally unique path ids, starting at zero, to every worker of one run.
 * <p>Thread-safe; ids are never reused.</p>
 *
 * @since 0.1.0
 */
public final class PathIdAllocator {
  private final AtomicLong next = new AtomicLong();

  /**
   * Allocates the next id.
   *
   * @return fresh path id
   */
  public long allocate() {
    return next.getAndIncrement();
  }

  /** Number of ids handed out so far. */
  public long allocated() {
    return next.get();
  }
}
