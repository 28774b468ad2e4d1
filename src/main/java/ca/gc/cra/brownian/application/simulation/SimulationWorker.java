package ca.gc.cra.brownian.application.simulation;

import ca.gc.cra.brownian.application.port.SegmentSink;
import ca.gc.cra.brownian.domain.geometry.BoundaryCrossing;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.domain.geometry.ExitGeometry;
import ca.gc.cra.brownian.domain.path.ExitCrossing;
import ca.gc.cra.brownian.domain.path.PathState;
import ca.gc.cra.brownian.domain.path.Segment;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Advances a fixed pool of random walks until the shared exit budget closes.
 * <p><strong>Role:</strong> Unit of work submitted to the engine's worker pool, one per thread.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own {@code pathsPerThread} active walks and a private random source.</li>
 *   <li>Append one segment per step to the shared sink.</li>
 *   <li>Replace a walk in place as soon as it leaves the domain, giving the new walk a fresh id.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each instance is confined to one thread; only the budget, the id allocator and
 * the sink are shared.</p>
 * <p><strong>Observability:</strong> Tags log lines with MDC key {@code worker}.</p>
 *
 * @since 0.1.0
 */
final class SimulationWorker implements Callable<WorkerReport> {
  private static final Logger log = LoggerFactory.getLogger(SimulationWorker.class);

  private final int index;
  private final Domain domain;
  private final int pathsPerThread;
  private final double stepSize;
  private final GlobalExitBudget budget;
  private final PathIdAllocator ids;
  private final SegmentSink sink;
  private final Random random;

  SimulationWorker(
      int index,
      SimulationParameters parameters,
      GlobalExitBudget budget,
      PathIdAllocator ids,
      SegmentSink sink,
      Random random) {
    this.index = index;
    this.domain = parameters.domain();
    this.pathsPerThread = parameters.pathsPerThread();
    this.stepSize = parameters.stepSize();
    this.budget = Objects.requireNonNull(budget, "budget");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public WorkerReport call() {
    String previousWorker = MDC.get("worker");
    MDC.put("worker", Integer.toString(index));
    try {
      return run();
    } catch (RuntimeException | Error ex) {
      budget.exhaust();
      log.error("Worker {} failed; closing exit budget", index, ex);
      throw ex;
    } finally {
      if (previousWorker == null) {
        MDC.remove("worker");
      } else {
        MDC.put("worker", previousWorker);
      }
    }
  }

  private WorkerReport run() {
    PathState[] slots = new PathState[pathsPerThread];
    for (int i = 0; i < slots.length; i++) {
      slots[i] = newPath();
    }
    log.debug("Worker {} started with {} paths", index, slots.length);

    long segments = 0;
    long exits = 0;
    long rejected = 0;

    while (budget.isOpen()) {
      int i = 0;
      while (i < slots.length) {
        PathState path = slots[i];
        double newX = path.x() + stepSize * random.nextGaussian();
        double newY = path.y() + stepSize * random.nextGaussian();
        int step = path.stepCount() + 1;

        if (!domain.isOutside(newX, newY)) {
          sink.append(Segment.interior(path.id(), step, path.x(), path.y(), newX, newY));
          segments++;
          slots[i] = path.moveTo(newX, newY);
          i++;
          continue;
        }

        double t = ExitGeometry.findExitPoint(path.x(), path.y(), newX, newY, domain);
        double ix = path.x() + t * (newX - path.x());
        double iy = path.y() + t * (newY - path.y());
        BoundaryCrossing crossing = ExitGeometry.identifyExitBoundary(ix, iy, domain);

        if (!budget.tryConsume()) {
          rejected++;
          break;
        }
        sink.append(
            Segment.exited(path.id(), step, path.x(), path.y(), newX, newY, ExitCrossing.at(ix, iy, crossing)));
        segments++;
        exits++;
        // slot i now holds a fresh walk, which steps before the pass moves on
        slots[i] = newPath();
      }
    }

    log.debug("Worker {} finished: {} segments, {} exits, {} rejected", index, segments, exits, rejected);
    return new WorkerReport(index, segments, exits, rejected);
  }

  private PathState newPath() {
    return PathState.start(ids.allocate(), domain.randomX(random), domain.randomY(random));
  }
}
