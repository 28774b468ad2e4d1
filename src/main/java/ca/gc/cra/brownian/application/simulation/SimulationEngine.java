package ca.gc.cra.brownian.application.simulation;

import ca.gc.cra.brownian.application.port.ClockPort;
import ca.gc.cra.brownian.application.port.MetricsPort;
import ca.gc.cra.brownian.application.port.SegmentSink;
import ca.gc.cra.brownian.domain.geometry.GeometryException;
import ca.gc.cra.brownian.domain.path.Segment;
import ca.gc.cra.brownian.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs many independent random walks in parallel until a global exit count is reached.
 * <p><strong>Role:</strong> Application service behind the {@code simulate} pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the shared exit budget, id allocator and segment sink for one run.</li>
 *   <li>Derive one random seed per worker and start {@code threads} workers.</li>
 *   <li>Join every worker, propagating the first failure after all have stopped.</li>
 *   <li>Discard segments of walks that never exited.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each call to {@link #simulate(SimulationParameters)} builds its own shared
 * state, so one engine may serve sequential or concurrent runs.</p>
 * <p><strong>Observability:</strong> Records {@code simulate.worker.*} observations per worker and
 * {@code simulate.run.durationMillis} and {@code simulate.paths.discarded} per run.</p>
 *
 * @since 0.1.0
 */
public final class SimulationEngine {
  private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final Supplier<? extends SegmentSink> sinkFactory;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates an engine.
   *
   * @param sinkFactory supplies a fresh, empty sink for every run
   * @param metrics metrics sink for worker and run counters
   * @param clock clock used to time runs
   */
  public SimulationEngine(Supplier<? extends SegmentSink> sinkFactory, MetricsPort metrics, ClockPort clock) {
    this.sinkFactory = Objects.requireNonNull(sinkFactory, "sinkFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs one simulation.
   *
   * @param parameters validated run parameters
   * @return segments of every walk that exited, in sink arrival order
   * @throws GeometryException if a worker produced an exit point on no boundary
   * @throws SimulationException if a worker failed for any other reason
   * @throws InterruptedException if the calling thread is interrupted while waiting for workers
   */
  public List<Segment> simulate(SimulationParameters parameters) throws InterruptedException {
    Objects.requireNonNull(parameters, "parameters");
    long started = clock.nowMillis();

    GlobalExitBudget budget = new GlobalExitBudget(parameters.maxGlobalExits());
    PathIdAllocator ids = new PathIdAllocator();
    SegmentSink sink = Objects.requireNonNull(sinkFactory.get(), "sinkFactory returned null");
    long[] seeds = WorkerSeeds.derive(parameters.seed(), parameters.threads());

    log.info(
        "Starting simulation: threads={}, pathsPerThread={}, stepSize={}, maxExits={}, domain={}",
        parameters.threads(),
        parameters.pathsPerThread(),
        parameters.stepSize(),
        parameters.maxGlobalExits(),
        parameters.domain());

    ExecutorService pool =
        ExecutorFactories.newWorkerPool(
            parameters.threads(),
            "brownian-worker",
            (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));

    List<Future<WorkerReport>> futures = new ArrayList<>(parameters.threads());
    Throwable failure = null;
    long exits = 0;
    try {
      for (int i = 0; i < parameters.threads(); i++) {
        futures.add(pool.submit(new SimulationWorker(i, parameters, budget, ids, sink, new Random(seeds[i]))));
      }
      for (Future<WorkerReport> future : futures) {
        try {
          WorkerReport report = future.get();
          exits += report.exits();
          recordWorker(report);
        } catch (ExecutionException ex) {
          budget.exhaust();
          metrics.increment("simulate.worker.failed");
          Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
          if (failure == null) {
            failure = cause;
          } else if (failure != cause) {
            failure.addSuppressed(cause);
          }
        }
      }
    } catch (InterruptedException ex) {
      budget.exhaust();
      log.warn("Simulation interrupted; stopping workers");
      pool.shutdownNow();
      Thread.currentThread().interrupt();
      throw ex;
    } finally {
      shutdown(pool);
    }

    if (failure != null) {
      throw propagate(failure);
    }

    List<Segment> raw = sink.snapshot();
    List<Segment> kept = ResultFilter.retainExitedPaths(raw);
    long elapsed = clock.nowMillis() - started;
    metrics.observe("simulate.run.durationMillis", elapsed);
    metrics.observe("simulate.paths.discarded", ids.allocated() - exits);
    log.info(
        "Simulation finished in {} ms: {} exits, {} paths started, kept {} of {} segments",
        elapsed,
        exits,
        ids.allocated(),
        kept.size(),
        raw.size());
    return kept;
  }

  private void recordWorker(WorkerReport report) {
    metrics.observe("simulate.worker.segments", report.segments());
    metrics.observe("simulate.worker.exits", report.exits());
    metrics.observe("simulate.worker.rejectedExits", report.rejectedExits());
  }

  private static RuntimeException propagate(Throwable failure) {
    if (failure instanceof GeometryException geometry) {
      return geometry;
    }
    if (failure instanceof SimulationException simulation) {
      return simulation;
    }
    return new SimulationException("Simulation worker failed: " + failure.getMessage(), failure);
  }

  private void shutdown(ExecutorService pool) {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Simulation workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        pool.shutdownNow();
      }
    } catch (InterruptedException ie) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
