package ca.gc.cra.brownian.application.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.application.port.ClockPort;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.domain.geometry.ExitGeometry;
import ca.gc.cra.brownian.domain.geometry.GeometryException;
import ca.gc.cra.brownian.domain.path.ExitCrossing;
import ca.gc.cra.brownian.domain.path.PathTrace;
import ca.gc.cra.brownian.domain.path.Segment;
import ca.gc.cra.brownian.infrastructure.persistence.LockingSegmentSink;
import ca.gc.cra.brownian.testutil.FailingSegmentSink;
import ca.gc.cra.brownian.testutil.RecordingMetricsPort;
import ca.gc.cra.brownian.validation.ConfigurationException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimulationEngineTest {
  private static final double TOLERANCE = ExitGeometry.BOUNDARY_TOLERANCE;

  private RecordingMetricsPort metrics;
  private SimulationEngine engine;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    engine = new SimulationEngine(LockingSegmentSink::new, metrics, ClockPort.SYSTEM);
  }

  @Test
  void singleWorkerRecordsExactlyMaxExits() throws Exception {
    List<Segment> result = engine.simulate(params(Domain.unitSquare(), 50, 5, 0.1, OptionalLong.of(1), 1));

    assertEquals(50, exits(result));
    assertEquals(50, PathTrace.group(result).size());
  }

  @Test
  void parallelWorkersStayWithinSoftCap() throws Exception {
    int threads = 4;
    List<Segment> result = engine.simulate(params(Domain.unitSquare(), 400, 20, 0.1, OptionalLong.of(3), threads));

    long exits = exits(result);
    assertTrue(exits >= 400 && exits <= 400 + threads - 1, "exits=" + exits);
    assertEquals(threads, metrics.observed("simulate.worker.exits").size());
    assertEquals(exits, metrics.observed("simulate.worker.exits").stream().mapToLong(Long::longValue).sum());
  }

  @Test
  void everyRetainedPathEndsWithItsOnlyExit() throws Exception {
    Domain domain = new Domain(-1.0, 2.0, 0.5, 1.5);
    List<Segment> result = engine.simulate(params(domain, 200, 10, 0.2, OptionalLong.of(11), 3));

    Map<Long, PathTrace> traces = PathTrace.group(result);
    for (PathTrace trace : traces.values()) {
      List<Segment> segments = trace.segments();
      for (int i = 0; i < segments.size(); i++) {
        assertEquals(i + 1, segments.get(i).step(), "steps are contiguous from 1 for path " + trace.pathId());
        assertEquals(i == segments.size() - 1, segments.get(i).hasExited());
      }
      assertTrue(trace.isConnected(), "path " + trace.pathId() + " is connected");
      for (int i = 0; i < segments.size() - 1; i++) {
        assertTrue(domain.contains(segments.get(i).endX(), segments.get(i).endY()));
      }
    }
  }

  @Test
  void exitSegmentsCarryConsistentIntersections() throws Exception {
    Domain domain = Domain.unitSquare();
    List<Segment> result = engine.simulate(params(domain, 300, 8, 0.15, OptionalLong.of(5), 2));

    for (Segment segment : result) {
      if (!segment.hasExited()) {
        continue;
      }
      ExitCrossing exit = segment.exit().orElseThrow();
      assertTrue(domain.isOutside(segment.endX(), segment.endY()));
      assertEquals(exit.boundary().valueIn(domain), exit.boundaryValue());
      double coordinate = switch (exit.boundary()) {
        case LEFT, RIGHT -> exit.intersectionX();
        case BOTTOM, TOP -> exit.intersectionY();
      };
      assertEquals(exit.boundaryValue(), coordinate, TOLERANCE);
      assertTrue(exit.intersectionX() >= domain.xMin() - TOLERANCE
          && exit.intersectionX() <= domain.xMax() + TOLERANCE);
      assertTrue(exit.intersectionY() >= domain.yMin() - TOLERANCE
          && exit.intersectionY() <= domain.yMax() + TOLERANCE);
      // intersection lies on the step between start and end
      double dx = segment.endX() - segment.startX();
      double dy = segment.endY() - segment.startY();
      double cross = dx * (exit.intersectionY() - segment.startY()) - dy * (exit.intersectionX() - segment.startX());
      assertEquals(0.0, cross, 1e-9);
    }
  }

  @Test
  void pathIdsAreUniqueAcrossWorkers() throws Exception {
    List<Segment> result = engine.simulate(params(Domain.unitSquare(), 500, 16, 0.1, OptionalLong.empty(), 4));

    Set<Long> exitedIds = new HashSet<>();
    for (Segment segment : result) {
      if (segment.hasExited()) {
        assertTrue(exitedIds.add(segment.pathId()), "path " + segment.pathId() + " exited twice");
      }
    }
    assertEquals(PathTrace.group(result).size(), exitedIds.size());
  }

  @Test
  void seededSingleWorkerRunsAreReproducible() throws Exception {
    SimulationParameters parameters = params(Domain.unitSquare(), 40, 6, 0.08, OptionalLong.of(2024), 1);

    List<Segment> first = engine.simulate(parameters);
    List<Segment> second = engine.simulate(parameters);

    assertEquals(first, second);
  }

  @Test
  void zeroExitBudgetProducesNoSegments() throws Exception {
    List<Segment> result = engine.simulate(params(Domain.unitSquare(), 0, 10, 0.1, OptionalLong.of(1), 2));

    assertTrue(result.isEmpty());
  }

  @Test
  void hugeStepsExitOnTheFirstStep() throws Exception {
    List<Segment> result = engine.simulate(params(Domain.unitSquare(), 100, 10, 1_000.0, OptionalLong.of(9), 1));

    assertEquals(100, exits(result));
    assertTrue(result.stream().allMatch(segment -> segment.step() == 1 && segment.hasExited()));
  }

  @Test
  void runMetricsAreRecorded() throws Exception {
    engine.simulate(params(Domain.unitSquare(), 30, 4, 0.1, OptionalLong.of(1), 2));

    assertTrue(metrics.hasObservation("simulate.run.durationMillis"));
    assertEquals(2, metrics.observed("simulate.worker.segments").size());
    assertEquals(1, metrics.observed("simulate.paths.discarded").size());
    assertTrue(metrics.observed("simulate.paths.discarded").get(0) >= 0);
  }

  @Test
  void workerFailureStopsTheRunAndIsWrapped() {
    AtomicInteger appended = new AtomicInteger();
    SimulationEngine failing = new SimulationEngine(
        () -> new FailingSegmentSink(segment -> {
          if (appended.incrementAndGet() > 100) {
            throw new IllegalStateException("sink full");
          }
        }),
        metrics,
        ClockPort.SYSTEM);

    SimulationException ex = assertThrows(
        SimulationException.class,
        () -> failing.simulate(params(Domain.unitSquare(), 1_000_000, 4, 0.01, OptionalLong.of(1), 3)));

    assertTrue(ex.getMessage().contains("sink full"));
    assertTrue(metrics.count("simulate.worker.failed") >= 1);
    assertFalse(metrics.hasObservation("simulate.run.durationMillis"));
  }

  @Test
  void geometryFailurePropagatesUnwrapped() {
    GeometryException boom = new GeometryException(0.5, 0.5, Domain.unitSquare());
    SimulationEngine failing = new SimulationEngine(
        () -> new FailingSegmentSink(segment -> {
          throw boom;
        }),
        metrics,
        ClockPort.SYSTEM);

    GeometryException thrown = assertThrows(
        GeometryException.class,
        () -> failing.simulate(params(Domain.unitSquare(), 10, 2, 0.1, OptionalLong.of(1), 1)));
    assertSame(boom, thrown);
  }

  @Test
  void invalidParametersAreRejectedBeforeAnyWorkerStarts() {
    assertThrows(ConfigurationException.class,
        () -> params(Domain.unitSquare(), 10, 0, 0.1, OptionalLong.empty(), 1));
    assertThrows(ConfigurationException.class,
        () -> params(Domain.unitSquare(), 10, 5, 0.0, OptionalLong.empty(), 1));
    assertThrows(ConfigurationException.class,
        () -> params(Domain.unitSquare(), -1, 5, 0.1, OptionalLong.empty(), 1));
    assertThrows(ConfigurationException.class,
        () -> params(Domain.unitSquare(), 10, 5, 0.1, OptionalLong.empty(), 0));
  }

  private static SimulationParameters params(
      Domain domain, long maxExits, int pathsPerThread, double stepSize, OptionalLong seed, int threads) {
    return new SimulationParameters(domain, maxExits, pathsPerThread, stepSize, seed, threads);
  }

  private static long exits(List<Segment> segments) {
    return segments.stream().filter(Segment::hasExited).count();
  }
}
