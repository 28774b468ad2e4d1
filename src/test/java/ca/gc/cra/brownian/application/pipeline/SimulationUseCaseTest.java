package ca.gc.cra.brownian.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.brownian.application.port.ClockPort;
import ca.gc.cra.brownian.application.simulation.SimulationEngine;
import ca.gc.cra.brownian.application.simulation.SimulationException;
import ca.gc.cra.brownian.application.simulation.SimulationSummary;
import ca.gc.cra.brownian.config.SimulationConfig;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.domain.path.Segment;
import ca.gc.cra.brownian.infrastructure.persistence.CsvSegmentFileWriter;
import ca.gc.cra.brownian.infrastructure.persistence.CsvSegmentReader;
import ca.gc.cra.brownian.infrastructure.persistence.LockingSegmentSink;
import ca.gc.cra.brownian.testutil.FailingSegmentSink;
import ca.gc.cra.brownian.testutil.RecordingMetricsPort;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class SimulationUseCaseTest {
  @TempDir Path tempDir;

  @Test
  void persistsEveryRetainedSegmentAndSummarizes() throws Exception {
    Path output = tempDir.resolve("paths.csv");
    SimulationConfig config = config(output, 25);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    SimulationEngine engine = new SimulationEngine(LockingSegmentSink::new, metrics, ClockPort.SYSTEM);

    SimulationSummary summary =
        new SimulationUseCase(config, engine, () -> new CsvSegmentFileWriter(output), metrics).run();

    List<Segment> written = new CsvSegmentReader(output).readAll();
    assertEquals(25, summary.totalExits());
    assertEquals(written.size(), summary.totalSegments());
    assertEquals(25, written.stream().filter(Segment::hasExited).count());
    assertEquals(List.of((long) written.size()), metrics.observed("simulate.segments.persisted"));
    assertNull(MDC.get("pipeline"));
  }

  @Test
  void failedRunNeverOpensTheOutput() {
    Path output = tempDir.resolve("paths.csv");
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    AtomicInteger opened = new AtomicInteger();
    SimulationEngine engine = new SimulationEngine(
        () -> new FailingSegmentSink(segment -> {
          throw new IllegalStateException("boom");
        }),
        metrics,
        ClockPort.SYSTEM);
    SimulationUseCase useCase = new SimulationUseCase(config(output, 10), engine, () -> {
      opened.incrementAndGet();
      return new CsvSegmentFileWriter(output);
    }, metrics);

    assertThrows(SimulationException.class, useCase::run);

    assertEquals(0, opened.get());
    assertFalse(Files.exists(output));
    assertNull(MDC.get("pipeline"));
  }

  private static SimulationConfig config(Path output, long maxExits) {
    return new SimulationConfig(
        Domain.unitSquare(), maxExits, 4, 0.1, OptionalLong.of(17), 2, output, false, false);
  }
}
