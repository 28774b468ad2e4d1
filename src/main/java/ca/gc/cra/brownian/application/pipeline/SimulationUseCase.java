package ca.gc.cra.brownian.application.pipeline;

import ca.gc.cra.brownian.application.port.MetricsPort;
import ca.gc.cra.brownian.application.port.SegmentPersistencePort;
import ca.gc.cra.brownian.application.simulation.SimulationEngine;
import ca.gc.cra.brownian.application.simulation.SimulationSummary;
import ca.gc.cra.brownian.config.SimulationConfig;
import ca.gc.cra.brownian.domain.path.Segment;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one simulation and persists the segments of every exited path.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code simulate} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the {@link SimulationEngine} with the configured parameters.</li>
 *   <li>Open the persistence port only after the engine succeeds, so a failed run leaves no partial file.</li>
 *   <li>Summarize the result.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per instance.</p>
 * <p><strong>Observability:</strong> Tags logs with MDC {@code pipeline=simulate}; records
 * {@code simulate.segments.persisted}.</p>
 *
 * @since 0.1.0
 */
public final class SimulationUseCase {
  private static final Logger log = LoggerFactory.getLogger(SimulationUseCase.class);

  private final SimulationConfig config;
  private final SimulationEngine engine;
  private final Supplier<? extends SegmentPersistencePort> persistenceFactory;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config validated simulate configuration
   * @param engine engine running the workers
   * @param persistenceFactory opens the output port once the run has succeeded
   * @param metrics metrics sink
   */
  public SimulationUseCase(
      SimulationConfig config,
      SimulationEngine engine,
      Supplier<? extends SegmentPersistencePort> persistenceFactory,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.persistenceFactory = Objects.requireNonNull(persistenceFactory, "persistenceFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the simulation and writes its output.
   *
   * @return summary of the persisted result
   * @throws Exception if the engine fails, the thread is interrupted, or persistence fails
   */
  public SimulationSummary run() throws Exception {
    MDC.put("pipeline", "simulate");
    try {
      List<Segment> segments = engine.simulate(config.toParameters());
      long persisted = 0;
      try (SegmentPersistencePort sink = persistenceFactory.get()) {
        for (Segment segment : segments) {
          sink.persist(segment);
          persisted++;
        }
        sink.flush();
      }
      metrics.observe("simulate.segments.persisted", persisted);

      SimulationSummary summary = SimulationSummary.of(segments);
      log.info(
          "Persisted {} segments of {} paths ({} exits) to {}",
          persisted,
          summary.uniquePaths(),
          summary.totalExits(),
          config.output());
      return summary;
    } catch (Exception ex) {
      log.error("Simulation pipeline failed", ex);
      throw ex;
    } finally {
      MDC.remove("pipeline");
    }
  }
}
