package ca.gc.cra.brownian.config;

import ca.gc.cra.brownian.application.pipeline.PlotUseCase;
import ca.gc.cra.brownian.application.pipeline.SimulationUseCase;
import ca.gc.cra.brownian.application.port.ClockPort;
import ca.gc.cra.brownian.application.port.MetricsPort;
import ca.gc.cra.brownian.application.simulation.SimulationEngine;
import ca.gc.cra.brownian.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.brownian.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.brownian.infrastructure.persistence.CsvSegmentFileWriter;
import ca.gc.cra.brownian.infrastructure.persistence.CsvSegmentReader;
import ca.gc.cra.brownian.infrastructure.persistence.LockingSegmentSink;
import ca.gc.cra.brownian.infrastructure.plot.SvgPathRenderer;
import ca.gc.cra.brownian.infrastructure.time.SystemClockAdapter;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that wires the simulate and plot use cases to concrete adapters.
 * <p><strong>Role:</strong> Single place translating configuration into runnable pipelines.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter ({@code none} or {@code otlp}).</li>
 *   <li>Build the simulation engine with an in-memory locking sink per run.</li>
 *   <li>Bind the CSV writer, CSV reader and SVG renderer to the configured paths.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Create and use from the CLI thread. {@link #close()} flushes and shuts down
 * the metrics exporter.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root whose metrics adapter is chosen by {@code metricsExporter}.
   *
   * @param metricsExporter {@code none} or {@code otlp}; blank means {@code none}
   */
  public CompositionRoot(String metricsExporter) {
    this(selectMetrics(metricsExporter), new SystemClockAdapter());
  }

  /**
   * Creates a root around explicit adapters; used by tests.
   *
   * @param metrics metrics adapter
   * @param clock clock adapter
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the simulate use case.
   *
   * @param config validated simulate configuration
   * @return use case ready to run
   */
  public SimulationUseCase simulationUseCase(SimulationConfig config) {
    Objects.requireNonNull(config, "config");
    SimulationEngine engine = new SimulationEngine(LockingSegmentSink::new, metrics, clock);
    return new SimulationUseCase(config, engine, () -> new CsvSegmentFileWriter(config.output()), metrics);
  }

  /**
   * Builds the plot use case.
   *
   * @param config validated plot configuration
   * @return use case ready to run
   */
  public PlotUseCase plotUseCase(PlotConfig config) {
    Objects.requireNonNull(config, "config");
    return new PlotUseCase(
        config, new CsvSegmentReader(config.input()), new SvgPathRenderer(config.output()), metrics);
  }

  /** Metrics adapter shared by every use case built here. */
  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter cleanly", ex);
      }
    }
  }

  private static MetricsPort selectMetrics(String metricsExporter) {
    String normalized = metricsExporter == null ? "" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("otlp")) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }
}
