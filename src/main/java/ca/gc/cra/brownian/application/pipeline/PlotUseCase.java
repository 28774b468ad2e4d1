package ca.gc.cra.brownian.application.pipeline;

import ca.gc.cra.brownian.application.port.MetricsPort;
import ca.gc.cra.brownian.application.port.PathRenderer;
import ca.gc.cra.brownian.application.port.SegmentSource;
import ca.gc.cra.brownian.config.PlotConfig;
import ca.gc.cra.brownian.domain.path.PathTrace;
import ca.gc.cra.brownian.domain.path.Segment;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Draws a random sample of persisted paths.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code plot} CLI.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per instance.</p>
 * <p><strong>Observability:</strong> Tags logs with MDC {@code pipeline=plot}; records {@code plot.paths.rendered}.</p>
 *
 * @since 0.1.0
 */
public final class PlotUseCase {
  private static final Logger log = LoggerFactory.getLogger(PlotUseCase.class);

  private final PlotConfig config;
  private final SegmentSource source;
  private final PathRenderer renderer;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config validated plot configuration
   * @param source segments written by a previous simulation
   * @param renderer rendering target
   * @param metrics metrics sink
   */
  public PlotUseCase(PlotConfig config, SegmentSource source, PathRenderer renderer, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads the segments, selects paths and renders them.
   *
   * @return the rendered traces, sorted by path id
   * @throws IOException if the input cannot be read or the output cannot be written
   */
  public List<PathTrace> run() throws IOException {
    MDC.put("pipeline", "plot");
    try {
      List<Segment> segments = source.readAll();
      Map<Long, PathTrace> traces = PathTrace.group(segments);
      if (traces.isEmpty()) {
        log.warn("Input {} contains no paths; rendering the domain only", config.input());
      }
      Random random = config.seed().isPresent() ? new Random(config.seed().getAsLong()) : new Random();
      List<PathTrace> selected = selectPaths(traces, config.nPaths(), random);
      for (PathTrace trace : selected) {
        if (!trace.isConnected()) {
          log.warn("Path {} has gaps between consecutive segments", trace.pathId());
        }
      }
      renderer.render(config.domain(), selected);
      metrics.observe("plot.paths.rendered", selected.size());
      log.info(
          "Plotted {} of {} paths from {} to {}",
          selected.size(),
          traces.size(),
          config.input(),
          config.output());
      return selected;
    } catch (IOException | RuntimeException ex) {
      log.error("Plot pipeline failed", ex);
      throw ex;
    } finally {
      MDC.remove("pipeline");
    }
  }

  static List<PathTrace> selectPaths(Map<Long, PathTrace> traces, int count, Random random) {
    List<Long> ids = new ArrayList<>(traces.keySet());
    Collections.shuffle(ids, random);
    List<Long> chosen = new ArrayList<>(ids.subList(0, Math.min(count, ids.size())));
    Collections.sort(chosen);
    List<PathTrace> selected = new ArrayList<>(chosen.size());
    for (Long id : chosen) {
      selected.add(traces.get(id));
    }
    return selected;
  }
}
