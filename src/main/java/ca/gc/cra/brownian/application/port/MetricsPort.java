package ca.gc.cra.brownian.application.port;

/**
 * <strong>What:</strong> Port abstracting BROWNIAN metrics emission.
 * <p><strong>Why:</strong> Lets the engine and pipelines record counters and observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code simulate.worker.exits}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code simulate.worker.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
