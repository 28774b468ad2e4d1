package ca.gc.cra.brownian.application.port;

import ca.gc.cra.brownian.domain.path.Segment;

/**
 * <strong>What:</strong> Output port for writing the filtered segments of a finished run.
 * <p><strong>Role:</strong> Sink-side port serving the simulate pipeline (CSV file by default).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist {@link Segment} entries in the order given.</li>
 *   <li>Flush buffered rows when requested.</li>
 *   <li>Dispose of persistence resources cleanly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the pipeline thread only, after all workers have joined.</p>
 * <p><strong>Observability:</strong> The pipeline counts {@code simulate.segments.persisted}.</p>
 *
 * @since 0.1.0
 */
public interface SegmentPersistencePort extends AutoCloseable {
  /**
   * Persists one segment.
   *
   * @param segment segment to write; must not be {@code null}
   * @throws Exception if the underlying store rejects the write
   */
  void persist(Segment segment) throws Exception;

  /**
   * Flushes buffered records to durable storage.
   *
   * @throws Exception if flushing fails
   */
  default void flush() throws Exception {}

  /**
   * Closes the persistence resource.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
