/**
 * Segment storage adapters: the in-memory sink shared by simulation workers and the CSV file format.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.brownian.infrastructure.persistence.LockingSegmentSink} is
 * thread-safe; the CSV adapters are used from a single thread.</p>
 */
package ca.gc.cra.brownian.infrastructure.persistence;
