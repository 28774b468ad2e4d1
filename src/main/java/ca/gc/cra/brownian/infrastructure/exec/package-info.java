/**
 * Executor helpers for simulation worker threads.
 * <p><strong>Concurrency:</strong> Pools are sized to the worker count and never queue.</p>
 */
package ca.gc.cra.brownian.infrastructure.exec;
