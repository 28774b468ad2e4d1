/**
 * Ports the simulation engine and pipelines depend on: segment sinks and sources, persistence, rendering,
 * metrics, and time.
 * <p>Adapters live under {@code ca.gc.cra.brownian.infrastructure}; the composition root wires them.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brownian.application.port;
