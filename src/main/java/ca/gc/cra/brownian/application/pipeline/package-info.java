/**
 * Use cases wiring the simulation engine and the plot renderer to their ports.
 * <p><strong>Role:</strong> Application layer invoked by the CLI adapters in {@code api}.</p>
 * <p><strong>Observability:</strong> Each use case sets the MDC key {@code pipeline} while it runs.</p>
 */
package ca.gc.cra.brownian.application.pipeline;
