/**
 * Time adapters implementing {@link ca.gc.cra.brownian.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 */
package ca.gc.cra.brownian.infrastructure.time;
