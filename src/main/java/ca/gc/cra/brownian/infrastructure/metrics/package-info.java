/**
 * Metrics adapters that bridge {@link ca.gc.cra.brownian.application.port.MetricsPort} to OpenTelemetry or to a
 * no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and accept updates from worker threads.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code simulate.*} and {@code plot.*} namespaces.</p>
 */
package ca.gc.cra.brownian.infrastructure.metrics;
