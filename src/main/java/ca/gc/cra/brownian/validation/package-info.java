/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid domain bounds, pool sizes, and file targets before the
 * simulation engine starts any worker thread.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via
 * {@link ca.gc.cra.brownian.validation.ConfigurationException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.brownian.validation;
