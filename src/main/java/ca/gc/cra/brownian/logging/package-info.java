/**
 * Logging helpers for BROWNIAN CLI entry points.
 * <p>Logs are tagged through SLF4J MDC with {@code pipeline} ({@code simulate} or {@code plot}) and, on worker
 * threads, {@code worker}; {@code logback.xml} prints both.</p>
 */
package ca.gc.cra.brownian.logging;
