/**
 * CLI entry points for the {@code simulate} and {@code plot} workflows.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes use cases.</p>
 * <p><strong>Concurrency:</strong> CLI commands run single-threaded; the simulation engine spawns its own workers.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths and refuses to replace existing output files unless
 * {@code --allow-overwrite} is given.</p>
 */
package ca.gc.cra.brownian.api;
