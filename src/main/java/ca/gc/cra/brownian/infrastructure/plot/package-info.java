/**
 * Rendering adapters for the {@code plot} pipeline.
 */
package ca.gc.cra.brownian.infrastructure.plot;
