/**
 * Domain model for bounded random walks: the rectangle, its exit geometry, and recorded path segments.
 * <p>Types here are immutable and free of threading concerns; the simulation engine owns all
 * concurrency.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.brownian.domain;
