/**
 * Adapters implementing the application ports: executors, segment storage, metrics, time and rendering.
 * <p><strong>Role:</strong> Outer ring of the hexagon; nothing in {@code domain} depends on this package.</p>
 */
package ca.gc.cra.brownian.infrastructure;
