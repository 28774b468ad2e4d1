/**
 * Parallel random-walk engine.
 * <p>{@link ca.gc.cra.brownian.application.simulation.SimulationEngine} starts one
 * {@code SimulationWorker} per thread; the workers share only a
 * {@link ca.gc.cra.brownian.application.simulation.GlobalExitBudget}, a
 * {@link ca.gc.cra.brownian.application.simulation.PathIdAllocator} and a segment sink.</p>
 */
package ca.gc.cra.brownian.application.simulation;
