package ca.gc.cra.brownian.application.simulation;

/**
 * Per-worker tallies returned when a worker finishes.
 *
 * @param worker zero-based worker index
 * @param segments segments appended to the sink
 * @param exits exits recorded
 * @param rejectedExits exits computed after the budget closed and therefore dropped
 * @since 0.1.0
 */
public record WorkerReport(int worker, long segments, long exits, long rejectedExits) {}
