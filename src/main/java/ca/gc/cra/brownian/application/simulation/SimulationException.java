package ca.gc.cra.brownian.application.simulation;

/**
 * Raised when a simulation worker fails for a reason other than an unclassifiable exit point.
 *
 * @since 0.1.0
 */
public final class SimulationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception wrapping the worker's failure.
   *
   * @param message human-readable summary
   * @param cause failure raised inside the worker
   */
  public SimulationException(String message, Throwable cause) {
    super(message, cause);
  }
}
