package ca.gc.cra.brownian.application.port;

/**
 * Port supplying wall-clock timestamps used to time simulation runs.
 * <p>Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.brownian.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
