package ca.gc.cra.brownian.infrastructure.time;

import ca.gc.cra.brownian.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
