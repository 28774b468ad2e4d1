package ca.gc.cra.brownian.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code brownian} command-line tools.
 * <p><strong>Why:</strong> Lets scripts distinguish bad input from I/O and simulation failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Reading or writing a file failed. */
  IO_ERROR(3),
  /** The simulation or rendering failed at runtime. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
