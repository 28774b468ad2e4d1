package ca.gc.cra.brownian.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by BROWNIAN CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects invalid domain bounds, step sizes, and pool sizes before any worker thread
 * is started, so a run either launches fully configured or not at all.
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration records and the simulation engine.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive integral bounds declared in configuration schemas.</li>
 *   <li>Enforce strictly positive, finite floating point values.</li>
 *   <li>Parse raw CLI strings with messages that name the offending key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link ConfigurationException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws ConfigurationException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new ConfigurationException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws ConfigurationException if {@code value} is NaN, infinite, zero, or negative
   */
  public static double requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0) {
      throw new ConfigurationException(label(name) + " must be > 0 (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @return the validated value
   * @throws ConfigurationException if {@code value} is NaN or infinite
   */
  public static double requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new ConfigurationException(label(name) + " must be a finite number (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal value supplied on the command line or in YAML.
   *
   * @param name key the value was read from
   * @param raw raw text; surrounding whitespace is ignored
   * @return parsed value
   * @throws ConfigurationException if the text is blank or not a number
   */
  public static double parseDouble(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(label(name) + " must be a number (was '" + trimmed + "')", ex);
    }
  }

  /**
   * Parses an integral value supplied on the command line or in YAML.
   *
   * @param name key the value was read from
   * @param raw raw text; surrounding whitespace is ignored
   * @return parsed value
   * @throws ConfigurationException if the text is blank or not an integer
   */
  public static long parseLong(String name, String raw) {
    String trimmed = Strings.requireNonBlank(name, raw);
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException ex) {
      throw new ConfigurationException(label(name) + " must be an integer (was '" + trimmed + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
