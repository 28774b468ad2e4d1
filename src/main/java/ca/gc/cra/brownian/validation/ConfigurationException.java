package ca.gc.cra.brownian.validation;

/**
 * Raised when a simulation or plot setting is rejected before any work starts.
 * <p>Extends {@link IllegalArgumentException} so CLI layers treat it like any other invalid argument;
 * messages always name the offending setting and value.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message naming the rejected value.
   *
   * @param message diagnostic message
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping a parse failure.
   *
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
