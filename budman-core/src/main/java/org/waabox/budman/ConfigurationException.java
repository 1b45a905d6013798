package org.waabox.budman;

/**
 * Thrown when the configuration record is malformed or incomplete.
 *
 * <p>Configuration problems are fatal: once the shape of the configuration
 * is wrong nothing built from it can be trusted, so model construction and
 * initialization abort.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigurationException extends BudmanException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ConfigurationException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ConfigurationException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
