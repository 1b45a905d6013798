package org.waabox.budman;

/**
 * Base exception for all Budman errors.
 *
 * <p>Budman errors are unchecked. Configuration shape problems, missing
 * folders or workbooks and unknown keys each have their own subclass so
 * callers can react to them individually, or catch this type to handle
 * any of them.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BudmanException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public BudmanException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public BudmanException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
