package org.waabox.budman;

/**
 * Thrown when a required folder, workbook or piece of workbook content is
 * absent.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotFoundException extends BudmanException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NotFoundException(final String message) {
    super(message);
  }
}
