package org.waabox.budman;

import java.util.Objects;

/**
 * Builds workbook ids.
 *
 * <p>An id is the financial institution key, the workflow key, the purpose,
 * the relative folder and the file name joined by {@value #SEPARATOR}. The
 * same physical file seen through the same configuration always gets the
 * same id, and files in different contexts always get different ones.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WorkbookId {

  /** The separator between id parts. */
  public static final String SEPARATOR = "|";

  /** Private constructor to prevent instantiation. */
  private WorkbookId() {
    throw new UnsupportedOperationException("Utility class");
  }

  /** Builds a workbook id.
   *
   * @param fiKey the financial institution key, cannot be null.
   * @param wfKey the workflow key, cannot be null.
   * @param purpose the purpose, cannot be null.
   * @param folder the folder relative to the institution, cannot be null.
   * @param filename the file name including extension, cannot be null.
   *
   * @return the id, never null.
   */
  public static String of(final String fiKey, final String wfKey,
      final Purpose purpose, final String folder, final String filename) {
    Objects.requireNonNull(fiKey, "fiKey must not be null");
    Objects.requireNonNull(wfKey, "wfKey must not be null");
    Objects.requireNonNull(purpose, "purpose must not be null");
    Objects.requireNonNull(folder, "folder must not be null");
    Objects.requireNonNull(filename, "filename must not be null");
    return String.join(SEPARATOR, fiKey, wfKey, purpose.value(), folder,
        filename);
  }
}
