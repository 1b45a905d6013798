package org.waabox.budman.store;

/**
 * The working state defaults a data context starts from, and saves back.
 *
 * @param fiKey        the selected financial institution key, may be null
 * @param wfKey        the selected workflow key, may be null
 * @param purpose      the selected purpose value, may be null
 * @param workbookId   the selected workbook id, may be null
 * @param allWorkbooks whether every workbook was selected
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WorkingStateRecord(
    String fiKey,
    String wfKey,
    String purpose,
    String workbookId,
    boolean allWorkbooks
) {

  /** No defaults at all. */
  public static final WorkingStateRecord EMPTY =
      new WorkingStateRecord(null, null, null, null, false);
}
