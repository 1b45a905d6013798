package org.waabox.budman.store;

/**
 * The stored shape of a cataloged workbook. The owning financial
 * institution is implied by the record that contains it, and the id is
 * derived again on load.
 *
 * @param name       the file name including the extension
 * @param url        the storage url
 * @param workflow   the workflow key
 * @param purpose    the purpose value
 * @param folderRole the folder role id
 * @param folder     the folder relative to the institution
 * @param type       the workbook type value
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WorkbookRecord(
    String name,
    String url,
    String workflow,
    String purpose,
    String folderRole,
    String folder,
    String type
) {
}
