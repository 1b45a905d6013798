package org.waabox.budman;

import java.util.Objects;

/**
 * A folder a workflow reads from or writes to, relative to the folder of a
 * financial institution.
 *
 * @param id     the folder role id the workflow declares, never null
 * @param folder the relative folder, e.g. {@code data/new}, never null
 * @param prefix the file name prefix for workbooks the workflow writes
 *               there, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FolderRole(String id, String folder, String prefix) {

  /**
   * Creates a folder role, validating its arguments.
   *
   * @throws NullPointerException if id or folder is null
   */
  public FolderRole {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(folder, "folder must not be null");
  }

  /** Tells whether workbooks written to this folder get a prefix.
   *
   * @return true if a non blank prefix is set.
   */
  public boolean hasPrefix() {
    return prefix != null && !prefix.isBlank();
  }
}
