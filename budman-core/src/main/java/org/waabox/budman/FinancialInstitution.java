package org.waabox.budman;

import java.util.Objects;

/**
 * A configured source of transaction workbooks: a bank, a brokerage, an
 * organization or a person.
 *
 * <p>Each institution owns the collection of every workbook found under
 * its folder, across all workflows and purposes.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FinancialInstitution {

  /** The unique key, never null. */
  private final String key;

  /** The display name, never null. */
  private final String name;

  /** The institution type, never null. */
  private final InstitutionType type;

  /** The folder, relative to the budget root, never null. */
  private final String folder;

  /** The workbooks of this institution, never null. */
  private final WorkbookCollection workbooks = new WorkbookCollection();

  /** Creates a new financial institution.
   *
   * @param theKey the unique key, cannot be null.
   * @param theName the display name, cannot be null.
   * @param theType the type, cannot be null.
   * @param theFolder the folder relative to the budget root, cannot be null.
   */
  public FinancialInstitution(final String theKey, final String theName,
      final InstitutionType theType, final String theFolder) {
    key = Objects.requireNonNull(theKey, "key must not be null");
    name = Objects.requireNonNull(theName, "name must not be null");
    type = Objects.requireNonNull(theType, "type must not be null");
    folder = Objects.requireNonNull(theFolder, "folder must not be null");
  }

  /** Returns the unique key.
   *
   * @return the key, never null.
   */
  public String key() {
    return key;
  }

  /** Returns the display name.
   *
   * @return the name, never null.
   */
  public String name() {
    return name;
  }

  /** Returns the institution type.
   *
   * @return the type, never null.
   */
  public InstitutionType type() {
    return type;
  }

  /** Returns the folder relative to the budget root.
   *
   * @return the folder, never null.
   */
  public String folder() {
    return folder;
  }

  /** Returns the workbooks cataloged for this institution.
   *
   * @return the live collection, never null.
   */
  public WorkbookCollection workbooks() {
    return workbooks;
  }

  @Override
  public String toString() {
    return "FinancialInstitution{key='" + key + "', folder='" + folder
        + "', workbooks=" + workbooks.size() + "}";
  }
}
