package org.waabox.budman.context;

/**
 * The current workbook of a {@link DataContext}.
 *
 * <p>The index, id and name always describe the same workbook. A selection
 * is replaced as a whole, never field by field, so readers never see a mix
 * of two workbooks.</p>
 *
 * @param index the position in the id sorted active collection, -1 if none
 * @param id    the workbook id, null if none
 * @param name  the workbook file name, null if none
 * @param all   whether every workbook is selected
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record WorkbookSelection(int index, String id, String name,
    boolean all) {

  /** Nothing selected. */
  public static final WorkbookSelection NONE =
      new WorkbookSelection(-1, null, null, false);

  /** Every workbook selected. */
  public static final WorkbookSelection ALL =
      new WorkbookSelection(-1, null, null, true);

  /** Tells whether a single workbook is selected.
   *
   * @return true if an id is set.
   */
  public boolean isSet() {
    return id != null;
  }
}
