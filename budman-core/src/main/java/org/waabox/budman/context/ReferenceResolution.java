package org.waabox.budman.context;

import java.util.Optional;

import org.waabox.budman.Workbook;

/**
 * The outcome of resolving a {@link WorkbookReference}.
 *
 * <p>A resolution is one of three things: every workbook, one workbook at
 * a position of the id sorted active collection, or nothing.</p>
 *
 * @param all      whether every workbook was referenced
 * @param index    the position of the workbook, -1 when there is none
 * @param workbook the workbook, null when there is none
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReferenceResolution(boolean all, int index, Workbook workbook) {

  /** The resolution of a reference that matched nothing. */
  private static final ReferenceResolution NOT_FOUND =
      new ReferenceResolution(false, -1, null);

  /** The resolution of the all sentinel. */
  private static final ReferenceResolution ALL =
      new ReferenceResolution(true, -1, null);

  public static ReferenceResolution notFound() {
    return NOT_FOUND;
  }

  public static ReferenceResolution everything() {
    return ALL;
  }

  /** Creates the resolution of a single workbook.
   *
   * @param index the position in the id sorted active collection.
   * @param workbook the workbook, cannot be null.
   *
   * @return the resolution, never null.
   */
  public static ReferenceResolution of(final int index,
      final Workbook workbook) {
    return new ReferenceResolution(false, index, workbook);
  }

  /** Tells whether the reference matched anything.
   *
   * @return true for the all sentinel or a single workbook.
   */
  public boolean found() {
    return all || workbook != null;
  }

  /** Returns the single workbook matched.
   *
   * @return the workbook, empty for the all sentinel or no match.
   */
  public Optional<Workbook> single() {
    return Optional.ofNullable(workbook);
  }
}
