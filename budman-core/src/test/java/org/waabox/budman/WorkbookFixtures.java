package org.waabox.budman;

import java.nio.file.Path;

/**
 * Builds workbooks for tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class WorkbookFixtures {

  /** The folder role used by {@link #workbook(Path, String)}. */
  public static final FolderRole NEW = new FolderRole("wf_in", "data/new",
      null);

  private WorkbookFixtures() {
  }

  /** Creates an input workbook of boa/categorization.
   *
   * @param folder the folder the file lives in.
   * @param name the file name.
   *
   * @return the workbook, never null.
   */
  public static Workbook workbook(final Path folder, final String name) {
    return Workbook.builder()
        .name(name)
        .url(folder.resolve(name).toUri())
        .institution("boa")
        .workflow("categorization")
        .purpose(Purpose.INPUT)
        .folderRole(NEW)
        .build();
  }
}
