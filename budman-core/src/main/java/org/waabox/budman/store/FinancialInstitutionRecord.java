package org.waabox.budman.store;

import java.util.List;

/**
 * The stored shape of a financial institution and its cataloged workbooks.
 *
 * @param key       the unique key
 * @param name      the display name
 * @param type      the institution type, e.g. {@code bank}
 * @param folder    the folder relative to the budget root
 * @param workbooks the cataloged workbooks, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FinancialInstitutionRecord(
    String key,
    String name,
    String type,
    String folder,
    List<WorkbookRecord> workbooks
) {

  /** Compact constructor that copies the workbooks. */
  public FinancialInstitutionRecord {
    workbooks = workbooks == null ? List.of() : List.copyOf(workbooks);
  }
}
