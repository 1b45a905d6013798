package org.waabox.budman.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The persisted configuration of a budget: where it lives, its financial
 * institutions and workflows, global options and the working state
 * defaults.
 *
 * <p>Records are the raw stored shape; their content is validated when a
 * {@link org.waabox.budman.BudgetDomainModel} is built from them. Null
 * collections become empty ones.</p>
 *
 * @param id               the record id, may be null
 * @param rootFolder       the budget root folder, may start with
 *                         {@code ~}
 * @param institutions     the financial institutions, never null
 * @param workflows        the workflows, never null
 * @param options          global options, never null
 * @param workingState     the working state defaults, never null
 * @param createdDate      when the record was created, ISO-8601, may be
 *                         null
 * @param lastModifiedDate when the record was last written, ISO-8601, may
 *                         be null
 * @param lastModifiedBy   who last wrote the record, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConfigurationRecord(
    String id,
    String rootFolder,
    List<FinancialInstitutionRecord> institutions,
    List<WorkflowRecord> workflows,
    Map<String, String> options,
    WorkingStateRecord workingState,
    String createdDate,
    String lastModifiedDate,
    String lastModifiedBy
) {

  /** The option listing the recognized workbook extensions. */
  public static final String OPTION_WORKBOOK_EXTENSIONS =
      "workbook_extensions";

  /** Compact constructor that copies the collections. */
  public ConfigurationRecord {
    institutions = institutions == null ? List.of()
        : List.copyOf(institutions);
    workflows = workflows == null ? List.of() : List.copyOf(workflows);
    options = options == null ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    workingState = workingState == null ? WorkingStateRecord.EMPTY
        : workingState;
  }

  /** Returns a copy of this record with other institutions.
   *
   * @param newInstitutions the institutions, may be null.
   *
   * @return the new record, never null.
   */
  public ConfigurationRecord withInstitutions(
      final List<FinancialInstitutionRecord> newInstitutions) {
    return new ConfigurationRecord(id, rootFolder, newInstitutions,
        workflows, options, workingState, createdDate, lastModifiedDate,
        lastModifiedBy);
  }

  /** Returns a copy of this record with another root folder.
   *
   * @param newRootFolder the root folder, may be null.
   *
   * @return the new record, never null.
   */
  public ConfigurationRecord withRootFolder(final String newRootFolder) {
    return new ConfigurationRecord(id, newRootFolder, institutions,
        workflows, options, workingState, createdDate, lastModifiedDate,
        lastModifiedBy);
  }

  /** Returns a copy of this record with other working state defaults.
   *
   * @param newWorkingState the defaults, may be null.
   *
   * @return the new record, never null.
   */
  public ConfigurationRecord withWorkingState(
      final WorkingStateRecord newWorkingState) {
    return new ConfigurationRecord(id, rootFolder, institutions, workflows,
        options, newWorkingState, createdDate, lastModifiedDate,
        lastModifiedBy);
  }

  /** Returns a copy of this record stamped as modified.
   *
   * @param date when it was modified, ISO-8601, may be null.
   * @param by who modified it, may be null.
   *
   * @return the new record, never null.
   */
  public ConfigurationRecord modified(final String date, final String by) {
    return new ConfigurationRecord(id, rootFolder, institutions, workflows,
        options, workingState, createdDate == null ? date : createdDate,
        date, by);
  }
}
