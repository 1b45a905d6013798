package org.waabox.budman;

import java.util.ArrayList;
import java.util.List;

/**
 * What an initialization or rescan of a {@link BudgetDomainModel} did.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InitializationReport {

  /** The financial institutions fully processed. */
  private int institutions;

  /** The (institution, workflow, purpose) folders scanned. */
  private int folders;

  /** The distinct workflows seen across all institutions. */
  private final List<String> workflows = new ArrayList<>();

  /** The workbook files found, new or already cataloged. */
  private int workbooks;

  /** The ids added to the catalog. */
  private final List<String> addedIds = new ArrayList<>();

  /** What was skipped and why. */
  private final List<ReconciliationWarning> warnings = new ArrayList<>();

  /** Whether processing stopped because of a cancellation request. */
  private boolean cancelled;

  /** Creates an empty report. Only the model fills reports in. */
  InitializationReport() {
  }

  void institutionProcessed() {
    institutions++;
  }

  void folderScanned(final String wfKey, final int found,
      final List<String> added) {
    folders++;
    if (!workflows.contains(wfKey)) {
      workflows.add(wfKey);
    }
    workbooks += found;
    addedIds.addAll(added);
  }

  void skipped(final ReconciliationWarning warning) {
    warnings.add(warning);
  }

  void cancel() {
    cancelled = true;
  }

  /** Returns how many financial institutions were fully processed.
   *
   * @return the count.
   */
  public int institutions() {
    return institutions;
  }

  /** Returns how many distinct workflows had at least one folder scanned.
   *
   * @return the count.
   */
  public int workflows() {
    return workflows.size();
  }

  /** Returns how many workflow folders were scanned.
   *
   * @return the count.
   */
  public int folders() {
    return folders;
  }

  /** Returns how many workbook files were found.
   *
   * @return the count, including files that were already cataloged.
   */
  public int workbooks() {
    return workbooks;
  }

  /** Returns the ids added to the catalog.
   *
   * @return an immutable list, never null.
   */
  public List<String> addedIds() {
    return List.copyOf(addedIds);
  }

  /** Returns everything that was skipped, with the reason.
   *
   * @return an immutable list, never null.
   */
  public List<ReconciliationWarning> warnings() {
    return List.copyOf(warnings);
  }

  /** Tells whether processing stopped early on request.
   *
   * @return true if cancelled.
   */
  public boolean cancelled() {
    return cancelled;
  }

  /** Tells whether everything was processed without warnings.
   *
   * @return true if nothing was skipped and the run was not cancelled.
   */
  public boolean complete() {
    return warnings.isEmpty() && !cancelled;
  }

  @Override
  public String toString() {
    return "InitializationReport{institutions=" + institutions
        + ", workflows=" + workflows.size()
        + ", folders=" + folders
        + ", workbooks=" + workbooks
        + ", added=" + addedIds.size()
        + ", skipped=" + warnings.size()
        + ", cancelled=" + cancelled + "}";
  }
}
