package org.waabox.budman.metrics;

import java.time.Duration;

/**
 * An abstraction for recording operational metrics of Budman.
 *
 * <p>Implementations can bridge to a monitoring system such as
 * Micrometer. Use {@link NoopBudmanMetrics} when metrics are not
 * required.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface BudmanMetrics {

  /**
   * Records that every folder of a financial institution was scanned.
   *
   * @param fiKey     the financial institution key, never null
   * @param workbooks the number of workbook files found
   * @param duration  how long the scan took, never null
   */
  void institutionScanned(String fiKey, int workbooks, Duration duration);

  /**
   * Records workbooks added to the catalog.
   *
   * @param fiKey the financial institution key, never null
   * @param count the number of workbooks added
   */
  void workbooksAdded(String fiKey, int count);

  /**
   * Records a skipped financial institution or workflow folder.
   *
   * @param fiKey  the financial institution key, may be null
   * @param reason why it was skipped, never null
   */
  void folderSkipped(String fiKey, String reason);

  /**
   * Records workbook content read from the content store.
   *
   * @param workbookId the workbook id, never null
   * @param bytes      the content size
   */
  void workbookLoaded(String workbookId, long bytes);

  /**
   * Records workbook content written to the content store.
   *
   * @param workbookId the workbook id, never null
   * @param bytes      the content size
   */
  void workbookSaved(String workbookId, long bytes);
}
