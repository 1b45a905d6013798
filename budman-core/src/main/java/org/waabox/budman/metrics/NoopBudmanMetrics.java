package org.waabox.budman.metrics;

import java.time.Duration;

/**
 * A {@link BudmanMetrics} that records nothing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NoopBudmanMetrics implements BudmanMetrics {

  /** The shared instance. */
  public static final NoopBudmanMetrics INSTANCE = new NoopBudmanMetrics();

  private NoopBudmanMetrics() {
  }

  @Override
  public void institutionScanned(final String fiKey, final int workbooks,
      final Duration duration) {
  }

  @Override
  public void workbooksAdded(final String fiKey, final int count) {
  }

  @Override
  public void folderSkipped(final String fiKey, final String reason) {
  }

  @Override
  public void workbookLoaded(final String workbookId, final long bytes) {
  }

  @Override
  public void workbookSaved(final String workbookId, final long bytes) {
  }
}
