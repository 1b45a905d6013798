package org.waabox.budman;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets another thread ask a long running initialization to stop.
 *
 * <p>The model checks the token between financial institutions, so an
 * institution that is being scanned is always finished first.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CancellationToken {

  /** A token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken() {
    @Override
    public void cancel() {
      throw new UnsupportedOperationException(
          "The NONE token cannot be cancelled");
    }
  };

  /** Whether cancellation was requested. */
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /** Requests cancellation. */
  public void cancel() {
    cancelled.set(true);
  }

  /** Tells whether cancellation was requested.
   *
   * @return true once {@link #cancel()} was called.
   */
  public boolean isCancelled() {
    return cancelled.get();
  }
}
