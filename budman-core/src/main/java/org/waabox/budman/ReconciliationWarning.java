package org.waabox.budman;

import java.util.Objects;

/**
 * A non fatal problem met while initializing or rescanning the model.
 *
 * <p>The workflow key and purpose are null when the whole financial
 * institution was skipped, and the financial institution key is null when
 * the problem is about the root folder.</p>
 *
 * @param fiKey   the financial institution key, may be null
 * @param wfKey   the workflow key, may be null
 * @param purpose the purpose, may be null
 * @param reason  what went wrong, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReconciliationWarning(String fiKey, String wfKey,
    Purpose purpose, String reason) {

  /**
   * Creates a warning, validating its arguments.
   *
   * @throws NullPointerException if reason is null
   */
  public ReconciliationWarning {
    Objects.requireNonNull(reason, "reason must not be null");
  }

  @Override
  public String toString() {
    return "(" + fiKey + ", " + wfKey + ", " + purpose + "): " + reason;
  }
}
