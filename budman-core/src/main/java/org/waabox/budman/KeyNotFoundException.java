package org.waabox.budman;

/**
 * Thrown when a lookup references a financial institution or workflow key
 * that is not configured, or when the {@code all} sentinel is used where a
 * concrete key is required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KeyNotFoundException extends BudmanException {

  private static final long serialVersionUID = 1L;

  /** The kind of key that was looked up, e.g. "financial institution". */
  private final String kind;

  /** The key that could not be resolved. */
  private final String key;

  /** Creates a new exception.
   *
   * @param kind the kind of key that was looked up, cannot be null.
   * @param key the key that could not be resolved, may be null.
   */
  public KeyNotFoundException(final String kind, final String key) {
    super("Unknown " + kind + " key: '" + key + "'");
    this.kind = kind;
    this.key = key;
  }

  /** Returns the kind of key that was looked up.
   *
   * @return the key kind, never null.
   */
  public String kind() {
    return kind;
  }

  /** Returns the key that could not be resolved.
   *
   * @return the key, may be null.
   */
  public String key() {
    return key;
  }
}
