package org.waabox.budman;

import java.util.Locale;

/**
 * The kind of data a workbook holds.
 *
 * <p>The type is guessed at discovery time from the file name and can be
 * changed later through
 * {@link org.waabox.budman.context.DataContext#reclassify}.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum WorkbookType {

  /** A persisted configuration record. */
  BDM_STORE("bdm_store"),

  /** A configuration template. */
  BDM_CONFIG("bdm_config"),

  /** A check register export. */
  CHECK_REGISTER("check_register"),

  /** A bank or brokerage transaction export. */
  TRANSACTIONS("transactions"),

  /** A budget workbook. */
  BUDGET("budget"),

  /** Anything that could not be classified. */
  UNKNOWN("unknown");

  /** The value used in configuration records. */
  private final String value;

  WorkbookType(final String theValue) {
    value = theValue;
  }

  /** Returns the value used in configuration records.
   *
   * @return the lower case value, never null.
   */
  public String value() {
    return value;
  }

  /** Parses a workbook type from its configuration value.
   *
   * @param text the value, may be null.
   *
   * @return the matching type, or {@link #UNKNOWN} when the value is null
   * or names no type.
   */
  public static WorkbookType of(final String text) {
    if (text == null) {
      return UNKNOWN;
    }
    final String candidate = text.trim().toLowerCase(Locale.ROOT);
    for (final WorkbookType type : values()) {
      if (type.value.equals(candidate)) {
        return type;
      }
    }
    return UNKNOWN;
  }

  /** Guesses the type of a workbook from its file name.
   *
   * <p>The first type whose value appears in the lower cased stem wins.
   * Otherwise the extension decides: spreadsheets are transactions, csv
   * files are check registers and json files are stores.</p>
   *
   * @param stem the file name without extension, cannot be null.
   *
   * @param extension the extension including the dot, cannot be null.
   *
   * @return the guessed type, never null.
   */
  public static WorkbookType determine(final String stem,
      final String extension) {
    final String lowerStem = stem.toLowerCase(Locale.ROOT);
    for (final WorkbookType type : values()) {
      if (type != UNKNOWN && lowerStem.contains(type.value)) {
        return type;
      }
    }
    switch (extension.toLowerCase(Locale.ROOT)) {
      case ".xlsx":
        return TRANSACTIONS;
      case ".csv":
        return CHECK_REGISTER;
      case ".json":
      case ".jsonc":
        return BDM_STORE;
      default:
        return UNKNOWN;
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
