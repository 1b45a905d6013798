package org.waabox.budman;

import java.util.Locale;

/**
 * The role a folder, and every workbook found in it, plays relative to a
 * workflow.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Purpose {

  /** Workbooks the workflow consumes. */
  INPUT("input"),

  /** Workbooks the workflow edits in place. */
  WORKING("working"),

  /** Workbooks the workflow produces. */
  OUTPUT("output");

  /** The prefix legacy configuration records put in front of the value. */
  private static final String LEGACY_PREFIX = "wf_";

  /** The value used in configuration records and workbook ids. */
  private final String value;

  Purpose(final String theValue) {
    value = theValue;
  }

  /** Returns the value used in configuration records and workbook ids.
   *
   * @return the lower case value, never null.
   */
  public String value() {
    return value;
  }

  /** Parses a purpose from its configuration value.
   *
   * <p>Matching ignores case and accepts the legacy {@code wf_input},
   * {@code wf_working} and {@code wf_output} spellings.</p>
   *
   * @param text the value to parse, cannot be null.
   *
   * @return the purpose, never null.
   *
   * @throws ConfigurationException if the text names no purpose.
   */
  public static Purpose of(final String text) {
    if (text == null) {
      throw new ConfigurationException("Purpose must not be null");
    }
    String candidate = text.trim().toLowerCase(Locale.ROOT);
    if (candidate.startsWith(LEGACY_PREFIX)) {
      candidate = candidate.substring(LEGACY_PREFIX.length());
    }
    for (final Purpose purpose : values()) {
      if (purpose.value.equals(candidate)) {
        return purpose;
      }
    }
    throw new ConfigurationException("Unknown purpose: '" + text + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
