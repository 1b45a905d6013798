package org.waabox.budman;

import java.util.Locale;

/**
 * The kind of a financial institution.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum InstitutionType {

  BANK,

  BROKERAGE,

  ORGANIZATION,

  PERSON;

  /** Parses an institution type from its configuration value.
   *
   * @param text the value, cannot be null.
   *
   * @return the type, never null.
   *
   * @throws ConfigurationException if the text names no type.
   */
  public static InstitutionType of(final String text) {
    if (text == null || text.isBlank()) {
      throw new ConfigurationException(
          "Financial institution type must not be blank");
    }
    try {
      return valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      throw new ConfigurationException(
          "Unknown financial institution type: '" + text + "'");
    }
  }

  /** Returns the value used in configuration records.
   *
   * @return the lower case name, never null.
   */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
