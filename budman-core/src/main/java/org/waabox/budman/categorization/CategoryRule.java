package org.waabox.budman.categorization;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A compiled pattern and the category a matching description belongs to.
 *
 * @param pattern  the pattern, searched anywhere in the description, never
 *                 null
 * @param category the category, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CategoryRule(Pattern pattern, String category) {

  /**
   * Creates a rule, validating its arguments.
   *
   * @throws NullPointerException if any argument is null
   */
  public CategoryRule {
    Objects.requireNonNull(pattern, "pattern must not be null");
    Objects.requireNonNull(category, "category must not be null");
  }

  /** Compiles a case insensitive rule.
   *
   * @param regex the regular expression, cannot be null.
   * @param category the category, cannot be null.
   *
   * @return the rule, never null.
   */
  public static CategoryRule of(final String regex, final String category) {
    Objects.requireNonNull(regex, "regex must not be null");
    return new CategoryRule(
        Pattern.compile(regex, Pattern.CASE_INSENSITIVE), category);
  }

  /** Tells whether the rule applies to a description.
   *
   * @param description the description, cannot be null.
   *
   * @return true if the pattern is found in the description.
   */
  public boolean matches(final String description) {
    return pattern.matcher(description).find();
  }
}
