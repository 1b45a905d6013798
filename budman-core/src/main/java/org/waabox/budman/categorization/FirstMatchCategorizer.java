package org.waabox.budman.categorization;

import java.util.List;
import java.util.Objects;

/**
 * A {@link Categorizer} over an ordered list of rules: the first rule that
 * matches decides, and descriptions no rule matches get the fallback
 * category.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FirstMatchCategorizer implements Categorizer {

  /** The category of descriptions no rule matches. */
  public static final String DEFAULT_CATEGORY = "Other";

  /** The rules, in priority order. */
  private final List<CategoryRule> rules;

  /** The category of descriptions no rule matches. */
  private final String fallback;

  /** Creates a categorizer falling back to {@link #DEFAULT_CATEGORY}.
   *
   * @param theRules the rules in priority order, cannot be null.
   */
  public FirstMatchCategorizer(final List<CategoryRule> theRules) {
    this(theRules, DEFAULT_CATEGORY);
  }

  /** Creates a categorizer.
   *
   * @param theRules the rules in priority order, cannot be null.
   * @param theFallback the category of unmatched descriptions, cannot be
   * null.
   */
  public FirstMatchCategorizer(final List<CategoryRule> theRules,
      final String theFallback) {
    rules = List.copyOf(Objects.requireNonNull(theRules,
        "rules must not be null"));
    fallback = Objects.requireNonNull(theFallback,
        "fallback must not be null");
  }

  @Override
  public String categorize(final String description) {
    if (description == null || description.isBlank()) {
      return fallback;
    }
    for (final CategoryRule rule : rules) {
      if (rule.matches(description)) {
        return rule.category();
      }
    }
    return fallback;
  }
}
