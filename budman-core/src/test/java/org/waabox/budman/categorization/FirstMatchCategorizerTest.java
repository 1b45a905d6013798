package org.waabox.budman.categorization;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link FirstMatchCategorizer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FirstMatchCategorizerTest {

  private final Categorizer categorizer = new FirstMatchCategorizer(List.of(
      CategoryRule.of("whole ?foods|trader joe", "Groceries"),
      CategoryRule.of("shell|chevron", "Fuel"),
      CategoryRule.of("foods", "Dining")));

  @Test
  void whenCategorizing_givenMatchingDescription_shouldUseFirstRule() {
    assertEquals("Groceries", categorizer.categorize("WHOLEFOODS #123"));
    assertEquals("Fuel", categorizer.categorize("Chevron 0042 Austin TX"));
    assertEquals("Dining", categorizer.categorize("Street Foods Cart"));
  }

  @Test
  void whenCategorizing_givenNoMatch_shouldUseFallback() {
    assertEquals(FirstMatchCategorizer.DEFAULT_CATEGORY,
        categorizer.categorize("Payroll deposit"));
    assertEquals(FirstMatchCategorizer.DEFAULT_CATEGORY,
        categorizer.categorize(" "));
    assertEquals("Uncategorized", new FirstMatchCategorizer(List.of(),
        "Uncategorized").categorize("anything"));
  }
}
