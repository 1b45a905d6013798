package org.waabox.budman;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Purpose} and {@link WorkbookType} parsing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PurposeTest {

  @Test
  void whenParsing_givenCurrentAndLegacyValues_shouldReturnPurpose() {
    assertEquals(Purpose.INPUT, Purpose.of("input"));
    assertEquals(Purpose.WORKING, Purpose.of(" Working "));
    assertEquals(Purpose.OUTPUT, Purpose.of("wf_output"));
  }

  @Test
  void whenParsing_givenUnknownValue_shouldThrow() {
    assertThrows(ConfigurationException.class, () -> Purpose.of("all"));
    assertThrows(ConfigurationException.class, () -> Purpose.of(null));
  }

  @Test
  void whenDeterminingType_givenStemOrExtension_shouldGuess() {
    assertEquals(WorkbookType.BUDGET,
        WorkbookType.determine("2025_Budget", ".xlsx"));
    assertEquals(WorkbookType.CHECK_REGISTER,
        WorkbookType.determine("boa_check_register", ".xlsx"));
    assertEquals(WorkbookType.TRANSACTIONS,
        WorkbookType.determine("statement", ".xlsx"));
    assertEquals(WorkbookType.CHECK_REGISTER,
        WorkbookType.determine("export", ".csv"));
    assertEquals(WorkbookType.UNKNOWN,
        WorkbookType.determine("notes", ".txt"));
  }

  @Test
  void whenParsingType_givenUnknownValue_shouldReturnUnknown() {
    assertEquals(WorkbookType.BDM_STORE, WorkbookType.of("bdm_store"));
    assertEquals(WorkbookType.UNKNOWN, WorkbookType.of("spreadsheet"));
    assertEquals(WorkbookType.UNKNOWN, WorkbookType.of(null));
  }
}
