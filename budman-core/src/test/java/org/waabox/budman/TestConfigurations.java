package org.waabox.budman;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.waabox.budman.store.ConfigurationRecord;
import org.waabox.budman.store.FinancialInstitutionRecord;
import org.waabox.budman.store.WorkflowRecord;
import org.waabox.budman.store.WorkingStateRecord;

/**
 * Configuration records and folder layouts shared by the tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TestConfigurations {

  private TestConfigurations() {
  }

  /** The categorization workflow: input data/new, working
   * data/categorized, output data/finalized.
   *
   * @return the record, never null.
   */
  public static WorkflowRecord categorization() {
    return new WorkflowRecord("categorization", "Categorization",
        map("wf_in", "data/new", "wf_working", "data/categorized",
            "wf_out", "data/finalized"),
        map("input", "wf_in", "working", "wf_working", "output", "wf_out"),
        map("wf_out", "finalized_"));
  }

  /** A record with the boa bank and the categorization workflow.
   *
   * @param root the budget root folder.
   *
   * @return the record, never null.
   */
  public static ConfigurationRecord boa(final Path root) {
    return record(root,
        List.of(new FinancialInstitutionRecord("boa", "Bank of America",
            "bank", "boa", List.of())),
        List.of(categorization()));
  }

  /** A record with the boa bank, the merrill brokerage and the
   * categorization workflow.
   *
   * @param root the budget root folder.
   *
   * @return the record, never null.
   */
  public static ConfigurationRecord boaAndMerrill(final Path root) {
    return record(root,
        List.of(new FinancialInstitutionRecord("boa", "Bank of America",
                "bank", "boa", List.of()),
            new FinancialInstitutionRecord("merrill", "Merrill Lynch",
                "brokerage", "merrill", List.of())),
        List.of(categorization()));
  }

  public static ConfigurationRecord record(final Path root,
      final List<FinancialInstitutionRecord> institutions,
      final List<WorkflowRecord> workflows) {
    return new ConfigurationRecord("test", root.toString(), institutions,
        workflows, Map.of(),
        new WorkingStateRecord("boa", "categorization", "working", null,
            false),
        null, null, null);
  }

  /** Creates files, and their folders, under a root.
   *
   * @param root the root folder.
   * @param relativeFiles the files, relative to the root.
   */
  public static void touch(final Path root, final String... relativeFiles) {
    try {
      for (final String relative : relativeFiles) {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, relative.getBytes());
      }
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Map<String, String> map(final String... pairs) {
    final Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }
}
